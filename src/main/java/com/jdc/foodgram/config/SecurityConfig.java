package com.jdc.foodgram.config;

import com.jdc.foodgram.jwt.JwtAuthenticationFilter;
import com.jdc.foodgram.security.CustomAccessDeniedHandler;
import com.jdc.foodgram.security.CustomAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.util.Arrays;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtAuthenticationFilter jwtFilter;
    private final CustomAuthenticationEntryPoint entryPoint;
    private final CustomAccessDeniedHandler accessDeniedHandler;
    private final Environment env;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS));

        // 로컬: H2 콘솔 허용
        if (Arrays.asList(env.getActiveProfiles()).contains("local")) {
            http
                    .authorizeHttpRequests(auth -> auth.requestMatchers("/h2-console/**").permitAll())
                    .headers(h -> h.frameOptions(frame -> frame.disable()));
        }

        http.authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(
                        "/v3/api-docs/**",
                        "/swagger-ui/**",
                        "/swagger-ui.html",
                        "/media/**",
                        "/s/*",
                        "/error"
                ).permitAll()

                // 1) 공개 엔드포인트
                .requestMatchers(HttpMethod.POST, "/api/users", "/api/auth/token/login").permitAll()
                .requestMatchers(HttpMethod.GET,
                        "/api/tags", "/api/tags/*",
                        "/api/ingredients", "/api/ingredients/*",
                        "/api/recipes", "/api/recipes/*", "/api/recipes/*/get-link",
                        "/api/users"
                ).permitAll()

                // 2) 인증 필요 GET (/api/users/* 보다 먼저 매칭되어야 함)
                .requestMatchers(HttpMethod.GET,
                        "/api/users/me",
                        "/api/users/subscriptions",
                        "/api/recipes/shopping_cart",
                        "/api/recipes/download_shopping_cart"
                ).authenticated()
                .requestMatchers(HttpMethod.GET, "/api/users/*").permitAll()

                // 3) 관리자용
                .requestMatchers(HttpMethod.DELETE, "/api/users/{id:\\d+}").hasRole("ADMIN")

                // 4) 나머지 /api 는 모두 인증 필요
                .requestMatchers("/api/**").authenticated()
                .anyRequest().permitAll()
        );

        http.addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class);
        http.exceptionHandling(e -> e
                .authenticationEntryPoint(entryPoint)
                .accessDeniedHandler(accessDeniedHandler));

        return http.build();
    }

    /**
     * 필터는 시큐리티 체인 안에서만 동작하도록 서블릿 자동 등록을 끈다.
     */
    @Bean
    public FilterRegistrationBean<JwtAuthenticationFilter> jwtFilterRegistration(JwtAuthenticationFilter filter) {
        FilterRegistrationBean<JwtAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
