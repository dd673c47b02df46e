package com.jdc.foodgram.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.web.config.EnableSpringDataWebSupport;
import org.springframework.web.filter.ForwardedHeaderFilter;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import static org.springframework.data.web.config.EnableSpringDataWebSupport.PageSerializationMode.VIA_DTO;

@Configuration
@EnableSpringDataWebSupport(pageSerializationMode = VIA_DTO)
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final StorageProperties storageProperties;

    /**
     * 로컬에 저장된 레시피/아바타 이미지를 그대로 내려준다.
     */
    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String prefix = storageProperties.getUrlPrefix();
        String pattern = (prefix.endsWith("/") ? prefix : prefix + "/") + "**";
        registry.addResourceHandler(pattern)
                .addResourceLocations(storageProperties.rootPath().toUri().toString());
    }

    /**
     * X-Forwarded-* 헤더를 HttpServletRequest에 반영해 줍니다.
     */
    @Bean
    public ForwardedHeaderFilter forwardedHeaderFilter() {
        return new ForwardedHeaderFilter();
    }
}
