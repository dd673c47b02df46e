package com.jdc.foodgram.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String TOKEN_SCHEME = "tokenAuth";

    @Bean
    public OpenAPI foodgramOpenAPI() {
        Info info = new Info()
                .title("Foodgram API")
                .version("1.0.0")
                .description("레시피 공유, 구독, 즐겨찾기, 장바구니 재료 목록 API");

        // Authorization: Token <jwt>
        SecurityScheme tokenScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("Authorization")
                .description("Token <발급받은 토큰>");

        return new OpenAPI()
                .info(info)
                .components(new Components().addSecuritySchemes(TOKEN_SCHEME, tokenScheme))
                .addSecurityItem(new SecurityRequirement().addList(TOKEN_SCHEME));
    }
}
