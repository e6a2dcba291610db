package com.example.musicrecommend.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musicRecommendOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Music Recommend API")
                        .description("Session, contextual and history based song recommendations")
                        .version("v1")
                        .contact(new Contact().name("music-recommend")));
    }
}
