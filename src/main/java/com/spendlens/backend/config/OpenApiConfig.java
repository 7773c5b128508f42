package com.spendlens.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI spendlensOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SpendLens API")
                        .description("Transaction classification, P2P detection and statement extraction.")
                        .version("v1"));
    }
}
