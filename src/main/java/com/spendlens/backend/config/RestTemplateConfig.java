package com.spendlens.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate used by HTTP-based inference providers.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, InferenceProperties inferenceProperties) {
        int timeoutSeconds = inferenceProperties.getGemini() != null
                ? inferenceProperties.getGemini().getTimeoutSeconds()
                : 60;
        if (timeoutSeconds <= 0) timeoutSeconds = 60;

        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
