package com.spendlens.backend.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * External inference providers, listed in priority order.
 *
 * Usage in application.properties:
 * spendlens.inference.provider-priority=gemini,deepseek
 * spendlens.inference.gemini.api-key=${GEMINI_API_KEY:}
 * spendlens.inference.deepseek.api-key=${DEEPSEEK_API_KEY:}
 */
@Data
@Component
@ConfigurationProperties(prefix = "spendlens.inference")
public class InferenceProperties {

    private List<String> providerPriority = new ArrayList<>(List.of("gemini", "deepseek"));

    private Provider gemini = new Provider("gemini-1.5-flash", "https://generativelanguage.googleapis.com/v1beta");

    private Provider deepseek = new Provider("deepseek-chat", "https://api.deepseek.com");

    @Data
    public static class Provider {
        private String apiKey;
        private String model;
        private String baseUrl;
        private double temperature = 0.1;
        private int timeoutSeconds = 60;

        public Provider() {
        }

        public Provider(String model, String baseUrl) {
            this.model = model;
            this.baseUrl = baseUrl;
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
