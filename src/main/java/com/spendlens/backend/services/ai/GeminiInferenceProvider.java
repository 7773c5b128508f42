package com.spendlens.backend.services.ai;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spendlens.backend.config.InferenceProperties;
import com.spendlens.backend.exceptions.ProviderException;

import lombok.extern.slf4j.Slf4j;

/**
 * Google Gemini via the {@code generateContent} REST endpoint.
 */
@Slf4j
@Component
public class GeminiInferenceProvider implements InferenceProvider {

    static final String NAME = "gemini";

    private final InferenceProperties.Provider settings;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public GeminiInferenceProvider(InferenceProperties inferenceProperties, ObjectProvider<RestTemplate> restTemplateProvider) {
        this.settings = inferenceProperties.getGemini();
        this.restTemplate = restTemplateProvider != null ? restTemplateProvider.getIfAvailable() : null;
    }

    // Construtor auxiliar para testes unitários (sem Spring).
    GeminiInferenceProvider(InferenceProperties.Provider settings, RestTemplate restTemplate) {
        this.settings = settings;
        this.restTemplate = restTemplate;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return settings != null && settings.isConfigured() && restTemplate != null;
    }

    @Override
    public String infer(InferenceRequest request) {
        if (!isConfigured()) {
            throw new ProviderException(NAME, "Provider is not configured");
        }

        String url = endpoint();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", settings.getApiKey().trim());

        String body;
        try {
            body = objectMapper.writeValueAsString(buildBody(request));
        } catch (JsonProcessingException e) {
            throw new ProviderException(NAME, "Failed to serialize request", e);
        }

        long start = System.currentTimeMillis();
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new ProviderException(NAME, "Rate limited (HTTP 429)", e);
            }
            throw new ProviderException(NAME, "HTTP " + e.getStatusCode().value() + " from generateContent", e);
        } catch (RestClientException e) {
            throw new ProviderException(NAME, "Transport error: " + e.getMessage(), e);
        }

        String text = extractText(response.getBody());
        log.debug("[Gemini] generateContent ok (model={} chars={} elapsedMs={})",
                settings.getModel(), text.length(), System.currentTimeMillis() - start);
        return text;
    }

    private String endpoint() {
        String base = settings.getBaseUrl() == null ? "" : settings.getBaseUrl().trim();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base + "/models/" + settings.getModel() + ":generateContent";
    }

    private Map<String, Object> buildBody(InferenceRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", request.prompt())))));
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", request.systemPrompt()))));
        }
        Map<String, Object> generation = new LinkedHashMap<>();
        generation.put("temperature", settings.getTemperature());
        generation.put("maxOutputTokens", request.maxOutputTokens());
        body.put("generationConfig", generation);
        return body;
    }

    private String extractText(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ProviderException(NAME, "Empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProviderException(NAME, "Response is not JSON", e);
        }

        StringBuilder sb = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            String t = part.path("text").asText("");
            if (!t.isEmpty()) sb.append(t);
        }
        if (sb.length() == 0) {
            String finish = root.path("candidates").path(0).path("finishReason").asText("none");
            throw new ProviderException(NAME, "No text in response (finishReason=" + finish + ")");
        }
        return sb.toString();
    }
}
