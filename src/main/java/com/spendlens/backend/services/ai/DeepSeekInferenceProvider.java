package com.spendlens.backend.services.ai;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.RateLimitException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.spendlens.backend.config.InferenceProperties;
import com.spendlens.backend.exceptions.ProviderException;

import lombok.extern.slf4j.Slf4j;

/**
 * DeepSeek through its OpenAI-compatible chat completions API.
 */
@Slf4j
@Component
public class DeepSeekInferenceProvider implements InferenceProvider {

    static final String NAME = "deepseek";

    private final InferenceProperties.Provider settings;

    private volatile OpenAIClient client;

    @Autowired
    public DeepSeekInferenceProvider(InferenceProperties inferenceProperties) {
        this.settings = inferenceProperties.getDeepseek();
    }

    // Construtor auxiliar para testes unitários (client já montado).
    DeepSeekInferenceProvider(InferenceProperties.Provider settings, OpenAIClient client) {
        this.settings = settings;
        this.client = client;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return settings != null && settings.isConfigured();
    }

    @Override
    public String infer(InferenceRequest request) {
        if (!isConfigured()) {
            throw new ProviderException(NAME, "Provider is not configured");
        }

        ChatCompletionCreateParams.Builder params = ChatCompletionCreateParams.builder()
                .model(settings.getModel())
                .maxTokens(request.maxOutputTokens())
                .temperature(settings.getTemperature());
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            params.addSystemMessage(request.systemPrompt());
        }
        params.addUserMessage(request.prompt());

        long start = System.currentTimeMillis();
        ChatCompletion completion;
        try {
            completion = getOrCreateClient().chat().completions().create(params.build());
        } catch (RateLimitException e) {
            throw new ProviderException(NAME, "Rate limited (HTTP 429)", e);
        } catch (OpenAIException e) {
            throw new ProviderException(NAME, "Chat completion failed: " + e.getMessage(), e);
        }

        String text = completion == null || completion.choices().isEmpty()
                ? ""
                : completion.choices().get(0).message().content().orElse("");
        if (text.isBlank()) {
            throw new ProviderException(NAME, "Empty completion");
        }

        log.debug("[DeepSeek] Chat completion ok (model={} chars={} elapsedMs={})",
                settings.getModel(), text.length(), System.currentTimeMillis() - start);
        return text;
    }

    private OpenAIClient getOrCreateClient() {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            client = OpenAIOkHttpClient.builder()
                    .apiKey(settings.getApiKey().trim())
                    .baseUrl(settings.getBaseUrl())
                    .timeout(Duration.ofSeconds(Math.max(1, settings.getTimeoutSeconds())))
                    // o orquestrador já faz o retry por chunk
                    .maxRetries(0)
                    .build();
            return client;
        }
    }
}
