package com.spendlens.backend.services.ai;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.spendlens.backend.config.InferenceProperties;
import com.spendlens.backend.exceptions.ProviderException;

class GeminiInferenceProviderTest {

    private static final String URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:generateContent";

    private InferenceProperties.Provider settings;
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        settings = new InferenceProperties().getGemini();
        settings.setApiKey(" test-key ");
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void infer_postsPromptAndJoinsTextParts() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-goog-api-key", "test-key"))
                .andExpect(content().string(containsString("\"maxOutputTokens\":512")))
                .andExpect(content().string(containsString("systemInstruction")))
                .andRespond(withSuccess(
                        "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"[{\\\"index\\\":0,\"},{\"text\":\"\\\"category\\\":\\\"Shopping\\\"}]\"}]}}]}",
                        MediaType.APPLICATION_JSON));

        GeminiInferenceProvider provider = new GeminiInferenceProvider(settings, restTemplate);
        String out = provider.infer(new InferenceRequest("system", "categorize this", 512));

        assertEquals("[{\"index\":0,\"category\":\"Shopping\"}]", out);
        server.verify();
    }

    @Test
    void rateLimit_isProviderException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        GeminiInferenceProvider provider = new GeminiInferenceProvider(settings, restTemplate);
        ProviderException e = assertThrows(ProviderException.class,
                () -> provider.infer(new InferenceRequest(null, "x", 10)));

        assertEquals("gemini", e.getProvider());
        assertTrue(e.getMessage().contains("429"));
    }

    @Test
    void noTextInResponse_isProviderException() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}", MediaType.APPLICATION_JSON));

        GeminiInferenceProvider provider = new GeminiInferenceProvider(settings, restTemplate);
        ProviderException e = assertThrows(ProviderException.class,
                () -> provider.infer(new InferenceRequest(null, "x", 10)));

        assertTrue(e.getMessage().contains("SAFETY"));
    }

    @Test
    void blankKey_notConfigured() {
        settings.setApiKey("  ");
        GeminiInferenceProvider provider = new GeminiInferenceProvider(settings, restTemplate);

        assertFalse(provider.isConfigured());
        assertThrows(ProviderException.class, () -> provider.infer(new InferenceRequest(null, "x", 10)));
    }
}
