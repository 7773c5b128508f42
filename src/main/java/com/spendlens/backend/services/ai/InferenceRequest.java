package com.spendlens.backend.services.ai;

/**
 * @param systemPrompt    instructions sent as the system role, may be null
 * @param prompt          user content
 * @param maxOutputTokens upper bound on generated tokens
 */
public record InferenceRequest(String systemPrompt, String prompt, int maxOutputTokens) {
}
