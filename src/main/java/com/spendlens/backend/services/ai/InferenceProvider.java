package com.spendlens.backend.services.ai;

import com.spendlens.backend.exceptions.ProviderException;

/**
 * A text-completion backend. One call, one prompt, raw text back.
 */
public interface InferenceProvider {

    String name();

    boolean isConfigured();

    /**
     * @return the model's raw text output, never null
     * @throws ProviderException on transport errors, non-2xx responses, rate limits or empty output
     */
    String infer(InferenceRequest request);
}
