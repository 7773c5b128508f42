package com.spendlens.backend.exceptions;

/**
 * Network, timeout, rate-limit or empty-output failure from an inference provider.
 * Always recoverable: callers fall back to defaults.
 */
public class ProviderException extends ClassificationPipelineException {

    private final String provider;

    public ProviderException(String provider, String message) {
        super("[" + provider + "] " + message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
