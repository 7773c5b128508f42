package com.spendlens.backend.exceptions;

public class RegistryUnavailableException extends ClassificationPipelineException {

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
