package com.spendlens.backend.exceptions;

/**
 * Base type for errors raised inside the classification and extraction pipeline.
 */
public class ClassificationPipelineException extends RuntimeException {

    public ClassificationPipelineException(String message) {
        super(message);
    }

    public ClassificationPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
