package com.spendlens.backend.exceptions;

/**
 * Provider output could not be read as the expected JSON array of records.
 */
public class SchemaValidationException extends ClassificationPipelineException {

    public SchemaValidationException(String message) {
        super(message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
