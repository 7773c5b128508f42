package com.spendlens.backend.exceptions;

/**
 * A transaction is missing a required field or is internally inconsistent.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
