package com.nexus.backend.exception;

/**
 * Malformed or out-of-policy input; rendered as 400.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
