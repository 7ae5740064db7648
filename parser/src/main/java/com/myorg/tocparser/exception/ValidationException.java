package com.myorg.tocparser.exception;

/**
 * Request-level validation failure in the REST layer.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
