package com.myorg.tocparser.exception;

/**
 * Raised when a caller breaks the contract of a pipeline entry point (missing input,
 * non-positive page count, lines out of page order). Malformed document content never
 * raises this; it is reported as diagnostics instead.
 */
public class InputContractException extends RuntimeException {

    public InputContractException(String message) {
        super(message);
    }

    public InputContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
