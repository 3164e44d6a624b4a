package com.document.verification.core;

/**
 * Runtime exception thrown when a verification request carries no usable input at all.
 * Nothing is computed when this is raised.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
