package com.tiergate.exception;

/**
 * Base exception for the Tiergate engine.
 */
public class GateException extends RuntimeException {

    public GateException(String message) {
        super(message);
    }

    public GateException(String message, Throwable cause) {
        super(message, cause);
    }
}
