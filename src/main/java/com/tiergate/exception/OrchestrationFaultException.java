package com.tiergate.exception;

/**
 * Thrown when the tier orchestration itself breaks (malformed task list, rejected
 * submission, interrupted join). Individual validator failures never surface as this
 * exception; they are recorded as results.
 */
public class OrchestrationFaultException extends GateException {

    public OrchestrationFaultException(String message) {
        super(message);
    }

    public OrchestrationFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
