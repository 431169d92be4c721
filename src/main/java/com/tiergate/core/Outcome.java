package com.tiergate.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict of a single task invocation.
 * Raw process exit codes are decoded into this enum once, at the invoker boundary.
 */
public enum Outcome {

    /**
     * Validator accepted the change.
     */
    ALLOW("allow"),

    /**
     * Validator vetoed the change.
     */
    BLOCK("block"),

    /**
     * Validator itself malfunctioned (bad exit code, spawn error, missing command).
     */
    FAIL("fail"),

    /**
     * Validator did not finish before its deadline.
     */
    TIMEOUT("timeout");

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * FAIL or TIMEOUT: the validator did not produce a clean verdict.
     */
    public boolean isError() {
        return this == FAIL || this == TIMEOUT;
    }
}
