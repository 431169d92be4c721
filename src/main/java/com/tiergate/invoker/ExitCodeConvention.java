package com.tiergate.invoker;

import com.tiergate.core.Outcome;

/**
 * Validator exit code convention: 0 allows, 2 blocks, anything else is a failure.
 * The choice of 2 for "block" is inherited from the hook protocol validators are written
 * against; any other value would be read as a failure.
 */
public final class ExitCodeConvention {

    public static final int ALLOW = 0;
    public static final int BLOCK = 2;

    private ExitCodeConvention() {
    }

    public static Outcome decode(int exitCode) {
        return switch (exitCode) {
            case ALLOW -> Outcome.ALLOW;
            case BLOCK -> Outcome.BLOCK;
            default -> Outcome.FAIL;
        };
    }
}
