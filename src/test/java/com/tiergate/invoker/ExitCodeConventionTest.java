package com.tiergate.invoker;

import com.tiergate.core.Outcome;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExitCodeConvention.
 */
class ExitCodeConventionTest {

    @ParameterizedTest(name = "exit {0} -> {1}")
    @CsvSource({
            "0, ALLOW",
            "2, BLOCK",
            "1, FAIL",
            "3, FAIL",
            "127, FAIL",
            "143, FAIL",
            "-1, FAIL"
    })
    void shouldDecodeExitCodes(int exitCode, Outcome expected) {
        assertEquals(expected, ExitCodeConvention.decode(exitCode));
    }
}
