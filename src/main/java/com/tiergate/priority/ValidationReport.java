package com.tiergate.priority;

import java.util.List;

/**
 * Outcome of checking one raw task definition.
 *
 * @param taskId   Identifier the task would be classified under
 * @param valid    True when there are no errors
 * @param errors   Problems that make the task unusable as written
 * @param warnings Problems that classification silently papers over
 */
public record ValidationReport(
        String taskId,
        boolean valid,
        List<String> errors,
        List<String> warnings
) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
