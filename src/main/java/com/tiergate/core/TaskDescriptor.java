package com.tiergate.core;

/**
 * Immutable specification of one validator task.
 *
 * @param id        Task identifier used in results and logs
 * @param tier      Priority tier driving the execution order
 * @param family    Family label (e.g. "security"), {@value #UNCLASSIFIED} when unknown
 * @param command   Command line to spawn; null or blank when the task has none
 * @param timeoutMs Wall-clock limit for one invocation, in milliseconds
 */
public record TaskDescriptor(
        String id,
        Tier tier,
        String family,
        String command,
        long timeoutMs
) {

    public static final String UNCLASSIFIED = "unclassified";

    /**
     * Create a descriptor with the tier's default timeout.
     */
    public static TaskDescriptor of(String id, Tier tier, String family, String command) {
        return new TaskDescriptor(id, tier, family, command, tier.defaultTimeoutMs());
    }

    /**
     * Whether there is anything to spawn.
     */
    public boolean hasCommand() {
        return command != null && !command.isBlank();
    }

    /**
     * Copy with a different timeout.
     */
    public TaskDescriptor withTimeoutMs(long timeoutMs) {
        return new TaskDescriptor(id, tier, family, command, timeoutMs);
    }
}
