package com.tiergate.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Priority tiers in execution order.
 * Declaration order is the precedence order: tiers run strictly one after another,
 * starting with {@link #CRITICAL}.
 */
public enum Tier {

    /**
     * Must pass before anything else runs. A block stops all later tiers.
     */
    CRITICAL("critical", true, 2000),

    /**
     * Important validations. A block stops all later tiers.
     */
    HIGH("high", true, 4000),

    /**
     * Standard validations. Default tier for unclassified tasks.
     */
    MEDIUM("medium", false, 3000),

    /**
     * Nice-to-have validations.
     */
    LOW("low", false, 2000),

    /**
     * Monitoring and analytics tasks.
     */
    BACKGROUND("background", false, 5000);

    private final String label;
    private final boolean gating;
    private final long defaultTimeoutMs;

    Tier(String label, boolean gating, long defaultTimeoutMs) {
        this.label = label;
        this.gating = gating;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    /**
     * Lowercase wire label (e.g. "critical").
     */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Whether a block in this tier halts scheduling of every later tier.
     */
    public boolean isGating() {
        return gating;
    }

    /**
     * Timeout applied when neither the task nor the configuration supplies one.
     */
    public long defaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    /**
     * Resolve a tier from its label, ignoring case and surrounding whitespace.
     *
     * @param label Tier label, may be null
     * @return Matching tier, or empty if the label is not recognized
     */
    public static Optional<Tier> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.label.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * Lenient lookup used when reading JSON: unknown labels become {@link #MEDIUM}.
     */
    @JsonCreator
    public static Tier fromLabelOrDefault(String label) {
        return fromLabel(label).orElse(MEDIUM);
    }
}
