package com.tiergate.config;

import com.tiergate.core.Tier;

/**
 * Configured defaults for a known validator command.
 * Any field except {@code command} may be null, meaning "no catalog default".
 *
 * @param command     Command line the entry applies to (exact match)
 * @param tier        Default tier
 * @param family      Default family
 * @param timeoutMs   Default timeout in milliseconds, null if not set
 * @param description Human-readable description
 */
public record CatalogEntry(
        String command,
        Tier tier,
        String family,
        Long timeoutMs,
        String description
) {
}
