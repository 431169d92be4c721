package com.tiergate.config;

import com.tiergate.core.Tier;

/**
 * A known validator family.
 *
 * @param name        Family name (e.g. "security")
 * @param tier        Tier tasks of this family usually run in
 * @param description Human-readable description
 */
public record FamilyConfig(
        String name,
        Tier tier,
        String description
) {
}
