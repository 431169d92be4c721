package com.tiergate.config;

import com.tiergate.core.Tier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Root configuration for the engine.
 *
 * @param name         Configuration name
 * @param execution    Execution defaults
 * @param tierTimeouts Default timeout per tier, overriding the built-in tier defaults
 * @param families     Known validator families
 * @param catalog      Known validator commands with their defaults
 */
public record GateConfig(
        String name,
        ExecutionConfig execution,
        Map<Tier, Long> tierTimeouts,
        List<FamilyConfig> families,
        List<CatalogEntry> catalog
) {

    public GateConfig {
        EnumMap<Tier, Long> timeouts = new EnumMap<>(Tier.class);
        if (tierTimeouts != null) {
            timeouts.putAll(tierTimeouts);
        }
        tierTimeouts = Collections.unmodifiableMap(timeouts);
        families = families != null ? List.copyOf(families) : List.of();
        catalog = catalog != null ? List.copyOf(catalog) : List.of();
    }

    /**
     * Default timeout for a tier: configured value if present, built-in otherwise.
     */
    public long defaultTimeoutMs(Tier tier) {
        Long configured = tierTimeouts.get(tier);
        return configured != null && configured > 0 ? configured : tier.defaultTimeoutMs();
    }

    /**
     * Get family by name.
     */
    public Optional<FamilyConfig> getFamily(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return families.stream()
                .filter(f -> f.name().equals(name))
                .findFirst();
    }

    /**
     * Get catalog entry by command.
     */
    public Optional<CatalogEntry> getCatalogEntry(String command) {
        if (command == null) {
            return Optional.empty();
        }
        return catalog.stream()
                .filter(e -> e.command().equals(command))
                .findFirst();
    }

    /**
     * Map of family name to family config.
     */
    public Map<String, FamilyConfig> familiesByName() {
        return families.stream()
                .collect(Collectors.toMap(FamilyConfig::name, Function.identity(), (a, b) -> a));
    }

    /**
     * Configuration with built-in defaults, no families and an empty catalog.
     */
    public static GateConfig defaults() {
        return new GateConfig("default-gate", ExecutionConfig.defaults(), Map.of(), List.of(), List.of());
    }
}
