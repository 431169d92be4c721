package com.tiergate.priority;

import com.tiergate.config.CatalogEntry;
import com.tiergate.config.GateConfig;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.Tier;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of the configured task catalog.
 *
 * @param total            Number of catalog entries
 * @param byTier           Entry count per tier label, tiers in precedence order
 * @param byFamily         Entry count per family, sorted by name
 * @param totalTimeoutMs   Sum of effective entry timeouts
 * @param averageTimeoutMs Rounded mean timeout, 0 for an empty catalog
 */
public record CatalogStatistics(
        int total,
        Map<String, Integer> byTier,
        Map<String, Integer> byFamily,
        long totalTimeoutMs,
        long averageTimeoutMs
) {

    public static CatalogStatistics of(GateConfig config) {
        Map<String, Integer> byTier = new LinkedHashMap<>();
        Map<String, Integer> byFamily = new TreeMap<>();
        long totalTimeout = 0;

        for (CatalogEntry entry : config.catalog()) {
            Tier tier = entry.tier() != null ? entry.tier() : Tier.MEDIUM;
            String family = entry.family() != null ? entry.family() : TaskDescriptor.UNCLASSIFIED;
            byTier.merge(tier.label(), 1, Integer::sum);
            byFamily.merge(family, 1, Integer::sum);
            totalTimeout += entry.timeoutMs() != null ? entry.timeoutMs() : config.defaultTimeoutMs(tier);
        }

        // Re-insert in tier order
        Map<String, Integer> orderedByTier = new LinkedHashMap<>();
        for (Tier tier : Tier.values()) {
            Integer count = byTier.get(tier.label());
            if (count != null) {
                orderedByTier.put(tier.label(), count);
            }
        }

        int total = config.catalog().size();
        long average = total > 0 ? Math.round((double) totalTimeout / total) : 0;
        return new CatalogStatistics(total, orderedByTier, byFamily, totalTimeout, average);
    }
}
