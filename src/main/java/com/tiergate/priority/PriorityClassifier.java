package com.tiergate.priority;

import com.tiergate.config.CatalogEntry;
import com.tiergate.config.GateConfig;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw task maps (parsed JSON or YAML) into {@link TaskDescriptor}s.
 *
 * <p>Classification is total: no input is rejected. Each field is resolved from the
 * raw value first, then the configured task catalog, then built-in defaults. An unknown
 * or missing tier becomes {@link Tier#MEDIUM}; an unknown family becomes
 * {@value TaskDescriptor#UNCLASSIFIED}.
 */
public class PriorityClassifier {

    private static final Logger log = LoggerFactory.getLogger(PriorityClassifier.class);

    private static final String UNNAMED = "unnamed";

    private final GateConfig config;

    public PriorityClassifier(GateConfig config) {
        if (config == null) {
            throw new NullPointerException("Config cannot be null");
        }
        this.config = config;
    }

    /**
     * Classify one raw task.
     *
     * @param raw Raw task fields, may be null
     * @return Descriptor, never null
     */
    public TaskDescriptor classify(Map<String, Object> raw) {
        return classify(raw, UNNAMED);
    }

    /**
     * Classify a list of raw tasks, assigning "task-N" ids to tasks without any name.
     * Null elements are classified like empty tasks.
     */
    public List<TaskDescriptor> classifyAll(List<Map<String, Object>> rawTasks) {
        if (rawTasks == null) {
            return List.of();
        }
        List<TaskDescriptor> descriptors = new ArrayList<>(rawTasks.size());
        for (int i = 0; i < rawTasks.size(); i++) {
            descriptors.add(classify(rawTasks.get(i), "task-" + i));
        }
        return descriptors;
    }

    private TaskDescriptor classify(Map<String, Object> raw, String fallbackId) {
        Map<String, Object> fields = raw != null ? raw : Map.of();

        String command = RawFields.getString(fields, "command");
        Optional<CatalogEntry> entry = config.getCatalogEntry(command);

        String id = resolveId(fields, command, fallbackId);
        Tier tier = resolveTier(fields, entry, id);
        String family = resolveFamily(fields, entry);
        long timeoutMs = resolveTimeout(fields, entry, tier);

        TaskDescriptor descriptor = new TaskDescriptor(id, tier, family, command, timeoutMs);
        log.debug("Classified task {} as tier={}, family={}, timeout={}ms",
                id, tier.label(), family, timeoutMs);
        return descriptor;
    }

    private String resolveId(Map<String, Object> fields, String command, String fallbackId) {
        String id = RawFields.getString(fields, "id");
        if (isPresent(id)) {
            return id;
        }
        String description = RawFields.getString(fields, "description");
        if (isPresent(description)) {
            return description;
        }
        if (isPresent(command)) {
            return command;
        }
        return fallbackId;
    }

    private Tier resolveTier(Map<String, Object> fields, Optional<CatalogEntry> entry, String id) {
        String label = RawFields.getString(fields, "tier");
        if (label == null) {
            // Host settings call it "priority"
            label = RawFields.getString(fields, "priority");
        }
        if (label != null) {
            Optional<Tier> tier = Tier.fromLabel(label);
            if (tier.isPresent()) {
                return tier.get();
            }
            log.debug("Task {} has unknown tier '{}', using {}", id, label, Tier.MEDIUM.label());
            return Tier.MEDIUM;
        }
        return entry.map(CatalogEntry::tier)
                .orElse(Tier.MEDIUM);
    }

    private String resolveFamily(Map<String, Object> fields, Optional<CatalogEntry> entry) {
        String family = RawFields.getString(fields, "family");
        if (family != null && config.getFamily(family).isPresent()) {
            return family;
        }
        return entry.map(CatalogEntry::family)
                .filter(f -> config.getFamily(f).isPresent())
                .orElse(TaskDescriptor.UNCLASSIFIED);
    }

    private long resolveTimeout(Map<String, Object> fields, Optional<CatalogEntry> entry, Tier tier) {
        Optional<Long> timeoutMs = RawFields.getPositiveLong(fields, "timeoutMs");
        if (timeoutMs.isPresent()) {
            return timeoutMs.get();
        }
        // Host settings express timeouts in whole seconds
        Optional<Long> legacyTimeoutMs = RawFields.getPositiveSecondsAsMillis(fields, "timeout");
        if (legacyTimeoutMs.isPresent()) {
            return legacyTimeoutMs.get();
        }
        return entry.map(CatalogEntry::timeoutMs)
                .filter(t -> t > 0)
                .orElseGet(() -> config.defaultTimeoutMs(tier));
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
