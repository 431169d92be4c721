package com.tiergate.priority;

import com.tiergate.config.FamilyConfig;
import com.tiergate.config.GateConfig;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.Tier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks raw task definitions before they are classified.
 * Classification never rejects a task; this is where the problems it hides are reported.
 */
public class TaskValidator {

    static final long LOW_TIMEOUT_THRESHOLD_MS = 1000;

    private final GateConfig config;
    private final PriorityClassifier classifier;

    public TaskValidator(GateConfig config, PriorityClassifier classifier) {
        this.config = config;
        this.classifier = classifier;
    }

    public ValidationReport validate(Map<String, Object> raw) {
        Map<String, Object> fields = raw != null ? raw : Map.of();
        TaskDescriptor descriptor = classifier.classify(fields);

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!descriptor.hasCommand()) {
            errors.add("Task command is required");
        }

        String tierLabel = RawFields.getString(fields, "tier");
        if (tierLabel == null) {
            tierLabel = RawFields.getString(fields, "priority");
        }
        if (tierLabel == null) {
            warnings.add("Task tier not specified, defaulting to " + descriptor.tier().label());
        } else if (Tier.fromLabel(tierLabel).isEmpty()) {
            errors.add("Invalid tier: " + tierLabel);
        }

        String family = RawFields.getString(fields, "family");
        if (family == null) {
            warnings.add("Task family not specified, defaulting to " + descriptor.family());
        } else if (config.getFamily(family).isEmpty()) {
            warnings.add("Unknown family: " + family);
        }

        if (descriptor.timeoutMs() < LOW_TIMEOUT_THRESHOLD_MS) {
            warnings.add("Task timeout is very low (" + descriptor.timeoutMs()
                    + "ms), may cause premature timeouts");
        }

        Optional<FamilyConfig> familyConfig = config.getFamily(descriptor.family());
        if (familyConfig.isPresent() && familyConfig.get().tier() != descriptor.tier()) {
            warnings.add("Family " + descriptor.family() + " usually runs in tier "
                    + familyConfig.get().tier().label() + ", task is " + descriptor.tier().label());
        }

        return new ValidationReport(descriptor.id(), errors.isEmpty(), errors, warnings);
    }

    public List<ValidationReport> validateAll(List<Map<String, Object>> rawTasks) {
        if (rawTasks == null) {
            return List.of();
        }
        List<ValidationReport> reports = new ArrayList<>(rawTasks.size());
        for (Map<String, Object> raw : rawTasks) {
            reports.add(validate(raw));
        }
        return reports;
    }
}
