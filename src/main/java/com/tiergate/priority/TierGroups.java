package com.tiergate.priority;

import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.Tier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tasks partitioned into the five tiers.
 * Each tier keeps the relative order its tasks had in the input list.
 */
public final class TierGroups {

    private final Map<Tier, List<TaskDescriptor>> groups;

    private TierGroups(Map<Tier, List<TaskDescriptor>> groups) {
        this.groups = groups;
    }

    /**
     * Partition a task list.
     *
     * @throws NullPointerException if the list, an element or an element's tier is null
     */
    public static TierGroups partition(List<TaskDescriptor> tasks) {
        if (tasks == null) {
            throw new NullPointerException("Tasks cannot be null");
        }
        Map<Tier, List<TaskDescriptor>> groups = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            groups.put(tier, new ArrayList<>());
        }
        for (int i = 0; i < tasks.size(); i++) {
            TaskDescriptor task = tasks.get(i);
            if (task == null) {
                throw new NullPointerException("Task at index " + i + " is null");
            }
            if (task.tier() == null) {
                throw new NullPointerException("Task '" + task.id() + "' has no tier");
            }
            groups.get(task.tier()).add(task);
        }
        return new TierGroups(groups);
    }

    /**
     * Tasks of one tier, possibly empty.
     */
    public List<TaskDescriptor> get(Tier tier) {
        return Collections.unmodifiableList(groups.get(tier));
    }

    /**
     * Non-empty tiers in precedence order.
     */
    public List<Tier> nonEmptyTiers() {
        List<Tier> tiers = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            if (!groups.get(tier).isEmpty()) {
                tiers.add(tier);
            }
        }
        return tiers;
    }

    /**
     * All tasks in execution order: tier precedence first, input order second.
     */
    public List<TaskDescriptor> flatten() {
        List<TaskDescriptor> ordered = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            ordered.addAll(groups.get(tier));
        }
        return ordered;
    }

    public int size() {
        return groups.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Tier label to tasks for every tier, in precedence order.
     */
    public Map<String, List<TaskDescriptor>> asLabelMap() {
        Map<String, List<TaskDescriptor>> byLabel = new LinkedHashMap<>();
        for (Tier tier : Tier.values()) {
            byLabel.put(tier.label(), get(tier));
        }
        return byLabel;
    }
}
