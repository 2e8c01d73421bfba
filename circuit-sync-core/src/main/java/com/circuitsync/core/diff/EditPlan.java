package com.circuitsync.core.diff;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classified changes of one namespace plus the plans of its instances.
 *
 * @param components one entry per component of either model
 * @param nets one entry per net of either model
 * @param instances one entry per instance of either model
 * @param targetKeys desired component and instance keys mapped to the keys they carry in the output
 */
public record EditPlan(
    List<ComponentChange> components,
    List<NetChange> nets,
    List<InstanceChange> instances,
    Map<String, String> targetKeys
) {
    public EditPlan {
        components = List.copyOf(components);
        nets = List.copyOf(nets);
        instances = List.copyOf(instances);
        targetKeys = Map.copyOf(targetKeys);
    }

    /**
     * @return true when this namespace or any nested one has a non-KEEP change
     */
    public boolean hasChanges() {
        return components.stream().anyMatch(c -> c.kind() != ChangeKind.KEEP)
            || nets.stream().anyMatch(n -> n.kind() != ChangeKind.KEEP)
            || instances.stream().anyMatch(i -> i.kind() != ChangeKind.KEEP
                || (i.body() != null && i.body().hasChanges()));
    }

    /**
     * Component counts per kind, including nested namespaces.
     */
    public Map<ChangeKind, Integer> componentCounts() {
        Map<ChangeKind, Integer> counts = emptyCounts();
        accumulate(this, counts, Entity.COMPONENT);
        return counts;
    }

    public Map<ChangeKind, Integer> netCounts() {
        Map<ChangeKind, Integer> counts = emptyCounts();
        accumulate(this, counts, Entity.NET);
        return counts;
    }

    public Map<ChangeKind, Integer> instanceCounts() {
        Map<ChangeKind, Integer> counts = emptyCounts();
        accumulate(this, counts, Entity.INSTANCE);
        return counts;
    }

    private enum Entity { COMPONENT, NET, INSTANCE }

    private static Map<ChangeKind, Integer> emptyCounts() {
        Map<ChangeKind, Integer> counts = new EnumMap<>(ChangeKind.class);
        for (ChangeKind kind : ChangeKind.values()) {
            counts.put(kind, 0);
        }
        return counts;
    }

    private static void accumulate(EditPlan plan, Map<ChangeKind, Integer> counts, Entity entity) {
        List<? extends Change> changes = switch (entity) {
            case COMPONENT -> plan.components();
            case NET -> plan.nets();
            case INSTANCE -> plan.instances();
        };
        for (Change change : changes) {
            counts.merge(change.kind(), 1, Integer::sum);
        }
        for (InstanceChange instance : plan.instances()) {
            if (instance.body() != null) {
                accumulate(instance.body(), counts, entity);
            }
        }
    }
}
