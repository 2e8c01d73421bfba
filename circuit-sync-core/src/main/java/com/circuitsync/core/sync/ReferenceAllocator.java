package com.circuitsync.core.sync;

import com.circuitsync.core.description.DescriptionModels;
import com.circuitsync.core.diff.ComponentChange;
import com.circuitsync.core.diff.EditPlan;
import com.circuitsync.core.diff.InstanceChange;
import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.SubcircuitInstance;
import com.circuitsync.core.util.References;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Numbers prefix-only references such as {@code R?}.
 *
 * <p>A component matched to a document symbol with the same prefix takes over that
 * symbol's reference, so numbering is stable across runs. Any other prefix-only
 * component gets the lowest free number for its prefix across the whole project.
 * Numbers used anywhere in the document or by an explicit reference are never handed
 * out twice.
 */
public final class ReferenceAllocator {

    private static final Logger log = LoggerFactory.getLogger(ReferenceAllocator.class);

    private ReferenceAllocator() {
        // Utility class
    }

    /**
     * @param current model interpreted from the document
     * @param desired model built from the description
     * @param plan plan diffing {@code current} against {@code desired}
     * @return {@code desired} with every prefix-only reference numbered and implicit net
     *     names derived from the final references
     */
    public static Circuit allocate(Circuit current, Circuit desired, EditPlan plan) {
        Set<String> used = new HashSet<>();
        collect(current, used);
        collect(desired, used);
        return DescriptionModels.deriveImplicitNames(assign(desired, plan, used));
    }

    private static void collect(Circuit circuit, Set<String> used) {
        for (Component component : circuit.components()) {
            if (!References.isPrefixOnly(component.reference())) {
                used.add(component.reference());
            }
        }
        for (SubcircuitInstance instance : circuit.instances()) {
            collect(instance.body(), used);
        }
    }

    private static Circuit assign(Circuit desired, EditPlan plan, Set<String> used) {
        Map<String, Component> matched = new HashMap<>();
        for (ComponentChange change : plan.components()) {
            if (change.current() != null && change.desired() != null) {
                matched.put(change.desired().key(), change.current());
            }
        }
        Set<String> explicit = new HashSet<>();
        for (Component component : desired.components()) {
            if (!References.isPrefixOnly(component.reference())) {
                explicit.add(component.reference());
            }
        }
        List<Component> components = new ArrayList<>();
        for (Component component : desired.components()) {
            if (!References.isPrefixOnly(component.reference())) {
                components.add(component);
                continue;
            }
            String prefix = References.prefix(component.reference());
            Component previous = matched.get(component.key());
            String reference;
            if (previous != null && References.prefix(previous.reference()).equals(prefix)
                && References.number(previous.reference()) >= 0 && !explicit.contains(previous.reference())) {
                reference = previous.reference();
            } else {
                reference = nextFree(prefix, used);
                log.debug("Numbered {} as {}", component.reference(), reference);
            }
            components.add(component.withReference(reference));
        }

        Map<String, EditPlan> bodies = new HashMap<>();
        for (InstanceChange change : plan.instances()) {
            if (change.desired() != null) {
                bodies.put(change.desired().key(), change.body());
            }
        }
        List<SubcircuitInstance> instances = new ArrayList<>();
        for (SubcircuitInstance instance : desired.instances()) {
            EditPlan body = bodies.get(instance.key());
            Circuit assigned = body == null ? instance.body() : assign(instance.body(), body, used);
            instances.add(new SubcircuitInstance(instance.key(), instance.identity(), instance.name(),
                instance.definition(), instance.parameters(), instance.ports(), assigned, instance.position(),
                instance.fileName()));
        }
        return new Circuit(components, desired.nets(), instances, desired.ports(), desired.annotations());
    }

    private static String nextFree(String prefix, Set<String> used) {
        int number = 1;
        while (used.contains(prefix + number)) {
            number++;
        }
        String reference = prefix + number;
        used.add(reference);
        return reference;
    }
}
