package com.circuitsync.core.diff;

import com.circuitsync.core.model.Component;
import com.circuitsync.core.util.References;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches on equal (type id, reference label). Prefix-only references never match here.
 */
public class ReferenceMatchStrategy implements MatchStrategy {

    @Override
    public String name() {
        return "reference";
    }

    @Override
    public List<Match> match(List<Component> current, List<Component> desired) {
        Map<String, Component> byKey = new LinkedHashMap<>();
        for (Component component : current) {
            byKey.putIfAbsent(component.typeId() + "|" + component.reference(), component);
        }
        List<Match> matches = new ArrayList<>();
        for (Component component : desired) {
            if (References.isPrefixOnly(component.reference())) {
                continue;
            }
            Component hit = byKey.remove(component.typeId() + "|" + component.reference());
            if (hit != null) {
                matches.add(new Match(hit, component));
            }
        }
        return matches;
    }
}
