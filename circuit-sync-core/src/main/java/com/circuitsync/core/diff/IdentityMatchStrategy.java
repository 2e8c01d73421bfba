package com.circuitsync.core.diff;

import com.circuitsync.core.model.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches on the stable identity persisted in the document.
 */
public class IdentityMatchStrategy implements MatchStrategy {

    @Override
    public String name() {
        return "identity";
    }

    @Override
    public List<Match> match(List<Component> current, List<Component> desired) {
        Map<String, Component> byIdentity = new LinkedHashMap<>();
        for (Component component : current) {
            if (component.identity() != null) {
                byIdentity.putIfAbsent(component.identity(), component);
            }
        }
        List<Match> matches = new ArrayList<>();
        for (Component component : desired) {
            if (component.identity() == null) {
                continue;
            }
            Component hit = byIdentity.remove(component.identity());
            if (hit != null) {
                matches.add(new Match(hit, component));
            }
        }
        return matches;
    }
}
