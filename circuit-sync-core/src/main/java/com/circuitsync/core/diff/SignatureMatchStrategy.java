package com.circuitsync.core.diff;

import com.circuitsync.core.model.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Last resort: matches components of the same type id and pin signature.
 *
 * <p>Desired components are visited in reference order. Each takes the candidate sharing
 * the most property values with it; among equal scores the lowest current reference
 * wins. The result depends only on the two models, never on document order.
 */
public class SignatureMatchStrategy implements MatchStrategy {

    @Override
    public String name() {
        return "signature";
    }

    @Override
    public List<Match> match(List<Component> current, List<Component> desired) {
        List<Component> remaining = new ArrayList<>(current);
        remaining.sort(Comparator.comparing(Component::reference).thenComparing(Component::key));
        List<Component> ordered = new ArrayList<>(desired);
        ordered.sort(Comparator.comparing(Component::reference).thenComparing(Component::key));

        List<Match> matches = new ArrayList<>();
        for (Component wanted : ordered) {
            Component best = null;
            int bestScore = -1;
            for (Component candidate : remaining) {
                if (!candidate.typeId().equals(wanted.typeId())
                    || !candidate.pinSignature().equals(wanted.pinSignature())) {
                    continue;
                }
                int score = score(wanted, candidate);
                if (score > bestScore) {
                    best = candidate;
                    bestScore = score;
                }
            }
            if (best != null) {
                remaining.remove(best);
                matches.add(new Match(best, wanted));
            }
        }
        return matches;
    }

    private static int score(Component wanted, Component candidate) {
        int score = 0;
        for (Map.Entry<String, String> property : wanted.properties().entrySet()) {
            if (property.getValue().equals(candidate.properties().get(property.getKey()))) {
                score++;
            }
        }
        return score;
    }
}
