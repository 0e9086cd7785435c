package io.hearthwarrio.sightline.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stable sort of matches by a {@link DisposalPolicy}.
 */
public final class MatchOrderer {

    private MatchOrderer() {
        // utility class
    }

    /**
     * @return a new list; the input is left untouched
     * @throws ConfigurationException if {@code policy} is null
     */
    public static List<Match> order(List<Match> matches, DisposalPolicy policy) {
        Objects.requireNonNull(matches, "matches must not be null");
        if (policy == null) {
            throw new ConfigurationException("Disposal policy not valid: null");
        }
        List<Match> out = new ArrayList<>(matches);
        out.sort(policy.comparator());
        return out;
    }
}
