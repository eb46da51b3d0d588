package org.matchcard.layout;

import java.util.List;

/**
 * Result of {@link LayoutEngine#layout}: winners first, then losers, with absolute coordinates.
 */
public record ScoreboardLayout(int width, int height, List<TeamLayout> teams) {
    public ScoreboardLayout {
        teams = List.copyOf(teams);
    }

    public TeamLayout winners() {
        return teams.get(0);
    }

    public TeamLayout losers() {
        return teams.get(1);
    }

    public int rowCount() {
        return teams.stream().mapToInt(t -> t.rows().size()).sum();
    }
}
