package org.matchcard.layout;

import org.matchcard.model.Participant;

import java.util.Comparator;

/**
 * How rows are ordered inside a team. Both are applied with a stable sort.
 */
public enum RowOrder {
    /** Top, jungle, mid, bot, support; unknown positions last. */
    TEAM_POSITION(Comparator.comparingInt(p -> p.position().rank())),
    /** Most kills first. */
    KILLS_DESCENDING(Comparator.comparingInt(Participant::kills).reversed());

    private final Comparator<Participant> comparator;

    RowOrder(Comparator<Participant> comparator) {
        this.comparator = comparator;
    }

    public Comparator<Participant> comparator() {
        return comparator;
    }
}
