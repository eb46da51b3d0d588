package org.matchcard.model;

import java.util.Locale;

/**
 * Lane assignment as reported by match-v5 {@code teamPosition}. The rank drives row order on the
 * scoreboard; anything unrecognised sorts last.
 */
public enum TeamPosition {
    TOP("Top", 0),
    JUNGLE("Jungle", 1),
    MIDDLE("Mid", 2),
    BOTTOM("Bot", 3),
    UTILITY("Support", 4),
    UNKNOWN("Flex", 99);

    private final String label;
    private final int rank;

    TeamPosition(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    public static TeamPosition parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "TOP" -> TOP;
            case "JUNGLE" -> JUNGLE;
            case "MIDDLE", "MID" -> MIDDLE;
            case "BOTTOM", "BOT", "ADC" -> BOTTOM;
            case "UTILITY", "SUPPORT" -> UTILITY;
            default -> UNKNOWN;
        };
    }
}
