package org.matchcard.render;

import java.util.Locale;

/**
 * Text shown on the scoreboard. Kept separate from drawing so the strings can be checked directly.
 */
public final class StatFormat {
    private static final int MAX_NAME_LENGTH = 12;
    private static final int TRUNCATED_NAME_LENGTH = 10;

    private StatFormat() {
    }

    public static String playerName(String name) {
        if (name == null) return "";
        if (name.length() <= MAX_NAME_LENGTH) return name;
        int cut = TRUNCATED_NAME_LENGTH;
        // keep surrogate pairs whole
        if (Character.isHighSurrogate(name.charAt(cut - 1))) {
            cut--;
        }
        return name.substring(0, cut) + "..";
    }

    /** {@code 15432 -> "15.4k"}, {@code 850 -> "850"}. */
    public static String compact(int value) {
        if (value >= 1000) {
            return String.format(Locale.ROOT, "%.1fk", value / 1000f);
        }
        return Integer.toString(value);
    }

    public static String kda(int kills, int deaths, int assists) {
        return kills + " / " + deaths + " / " + assists;
    }

    public static String gameInfo(String gameMode, long durationSeconds) {
        long minutes = durationSeconds / 60;
        long seconds = durationSeconds % 60;
        return String.format(Locale.ROOT, "%s • %d:%02d", gameMode == null ? "" : gameMode, minutes, seconds);
    }
}
