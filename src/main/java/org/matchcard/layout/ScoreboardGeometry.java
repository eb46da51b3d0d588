package org.matchcard.layout;

/**
 * Pixel geometry of the scoreboard. Only vertical metrics and the slot count affect layout; column
 * positions are fixed by the renderer.
 */
public record ScoreboardGeometry(
        int width,
        int headerHeight,
        int teamHeaderHeight,
        int columnHeaderHeight,
        int rowHeight,
        int teamSpacing,
        int bottomPadding,
        int mainItemSlots
) {
    public static ScoreboardGeometry defaults() {
        return new ScoreboardGeometry(750, 80, 32, 22, 44, 12, 16, 6);
    }

    public ScoreboardGeometry {
        if (mainItemSlots != 6 && mainItemSlots != 7) {
            throw new IllegalArgumentException("mainItemSlots must be 6 or 7, was " + mainItemSlots);
        }
    }

    /** Height of one team block: banner, column headers and rows. */
    public int teamHeight(int rows) {
        return teamHeaderHeight + columnHeaderHeight + rows * rowHeight;
    }

    public int imageHeight(int winningRows, int losingRows) {
        return headerHeight + teamHeight(winningRows) + teamSpacing + teamHeight(losingRows) + bottomPadding;
    }

    /** True when the role-bound item shares the main slots instead of trailing the trinket. */
    public boolean roleItemInMainSlots() {
        return mainItemSlots == 7;
    }
}
