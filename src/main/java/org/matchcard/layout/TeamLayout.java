package org.matchcard.layout;

import java.util.List;

/**
 * @param y         top edge of the team banner
 * @param columnsY  top edge of the column header strip
 */
public record TeamLayout(boolean victory, int y, int columnsY, List<RowLayout> rows) {
    public TeamLayout {
        rows = List.copyOf(rows);
    }

    public String title() {
        return victory ? "VICTORY" : "DEFEAT";
    }
}
