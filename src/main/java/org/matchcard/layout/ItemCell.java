package org.matchcard.layout;

/**
 * One square of the item bar. {@code itemId} is 0 for an empty cell.
 */
public record ItemCell(Kind kind, int itemId) {

    public enum Kind {
        ITEM,
        EMPTY
    }

    private static final ItemCell EMPTY_CELL = new ItemCell(Kind.EMPTY, 0);

    public static ItemCell of(int itemId) {
        return itemId == 0 ? EMPTY_CELL : new ItemCell(Kind.ITEM, itemId);
    }

    public static ItemCell empty() {
        return EMPTY_CELL;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    @Override
    public String toString() {
        return isEmpty() ? "empty" : "icon(" + itemId + ")";
    }
}
