package org.matchcard.model;

import java.util.Objects;

/**
 * Identity of one cached icon. {@code ITEM/0} is the empty inventory slot and never hits the cache.
 */
public record AssetKey(AssetKind kind, String identifier) {
    public static final String EMPTY_ITEM = "0";

    public AssetKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(identifier, "identifier");
    }

    public static AssetKey champion(String championName) {
        return new AssetKey(AssetKind.CHAMPION, championName == null ? "" : championName);
    }

    public static AssetKey item(int itemId) {
        return new AssetKey(AssetKind.ITEM, Integer.toString(itemId));
    }

    public boolean isEmptySlot() {
        return kind == AssetKind.ITEM && EMPTY_ITEM.equals(identifier);
    }

    public String fileName() {
        return identifier + ".png";
    }

    @Override
    public String toString() {
        return kind.pathSegment() + "/" + identifier;
    }
}
