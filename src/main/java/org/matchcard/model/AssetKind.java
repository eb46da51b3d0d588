package org.matchcard.model;

public enum AssetKind {
    CHAMPION("champions", "champion"),
    ITEM("items", "item");

    private final String directory;
    private final String pathSegment;

    AssetKind(String directory, String pathSegment) {
        this.directory = directory;
        this.pathSegment = pathSegment;
    }

    /** Sub-directory below the cache root. */
    public String directory() {
        return directory;
    }

    /** Segment in {@code /img/{segment}/} of the Data Dragon URL. */
    public String pathSegment() {
        return pathSegment;
    }
}
