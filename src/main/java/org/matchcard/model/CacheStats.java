package org.matchcard.model;

public record CacheStats(int fileCount, long totalSizeBytes) {

    public double totalSizeMegabytes() {
        return totalSizeBytes / (1024.0 * 1024.0);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "%d files, %.2f MB", fileCount, totalSizeMegabytes());
    }
}
