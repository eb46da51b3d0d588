package org.matchcard.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Icons resolved for one participant during one render. {@code mainItems} lines up with the
 * non-empty main cells of the row's item bar; an empty entry means the download failed.
 */
public record PlayerAssets(
        String puuid,
        Optional<Path> championIcon,
        List<Optional<Path>> mainItems,
        Optional<Path> trinket,
        Optional<Path> roleItem
) {
    public PlayerAssets {
        mainItems = List.copyOf(mainItems);
    }

    public static PlayerAssets unresolved(String puuid) {
        return new PlayerAssets(puuid, Optional.empty(), List.of(), Optional.empty(), Optional.empty());
    }

    public Optional<Path> mainItem(int packedIndex) {
        return packedIndex < mainItems.size() ? mainItems.get(packedIndex) : Optional.empty();
    }
}
