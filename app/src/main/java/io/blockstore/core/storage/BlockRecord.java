package io.blockstore.core.storage;

import io.blockstore.core.protocol.Digest;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Index metadata for one stored block. Bodies and receipts live in blob stores.
 *
 * @param previousBlockIds canonical parent first; empty for genesis. Later
 *                         entries are kept but never used for height or ancestry.
 * @param skipIds          ancestors at {@link SkipList#previousHeights(long)}
 */
public record BlockRecord(Digest id, long height, List<Digest> previousBlockIds, List<Digest> skipIds) {

    public BlockRecord {
        Objects.requireNonNull(id, "id");
        if (height < 0) {
            throw new IllegalArgumentException("negative height " + height);
        }
        previousBlockIds = previousBlockIds == null ? List.of() : List.copyOf(previousBlockIds);
        skipIds = skipIds == null ? List.of() : List.copyOf(skipIds);
    }

    public static BlockRecord genesis(Digest id) {
        return new BlockRecord(id, 0L, List.of(), List.of());
    }

    public Optional<Digest> canonicalParent() {
        return previousBlockIds.isEmpty() ? Optional.empty() : Optional.of(previousBlockIds.get(0));
    }

    public boolean isGenesis() {
        return previousBlockIds.isEmpty();
    }
}
