package io.blockstore.core.storage;

import java.nio.charset.StandardCharsets;

/** Key spaces of the backend; one RocksDB column family each. */
public enum Column {
    BLOCK_BLOBS("block_blobs"),
    RECEIPT_BLOBS("receipt_blobs"),
    TRANSACTIONS("transactions"),
    BLOCK_INDEX("block_index");

    private final String familyName;

    Column(String familyName) {
        this.familyName = familyName;
    }

    public String familyName() { return familyName; }

    byte[] familyNameBytes() {
        return familyName.getBytes(StandardCharsets.UTF_8);
    }
}
