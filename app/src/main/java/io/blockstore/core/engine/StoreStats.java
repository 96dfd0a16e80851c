package io.blockstore.core.engine;

public record StoreStats(long blocks, long blockBlobs, long receiptBlobs, long transactions) {}
