package io.blockstore.core.protocol.messages;

import io.blockstore.core.protocol.Digest;

/**
 * Hydrated block as seen by callers. Blob fields are empty when not requested
 * (or not stored). On add requests {@code blockHeight} is informational only.
 */
public record BlockItem(Digest blockId, long blockHeight, byte[] blockBlob, byte[] blockReceiptBlob) {
    private static final byte[] EMPTY = new byte[0];

    public BlockItem {
        blockBlob = blockBlob == null ? EMPTY : blockBlob;
        blockReceiptBlob = blockReceiptBlob == null ? EMPTY : blockReceiptBlob;
    }

    public static BlockItem of(Digest blockId, byte[] blockBlob, byte[] blockReceiptBlob) {
        return new BlockItem(blockId, 0L, blockBlob, blockReceiptBlob);
    }
}
