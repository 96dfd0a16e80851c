package io.blockstore.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_IDS_PER_REQUEST = 10_000;
    public static final int MAX_BLOCKS_PER_REQUEST = 10_000;
    public static final int MAX_BLOB_BYTES = 32 * 1024 * 1024;
    public static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;  // socket transport
}
