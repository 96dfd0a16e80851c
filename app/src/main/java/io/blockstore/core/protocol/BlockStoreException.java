package io.blockstore.core.protocol;

/**
 * Failure of a single block-store operation. Batch reads never throw this for
 * individual missing ids.
 */
public class BlockStoreException extends RuntimeException {
    private final ErrorCode code;

    public BlockStoreException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BlockStoreException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() { return code; }

    public static BlockStoreException invalid(String message) {
        return new BlockStoreException(ErrorCode.INVALID_REQUEST, message);
    }

    @Override
    public String toString() {
        return "BlockStoreException[" + code + "]: " + getMessage();
    }
}
