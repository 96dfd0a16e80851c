package io.blockstore.core.protocol;

import java.util.Optional;

public enum ErrorCode {
    /** Head block absent. Batch lookups report misses per element instead. */
    NOT_FOUND(404),
    PARENT_NOT_FOUND(404),
    /** Id already stored with different content. */
    CONFLICT(409),
    INVALID_RANGE(400),
    DIGEST_MISMATCH(400),
    INVALID_REQUEST(400),
    UNKNOWN_REQUEST(400),
    STORAGE_FAILURE(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() { return httpStatus; }

    /** Lowercase wire name, e.g. {@code parent_not_found}. */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    public static Optional<ErrorCode> fromWireName(String wireName) {
        for (ErrorCode code : values()) {
            if (code.wireName().equals(wireName)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
