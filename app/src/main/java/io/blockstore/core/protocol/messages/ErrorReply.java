package io.blockstore.core.protocol.messages;

import io.blockstore.core.protocol.BlockStoreException;

/** Wire form of a failed request: {@code {"error": "<code>", "message": "..."}}. */
public record ErrorReply(String error, String message) {
    public static final String INTERNAL_ERROR = "internal_error";

    public static ErrorReply of(BlockStoreException e) {
        return new ErrorReply(e.code().wireName(), e.getMessage());
    }
}
