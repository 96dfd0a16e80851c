package io.blockstore.core.net;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.blockstore.core.protocol.messages.BlockStoreRequest;
import io.blockstore.core.protocol.messages.BlockStoreResponse;
import io.blockstore.core.protocol.messages.ErrorReply;

/**
 * One framed socket message. Clients send {@code request}; the server answers
 * with the same {@code id} and exactly one of {@code response} or {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(long id, BlockStoreRequest request, BlockStoreResponse response, ErrorReply error) {

    public static Envelope request(long id, BlockStoreRequest request) {
        return new Envelope(id, request, null, null);
    }

    public static Envelope response(long id, BlockStoreResponse response) {
        return new Envelope(id, null, response, null);
    }

    public static Envelope error(long id, ErrorReply error) {
        return new Envelope(id, null, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
