package io.blockstore.core.net;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockstore.core.protocol.ErrorCode;
import io.blockstore.core.protocol.messages.BlockStoreRequest;
import io.blockstore.core.protocol.messages.BlockStoreResponse;
import io.blockstore.core.protocol.messages.ErrorReply;
import io.blockstore.core.protocol.messages.MessageJson;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.io.IOException;
import java.util.List;

/**
 * JSON text frames to {@link Envelope}s and back. A frame that does not
 * decode still yields an envelope (carrying the error and whatever id could
 * be read) so the server can answer it instead of dropping the connection.
 */
final class EnvelopeCodec extends MessageToMessageCodec<String, Envelope> {
    private static final ObjectMapper MAPPER = MessageJson.newMapper();

    @Override
    protected void encode(ChannelHandlerContext ctx, Envelope msg, List<Object> out) throws Exception {
        out.add(MAPPER.writeValueAsString(msg));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) {
        JsonNode node;
        try {
            node = MAPPER.readTree(msg);
        } catch (IOException e) {
            out.add(Envelope.error(0L, ErrorReply.of(MessageJson.decodeFailure(e))));
            return;
        }
        if (node == null || !node.isObject()) {
            out.add(Envelope.error(0L, new ErrorReply(ErrorCode.INVALID_REQUEST.wireName(), "Frame is not a JSON object")));
            return;
        }
        long id = node.path("id").asLong(0L);
        try {
            BlockStoreRequest request = node.hasNonNull("request")
                    ? MAPPER.treeToValue(node.get("request"), BlockStoreRequest.class) : null;
            BlockStoreResponse response = node.hasNonNull("response")
                    ? MAPPER.treeToValue(node.get("response"), BlockStoreResponse.class) : null;
            ErrorReply error = node.hasNonNull("error")
                    ? MAPPER.treeToValue(node.get("error"), ErrorReply.class) : null;
            out.add(new Envelope(id, request, response, error));
        } catch (IOException e) {
            out.add(Envelope.error(id, ErrorReply.of(MessageJson.decodeFailure(e))));
        }
    }
}
