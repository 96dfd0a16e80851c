package io.blockstore.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockstore.core.engine.BlockStoreEngine;
import io.blockstore.core.metrics.RequestMetrics;
import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.ErrorCode;
import io.blockstore.core.protocol.messages.BlockStoreRequest;
import io.blockstore.core.protocol.messages.BlockStoreResponse;
import io.blockstore.core.protocol.messages.ErrorReply;
import io.blockstore.core.protocol.messages.MessageJson;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatches decoded requests to the engine. Every transport goes through
 * here so they agree on decoding, error mapping and request metrics.
 */
public final class RequestHandler {
    private static final Logger LOG = Logger.getLogger(RequestHandler.class.getName());

    private final BlockStoreEngine engine;
    private final ObjectMapper mapper;

    public RequestHandler(BlockStoreEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.mapper = MessageJson.newMapper();
    }

    public BlockStoreResponse handle(BlockStoreRequest request) {
        if (request instanceof BlockStoreRequest.GetBlocksById r) {
            return new BlockStoreResponse.GetBlocksById(
                    engine.getBlocksById(r.blockId(), r.returnBlockBlob(), r.returnReceiptBlob()));
        }
        if (request instanceof BlockStoreRequest.GetBlocksByHeight r) {
            return new BlockStoreResponse.GetBlocksByHeight(engine.getBlocksByHeight(
                    r.headBlockId(), r.ancestorStartHeight(), r.numBlocks(),
                    r.returnBlockBlob(), r.returnReceiptBlob()));
        }
        if (request instanceof BlockStoreRequest.AddBlock r) {
            engine.addBlock(r.blockToAdd(), r.previousBlockId());
            return new BlockStoreResponse.AddBlock();
        }
        if (request instanceof BlockStoreRequest.AddTransaction r) {
            engine.addTransaction(r.transactionId(), r.transactionBlob());
            return new BlockStoreResponse.AddTransaction();
        }
        if (request instanceof BlockStoreRequest.GetTransactionsById r) {
            return new BlockStoreResponse.GetTransactionsById(engine.getTransactionsById(r.transactionIds()));
        }
        if (request instanceof BlockStoreRequest.Reserved) {
            engine.reserved();
            return new BlockStoreResponse.Reserved();
        }
        throw new BlockStoreException(ErrorCode.UNKNOWN_REQUEST,
                "Unsupported request " + (request == null ? "null" : request.getClass().getSimpleName()));
    }

    /** Timed dispatch; {@code transport} tags the request timer. */
    public BlockStoreResponse handle(BlockStoreRequest request, String transport) {
        var sample = RequestMetrics.start();
        String outcome = ErrorReply.INTERNAL_ERROR;
        try {
            BlockStoreResponse response = handle(request);
            outcome = "ok";
            return response;
        } catch (BlockStoreException e) {
            outcome = e.code().wireName();
            throw e;
        } finally {
            RequestMetrics.stopRequest(sample, transport, variantName(request), outcome);
        }
    }

    public BlockStoreRequest decode(byte[] json) {
        try {
            return checkDecoded(mapper.readValue(json, BlockStoreRequest.class));
        } catch (IOException e) {
            throw MessageJson.decodeFailure(e);
        }
    }

    public BlockStoreRequest decode(InputStream json) {
        try {
            return checkDecoded(mapper.readValue(json, BlockStoreRequest.class));
        } catch (IOException e) {
            throw MessageJson.decodeFailure(e);
        }
    }

    public byte[] encode(Object message) {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decode, dispatch and encode one JSON request. Failures come back as an
     * encoded {@link ErrorReply} instead of being thrown.
     */
    public byte[] handleJson(byte[] json, String transport) {
        try {
            return encode(handle(decode(json), transport));
        } catch (RuntimeException e) {
            return encode(toErrorReply(e));
        }
    }

    /** Map any failure to its wire reply; anything but a {@link BlockStoreException} is logged. */
    public static ErrorReply toErrorReply(Throwable t) {
        if (t instanceof BlockStoreException e) {
            return ErrorReply.of(e);
        }
        LOG.log(Level.WARNING, "Unexpected failure while handling block store request", t);
        return new ErrorReply(ErrorReply.INTERNAL_ERROR, "Unexpected server error");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    static String variantName(BlockStoreRequest request) {
        if (request instanceof BlockStoreRequest.GetBlocksById) return "get_blocks_by_id_req";
        if (request instanceof BlockStoreRequest.GetBlocksByHeight) return "get_blocks_by_height_req";
        if (request instanceof BlockStoreRequest.AddBlock) return "add_block_req";
        if (request instanceof BlockStoreRequest.AddTransaction) return "add_transaction_req";
        if (request instanceof BlockStoreRequest.GetTransactionsById) return "get_transactions_by_id_req";
        if (request instanceof BlockStoreRequest.Reserved) return "reserved_req";
        return "unknown";
    }

    private static BlockStoreRequest checkDecoded(BlockStoreRequest request) {
        if (request == null) {
            throw BlockStoreException.invalid("Empty request");
        }
        return request;
    }
}
