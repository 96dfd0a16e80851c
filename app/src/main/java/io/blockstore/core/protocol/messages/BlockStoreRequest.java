package io.blockstore.core.protocol.messages;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.blockstore.core.protocol.Digest;

import java.util.List;

/**
 * Tagged union of everything a client can ask the block store.
 * The JSON "type" property names the active variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BlockStoreRequest.Reserved.class, name = "reserved_req"),
        @JsonSubTypes.Type(value = BlockStoreRequest.GetBlocksById.class, name = "get_blocks_by_id_req"),
        @JsonSubTypes.Type(value = BlockStoreRequest.GetBlocksByHeight.class, name = "get_blocks_by_height_req"),
        @JsonSubTypes.Type(value = BlockStoreRequest.AddBlock.class, name = "add_block_req"),
        @JsonSubTypes.Type(value = BlockStoreRequest.AddTransaction.class, name = "add_transaction_req"),
        @JsonSubTypes.Type(value = BlockStoreRequest.GetTransactionsById.class, name = "get_transactions_by_id_req")
})
public interface BlockStoreRequest {

    /** Placeholder for protocol extension; answered with an empty response. */
    record Reserved() implements BlockStoreRequest {}

    record GetBlocksById(List<Digest> blockId, boolean returnBlockBlob, boolean returnReceiptBlob)
            implements BlockStoreRequest {
        public GetBlocksById {
            blockId = blockId == null ? List.of() : List.copyOf(blockId);
        }
    }

    record GetBlocksByHeight(Digest headBlockId,
                             long ancestorStartHeight,
                             long numBlocks,
                             boolean returnBlockBlob,
                             boolean returnReceiptBlob) implements BlockStoreRequest {}

    /** A zero or missing previous id adds a genesis block. */
    record AddBlock(BlockItem blockToAdd, Digest previousBlockId) implements BlockStoreRequest {}

    record AddTransaction(Digest transactionId, byte[] transactionBlob) implements BlockStoreRequest {
        public AddTransaction {
            transactionBlob = transactionBlob == null ? new byte[0] : transactionBlob;
        }
    }

    record GetTransactionsById(List<Digest> transactionIds) implements BlockStoreRequest {
        public GetTransactionsById {
            transactionIds = transactionIds == null ? List.of() : List.copyOf(transactionIds);
        }
    }
}
