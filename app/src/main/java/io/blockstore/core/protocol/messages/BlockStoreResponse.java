package io.blockstore.core.protocol.messages;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BlockStoreResponse.Reserved.class, name = "reserved_resp"),
        @JsonSubTypes.Type(value = BlockStoreResponse.GetBlocksById.class, name = "get_blocks_by_id_resp"),
        @JsonSubTypes.Type(value = BlockStoreResponse.GetBlocksByHeight.class, name = "get_blocks_by_height_resp"),
        @JsonSubTypes.Type(value = BlockStoreResponse.AddBlock.class, name = "add_block_resp"),
        @JsonSubTypes.Type(value = BlockStoreResponse.AddTransaction.class, name = "add_transaction_resp"),
        @JsonSubTypes.Type(value = BlockStoreResponse.GetTransactionsById.class, name = "get_transactions_by_id_resp")
})
public interface BlockStoreResponse {

    record Reserved() implements BlockStoreResponse {}

    record GetBlocksById(List<BlockItem> blockItems) implements BlockStoreResponse {
        public GetBlocksById {
            blockItems = blockItems == null ? List.of() : List.copyOf(blockItems);
        }
    }

    record GetBlocksByHeight(List<BlockItem> blockItems) implements BlockStoreResponse {
        public GetBlocksByHeight {
            blockItems = blockItems == null ? List.of() : List.copyOf(blockItems);
        }
    }

    record AddBlock() implements BlockStoreResponse {}

    record AddTransaction() implements BlockStoreResponse {}

    record GetTransactionsById(List<TransactionItem> transactionItems) implements BlockStoreResponse {
        public GetTransactionsById {
            transactionItems = transactionItems == null ? List.of() : List.copyOf(transactionItems);
        }
    }
}
