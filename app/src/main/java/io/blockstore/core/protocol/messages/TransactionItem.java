package io.blockstore.core.protocol.messages;

import io.blockstore.core.protocol.Digest;

public record TransactionItem(Digest transactionId, byte[] transactionBlob) {
    public TransactionItem {
        transactionBlob = transactionBlob == null ? new byte[0] : transactionBlob;
    }
}
