package com.flagship.payments_engine.exception;

import lombok.Getter;

/**
 * Thrown when a deposit or withdrawal reuses a transaction id that is already cached.
 */
@Getter
public class DuplicateTransactionException extends LedgerException {

    private final long txId;

    public DuplicateTransactionException(long txId) {
        super("Duplicate transaction id: " + txId);
        this.txId = txId;
    }
}
