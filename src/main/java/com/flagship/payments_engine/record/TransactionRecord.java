package com.flagship.payments_engine.record;

import com.flagship.payments_engine.exception.MalformedRecordException;
import com.flagship.payments_engine.money.Amount;
import lombok.Value;

/**
 * One input record fed to the ledger engine.
 *
 * Invariant: deposits and withdrawals carry a non-negative amount;
 * disputes, resolves and chargebacks carry none.
 */
@Value
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    RecordType type;
    int clientId;
    long txId;
    Amount amount;

    private TransactionRecord(RecordType type, int clientId, long txId, Amount amount) {
        this.type = type;
        this.clientId = clientId;
        this.txId = txId;
        this.amount = amount;
    }

    /**
     * Validates the record shape and creates the record.
     *
     * @param amount the amount, or null for dispute-chain records
     * @throws MalformedRecordException if any field violates the record shape
     */
    public static TransactionRecord of(RecordType type, long clientId, long txId, Amount amount) {
        if (type == null) {
            throw new MalformedRecordException("Record type is required");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new MalformedRecordException(
                String.format("Client id %d is outside [0, %d]", clientId, MAX_CLIENT_ID));
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new MalformedRecordException(
                String.format("Transaction id %d is outside [0, %d]", txId, MAX_TX_ID));
        }
        if (type.carriesAmount()) {
            if (amount == null) {
                throw new MalformedRecordException(
                    String.format("%s %d has no amount", type.getCode(), txId));
            }
            if (amount.isNegative()) {
                throw new MalformedRecordException(
                    String.format("%s %d has negative amount %s", type.getCode(), txId, amount));
            }
        } else if (amount != null) {
            throw new MalformedRecordException(
                String.format("%s %d must not carry an amount", type.getCode(), txId));
        }
        return new TransactionRecord(type, (int) clientId, txId, amount);
    }

    public static TransactionRecord deposit(int clientId, long txId, Amount amount) {
        return of(RecordType.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionRecord withdrawal(int clientId, long txId, Amount amount) {
        return of(RecordType.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionRecord dispute(int clientId, long txId) {
        return of(RecordType.DISPUTE, clientId, txId, null);
    }

    public static TransactionRecord resolve(int clientId, long txId) {
        return of(RecordType.RESOLVE, clientId, txId, null);
    }

    public static TransactionRecord chargeback(int clientId, long txId) {
        return of(RecordType.CHARGEBACK, clientId, txId, null);
    }
}
