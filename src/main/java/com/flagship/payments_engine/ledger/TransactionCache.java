package com.flagship.payments_engine.ledger;

import com.flagship.payments_engine.exception.DuplicateTransactionException;
import com.flagship.payments_engine.money.Amount;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only store of every deposit and withdrawal applied during a run.
 *
 * Entries are never evicted, so a dispute arriving at any point of the stream can be
 * resolved with an O(1) lookup. The price is memory proportional to the number of
 * money-moving records in the input: this is the main scalability limit of the engine.
 * A bounded-memory deployment would keep the put/get/mark contract and move the map
 * to an indexed external store.
 *
 * Not thread-safe; owned by a single {@link LedgerEngine}.
 */
public class TransactionCache {

    private final Map<Long, CachedTransaction> entries = new HashMap<>();

    /**
     * Caches a newly applied transaction in NONE state.
     *
     * @param amount signed amount, positive for deposits and negative for withdrawals
     * @return the cached entry
     * @throws DuplicateTransactionException if the transaction id is already cached
     */
    public CachedTransaction put(long txId, int clientId, Amount amount, TransactionKind kind) {
        if (contains(txId)) {
            throw new DuplicateTransactionException(txId);
        }
        CachedTransaction entry = CachedTransaction.applied(txId, clientId, amount, kind);
        entries.put(txId, entry);
        return entry;
    }

    public Optional<CachedTransaction> get(long txId) {
        return Optional.ofNullable(entries.get(txId));
    }

    public boolean contains(long txId) {
        return entries.containsKey(txId);
    }

    /**
     * @throws IllegalStateException if the transaction is unknown or not in NONE state
     */
    public CachedTransaction markDisputed(long txId) {
        CachedTransaction disputed = require(txId).dispute();
        entries.put(txId, disputed);
        return disputed;
    }

    /**
     * @throws IllegalStateException if the transaction is unknown or not DISPUTED
     */
    public CachedTransaction markResolved(long txId) {
        CachedTransaction resolved = require(txId).resolve();
        entries.put(txId, resolved);
        return resolved;
    }

    public int size() {
        return entries.size();
    }

    private CachedTransaction require(long txId) {
        CachedTransaction entry = entries.get(txId);
        if (entry == null) {
            throw new IllegalStateException("Transaction not cached: " + txId);
        }
        return entry;
    }
}
