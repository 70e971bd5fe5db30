package com.flagship.payments_engine.ledger;

import com.flagship.payments_engine.exception.LedgerException;
import com.flagship.payments_engine.money.Amount;
import com.flagship.payments_engine.record.TransactionRecord;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Applies transaction records to client accounts, one at a time, in arrival order.
 *
 * This class enforces the account rules:
 * - deposits and withdrawals are rejected on locked accounts
 * - withdrawals never take available funds below zero
 * - a cached transaction goes NONE → DISPUTED → RESOLVED_FINAL, nothing else
 * - chargebacks lock the account; later disputes on older transactions still apply
 *
 * Rejected records come back as {@link ApplyResult#skipped(SkipReason)} and leave no trace.
 * Conditions that must end the run (duplicate transaction id, amount overflow) come back as
 * {@link ApplyResult#fatal(LedgerException)}; a fatal record has no partial effect because the
 * new account state and cache entry are only stored once all arithmetic succeeded.
 *
 * Single-threaded: a new engine is created for every replay and must not be shared.
 */
public class LedgerEngine {

    private final Map<Integer, Account> accounts = new TreeMap<>();
    private final TransactionCache transactions;
    private final boolean verifyDisputeClient;

    public LedgerEngine() {
        this(new TransactionCache(), true);
    }

    /**
     * @param verifyDisputeClient when true, dispute-chain records naming a client other than the
     *                            owner of the referenced transaction are skipped
     */
    public LedgerEngine(TransactionCache transactions, boolean verifyDisputeClient) {
        this.transactions = Objects.requireNonNull(transactions);
        this.verifyDisputeClient = verifyDisputeClient;
    }

    /**
     * Applies a single record.
     *
     * The client's account is opened on first reference, even if the record itself is skipped.
     * Never throws {@link LedgerException}; fatal conditions are returned.
     */
    public ApplyResult apply(TransactionRecord record) {
        Objects.requireNonNull(record, "record");
        Account account = accounts.computeIfAbsent(record.getClientId(), Account::open);
        try {
            return switch (record.getType()) {
                case DEPOSIT -> deposit(account, record);
                case WITHDRAWAL -> withdraw(account, record);
                case DISPUTE -> dispute(record);
                case RESOLVE -> resolve(record);
                case CHARGEBACK -> chargeBack(record);
            };
        } catch (LedgerException e) {
            return ApplyResult.fatal(e);
        }
    }

    /**
     * Point-in-time copy of every known account, ordered by client id.
     */
    public Stream<Account> snapshot() {
        return List.copyOf(accounts.values()).stream();
    }

    public Optional<Account> findAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public Optional<CachedTransaction> findTransaction(long txId) {
        return transactions.get(txId);
    }

    public int accountCount() {
        return accounts.size();
    }

    public int transactionCount() {
        return transactions.size();
    }

    private ApplyResult deposit(Account account, TransactionRecord record) {
        if (account.isLocked()) {
            return ApplyResult.skipped(SkipReason.ACCOUNT_LOCKED);
        }
        Amount amount = record.getAmount();
        Account updated = account.deposit(amount);
        transactions.put(record.getTxId(), record.getClientId(), amount, TransactionKind.DEPOSIT);
        accounts.put(updated.getClientId(), updated);
        return ApplyResult.applied();
    }

    private ApplyResult withdraw(Account account, TransactionRecord record) {
        if (account.isLocked()) {
            return ApplyResult.skipped(SkipReason.ACCOUNT_LOCKED);
        }
        Amount amount = record.getAmount();
        if (!account.canCover(amount)) {
            return ApplyResult.skipped(SkipReason.INSUFFICIENT_FUNDS);
        }
        Account updated = account.withdraw(amount);
        transactions.put(record.getTxId(), record.getClientId(), amount.negate(), TransactionKind.WITHDRAWAL);
        accounts.put(updated.getClientId(), updated);
        return ApplyResult.applied();
    }

    private ApplyResult dispute(TransactionRecord record) {
        Optional<CachedTransaction> target = transactions.get(record.getTxId());
        Optional<SkipReason> rejection = checkTarget(record, target, DisputeState.DISPUTED);
        if (rejection.isPresent()) {
            return ApplyResult.skipped(rejection.get());
        }
        CachedTransaction entry = target.get();
        Account updated = ownerOf(entry).hold(entry.magnitude());
        transactions.markDisputed(entry.getTxId());
        accounts.put(updated.getClientId(), updated);
        return ApplyResult.applied();
    }

    private ApplyResult resolve(TransactionRecord record) {
        Optional<CachedTransaction> target = transactions.get(record.getTxId());
        Optional<SkipReason> rejection = checkTarget(record, target, DisputeState.RESOLVED_FINAL);
        if (rejection.isPresent()) {
            return ApplyResult.skipped(rejection.get());
        }
        CachedTransaction entry = target.get();
        Account updated = ownerOf(entry).release(entry.magnitude());
        transactions.markResolved(entry.getTxId());
        accounts.put(updated.getClientId(), updated);
        return ApplyResult.applied();
    }

    private ApplyResult chargeBack(TransactionRecord record) {
        Optional<CachedTransaction> target = transactions.get(record.getTxId());
        Optional<SkipReason> rejection = checkTarget(record, target, DisputeState.RESOLVED_FINAL);
        if (rejection.isPresent()) {
            return ApplyResult.skipped(rejection.get());
        }
        CachedTransaction entry = target.get();
        Account updated = ownerOf(entry).chargeBack(entry.magnitude());
        transactions.markResolved(entry.getTxId());
        accounts.put(updated.getClientId(), updated);
        return ApplyResult.applied();
    }

    private Optional<SkipReason> checkTarget(TransactionRecord record, Optional<CachedTransaction> target,
                                             DisputeState nextState) {
        if (target.isEmpty()) {
            return Optional.of(SkipReason.UNKNOWN_TRANSACTION);
        }
        CachedTransaction entry = target.get();
        if (verifyDisputeClient && entry.getClientId() != record.getClientId()) {
            return Optional.of(SkipReason.CLIENT_MISMATCH);
        }
        if (!entry.canTransitionTo(nextState)) {
            return Optional.of(SkipReason.INVALID_DISPUTE_STATE);
        }
        return Optional.empty();
    }

    // Cached transactions always belong to an account opened before them.
    private Account ownerOf(CachedTransaction entry) {
        Account owner = accounts.get(entry.getClientId());
        if (owner == null) {
            throw new IllegalStateException(
                String.format("Transaction %d references unknown client %d", entry.getTxId(), entry.getClientId()));
        }
        return owner;
    }
}
