package com.flagship.payments_engine.ledger;

import com.flagship.payments_engine.money.Amount;
import lombok.Value;

/**
 * A deposit or withdrawal that was applied to an account, kept for later disputes.
 *
 * The amount is signed: positive for deposits, negative for withdrawals.
 * State changes are immutable (a transition returns a new CachedTransaction).
 */
@Value
public class CachedTransaction {
    long txId;
    int clientId;
    Amount amount;
    TransactionKind kind;
    DisputeState disputeState;

    /**
     * Creates a freshly applied transaction in NONE state.
     */
    public static CachedTransaction applied(long txId, int clientId, Amount amount, TransactionKind kind) {
        boolean signMatchesKind = kind == TransactionKind.DEPOSIT
            ? !amount.isNegative()
            : amount.isNegative() || amount.isZero();
        if (!signMatchesKind) {
            throw new IllegalArgumentException(
                String.format("Amount %s has the wrong sign for a %s", amount, kind));
        }
        return new CachedTransaction(txId, clientId, amount, kind, DisputeState.NONE);
    }

    /**
     * Size of the disputed funds, regardless of the transaction kind.
     */
    public Amount magnitude() {
        return amount.abs();
    }

    /**
     * Transitions to DISPUTED. Only valid from NONE.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public CachedTransaction dispute() {
        if (disputeState != DisputeState.NONE) {
            throw new IllegalStateException(
                String.format("Cannot dispute transaction %d in %s state. Only NONE transactions can be disputed.",
                    txId, disputeState));
        }
        return withState(DisputeState.DISPUTED);
    }

    /**
     * Transitions to RESOLVED_FINAL. Only valid from DISPUTED.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public CachedTransaction resolve() {
        if (!isDisputed()) {
            throw new IllegalStateException(
                String.format("Cannot resolve transaction %d in %s state. Only DISPUTED transactions can be resolved.",
                    txId, disputeState));
        }
        return withState(DisputeState.RESOLVED_FINAL);
    }

    public boolean isDisputed() {
        return disputeState == DisputeState.DISPUTED;
    }

    public boolean canTransitionTo(DisputeState target) {
        return switch (disputeState) {
            case NONE -> target == DisputeState.DISPUTED;
            case DISPUTED -> target == DisputeState.RESOLVED_FINAL;
            case RESOLVED_FINAL -> false;
        };
    }

    private CachedTransaction withState(DisputeState state) {
        return new CachedTransaction(txId, clientId, amount, kind, state);
    }
}
