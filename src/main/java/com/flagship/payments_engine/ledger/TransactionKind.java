package com.flagship.payments_engine.ledger;

/**
 * The kinds of money-moving transaction that are cached and can later be disputed.
 */
public enum TransactionKind {
    DEPOSIT,
    WITHDRAWAL
}
