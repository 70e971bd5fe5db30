package com.flagship.payments_engine.ledger;

/**
 * Why a record was rejected without aborting the run.
 */
public enum SkipReason {
    INSUFFICIENT_FUNDS,
    ACCOUNT_LOCKED,
    UNKNOWN_TRANSACTION,
    INVALID_DISPUTE_STATE,
    CLIENT_MISMATCH
}
