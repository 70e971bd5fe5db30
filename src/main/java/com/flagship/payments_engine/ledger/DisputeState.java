package com.flagship.payments_engine.ledger;

/**
 * Dispute lifecycle of a cached transaction.
 *
 * NONE → DISPUTED → RESOLVED_FINAL. There is no way back from RESOLVED_FINAL.
 */
public enum DisputeState {
    /**
     * Applied and never disputed.
     * Initial state for every cached transaction.
     */
    NONE,

    /**
     * Under dispute; its funds are held.
     * Can transition to RESOLVED_FINAL through a resolve or a chargeback.
     */
    DISPUTED,

    /**
     * Dispute closed by a resolve or a chargeback.
     * Terminal state - the transaction cannot be disputed again.
     */
    RESOLVED_FINAL
}
