package com.flagship.payments_engine.exception;

/**
 * Base type for every condition that aborts a replay.
 *
 * A LedgerException means the run cannot continue: no further records are applied and the
 * account state reached so far is reported as-is. Records that are merely rejected
 * (insufficient funds, locked account, invalid dispute target) never raise one of these.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
