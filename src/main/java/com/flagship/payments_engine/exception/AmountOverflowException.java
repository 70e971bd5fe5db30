package com.flagship.payments_engine.exception;

/**
 * Thrown when a monetary value or the result of amount arithmetic falls outside the
 * fixed-point range.
 */
public class AmountOverflowException extends LedgerException {

    public AmountOverflowException(String message) {
        super(message);
    }

    public AmountOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
