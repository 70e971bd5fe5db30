package com.flagship.payments_engine.exception;

/**
 * Thrown when an input record cannot be turned into a valid transaction record.
 */
public class MalformedRecordException extends LedgerException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
