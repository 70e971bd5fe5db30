package com.flagship.payments_engine.ledger;

import com.flagship.payments_engine.exception.LedgerException;

import java.util.Objects;

/**
 * Outcome of applying one record to the engine.
 *
 * APPLIED and SKIPPED let the run continue; FATAL carries the exception that must end it.
 */
public final class ApplyResult {

    public enum Status {
        APPLIED,
        SKIPPED,
        FATAL
    }

    private static final ApplyResult APPLIED = new ApplyResult(Status.APPLIED, null, null);

    private final Status status;
    private final SkipReason skipReason;
    private final LedgerException failure;

    private ApplyResult(Status status, SkipReason skipReason, LedgerException failure) {
        this.status = status;
        this.skipReason = skipReason;
        this.failure = failure;
    }

    public static ApplyResult applied() {
        return APPLIED;
    }

    public static ApplyResult skipped(SkipReason reason) {
        return new ApplyResult(Status.SKIPPED, Objects.requireNonNull(reason), null);
    }

    public static ApplyResult fatal(LedgerException failure) {
        return new ApplyResult(Status.FATAL, null, Objects.requireNonNull(failure));
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return the skip reason, or null unless SKIPPED
     */
    public SkipReason getSkipReason() {
        return skipReason;
    }

    /**
     * @return the fatal exception, or null unless FATAL
     */
    public LedgerException getFailure() {
        return failure;
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isFatal() {
        return status == Status.FATAL;
    }

    @Override
    public String toString() {
        return switch (status) {
            case APPLIED -> "APPLIED";
            case SKIPPED -> "SKIPPED(" + skipReason + ")";
            case FATAL -> "FATAL(" + failure.getMessage() + ")";
        };
    }
}
