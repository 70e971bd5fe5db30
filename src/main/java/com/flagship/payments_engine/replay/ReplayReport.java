package com.flagship.payments_engine.replay;

import com.flagship.payments_engine.exception.LedgerException;
import com.flagship.payments_engine.ledger.Account;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of one replay: the final account snapshot plus record counters.
 *
 * When the replay was aborted, {@code accounts} is the state reached by the last
 * successfully applied record and {@code failure} is the reason for the abort.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReplayReport {
    List<Account> accounts;
    long appliedCount;
    long skippedCount;
    LedgerException failure;

    public static ReplayReport completed(List<Account> accounts, long appliedCount, long skippedCount) {
        return new ReplayReport(List.copyOf(accounts), appliedCount, skippedCount, null);
    }

    public static ReplayReport aborted(List<Account> accounts, long appliedCount, long skippedCount,
                                       LedgerException failure) {
        return new ReplayReport(List.copyOf(accounts), appliedCount, skippedCount, failure);
    }

    public boolean isAborted() {
        return failure != null;
    }
}
