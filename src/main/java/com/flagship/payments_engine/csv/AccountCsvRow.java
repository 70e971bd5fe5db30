package com.flagship.payments_engine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.payments_engine.ledger.Account;
import lombok.Value;

/**
 * Output row for one account. Amounts are rendered with four fractional digits.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountCsvRow {
    int client;
    String available;
    String held;
    String total;
    boolean locked;

    public static AccountCsvRow from(Account account) {
        return new AccountCsvRow(
            account.getClientId(),
            account.getAvailable().toString(),
            account.getHeld().toString(),
            account.getTotal().toString(),
            account.isLocked()
        );
    }
}
