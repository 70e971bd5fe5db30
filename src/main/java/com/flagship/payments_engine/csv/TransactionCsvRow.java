package com.flagship.payments_engine.csv;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw CSV row as read from the input, before any validation.
 * Column names follow the input header {@code type,client,tx,amount}.
 */
@Data
@NoArgsConstructor
public class TransactionCsvRow {
    private String type;
    private String client;
    private String tx;
    private String amount;
}
