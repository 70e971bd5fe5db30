package com.flagship.payments_engine.record;

import com.flagship.payments_engine.exception.MalformedRecordException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Record types accepted by the engine, with their wire codes.
 */
public enum RecordType {
    DEPOSIT("deposit", true),
    WITHDRAWAL("withdrawal", true),
    DISPUTE("dispute", false),
    RESOLVE("resolve", false),
    CHARGEBACK("chargeback", false);

    private final String code;
    private final boolean carriesAmount;

    RecordType(String code, boolean carriesAmount) {
        this.code = code;
        this.carriesAmount = carriesAmount;
    }

    public String getCode() {
        return code;
    }

    /**
     * Deposits and withdrawals carry an amount; dispute-chain records reference an earlier one.
     */
    public boolean carriesAmount() {
        return carriesAmount;
    }

    /**
     * @throws MalformedRecordException if the code is not a known record type
     */
    public static RecordType fromCode(String code) {
        if (code == null) {
            throw new MalformedRecordException("Record type is missing");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.code.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new MalformedRecordException("Unknown record type: " + code));
    }
}
