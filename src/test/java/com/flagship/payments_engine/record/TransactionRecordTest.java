package com.flagship.payments_engine.record;

import com.flagship.payments_engine.exception.MalformedRecordException;
import com.flagship.payments_engine.money.Amount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRecordTest {

    @Test
    @DisplayName("Record type codes are matched case-insensitively")
    void testRecordTypeCodes() {
        assertEquals(RecordType.DEPOSIT, RecordType.fromCode("deposit"));
        assertEquals(RecordType.CHARGEBACK, RecordType.fromCode(" Chargeback "));
        assertTrue(RecordType.WITHDRAWAL.carriesAmount());
        assertFalse(RecordType.RESOLVE.carriesAmount());

        MalformedRecordException exception = assertThrows(MalformedRecordException.class,
            () -> RecordType.fromCode("transfer"));
        assertTrue(exception.getMessage().contains("transfer"));
        assertThrows(MalformedRecordException.class, () -> RecordType.fromCode(null));
    }

    @Test
    @DisplayName("Deposits and withdrawals require a non-negative amount")
    void testAmountRequired() {
        TransactionRecord zero = TransactionRecord.deposit(1, 1, Amount.ZERO);
        assertEquals(Amount.ZERO, zero.getAmount());

        assertThrows(MalformedRecordException.class, () -> TransactionRecord.deposit(1, 1, null));
        assertThrows(MalformedRecordException.class, () -> TransactionRecord.withdrawal(1, 1, null));
        assertThrows(MalformedRecordException.class,
            () -> TransactionRecord.withdrawal(1, 1, Amount.parse("-1")));
    }

    @Test
    @DisplayName("Dispute-chain records must not carry an amount")
    void testNoAmountOnDisputeChain() {
        TransactionRecord dispute = TransactionRecord.dispute(4, 9);
        assertEquals(RecordType.DISPUTE, dispute.getType());
        assertNull(dispute.getAmount());

        assertThrows(MalformedRecordException.class,
            () -> TransactionRecord.of(RecordType.RESOLVE, 1, 1, Amount.parse("1")));
    }

    @Test
    @DisplayName("Client ids are 16-bit and transaction ids 32-bit unsigned")
    void testIdRanges() {
        TransactionRecord max = TransactionRecord.of(RecordType.CHARGEBACK, 65535, 4294967295L, null);
        assertEquals(65535, max.getClientId());
        assertEquals(4294967295L, max.getTxId());

        assertThrows(MalformedRecordException.class,
            () -> TransactionRecord.of(RecordType.DISPUTE, 65536, 1, null));
        assertThrows(MalformedRecordException.class,
            () -> TransactionRecord.of(RecordType.DISPUTE, -1, 1, null));
        assertThrows(MalformedRecordException.class,
            () -> TransactionRecord.of(RecordType.DISPUTE, 1, 4294967296L, null));
        assertThrows(MalformedRecordException.class,
            () -> TransactionRecord.of(null, 1, 1, null));
    }
}
