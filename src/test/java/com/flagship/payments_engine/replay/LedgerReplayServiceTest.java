package com.flagship.payments_engine.replay;

import com.flagship.payments_engine.exception.DuplicateTransactionException;
import com.flagship.payments_engine.exception.MalformedRecordException;
import com.flagship.payments_engine.ledger.Account;
import com.flagship.payments_engine.money.Amount;
import com.flagship.payments_engine.observability.LedgerMetrics;
import com.flagship.payments_engine.record.TransactionRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replay loop tests.
 *
 * These tests verify that:
 * - Skipped records are counted and the stream continues
 * - The first fatal record stops the replay and nothing after it is read
 * - The report carries the snapshot reached before the abort
 */
class LedgerReplayServiceTest {

    private SimpleMeterRegistry registry;
    private LedgerReplayService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new LedgerReplayService(new LedgerMetrics(registry), true);
    }

    private static Amount amount(String value) {
        return Amount.parse(value);
    }

    private double counter(String name, String tagKey, String tagValue) {
        return registry.find(name).tag(tagKey, tagValue).counters().stream()
            .mapToDouble(c -> c.count())
            .sum();
    }

    @Test
    @DisplayName("A clean stream completes with applied and skipped counts")
    void testCompletedReplay() {
        List<TransactionRecord> records = List.of(
            TransactionRecord.deposit(1, 1, amount("10")),
            TransactionRecord.withdrawal(1, 2, amount("15")),
            TransactionRecord.dispute(1, 99),
            TransactionRecord.deposit(2, 3, amount("1")),
            TransactionRecord.dispute(2, 3)
        );

        ReplayReport report = service.replay(records.iterator());

        assertFalse(report.isAborted());
        assertNull(report.getFailure());
        assertEquals(3, report.getAppliedCount());
        assertEquals(2, report.getSkippedCount());
        assertEquals(2, report.getAccounts().size());

        Account client2 = report.getAccounts().get(1);
        assertEquals(2, client2.getClientId());
        assertEquals(amount("1"), client2.getHeld());

        assertEquals(2.0, counter("ledger.records.applied", "type", "deposit"));
        assertEquals(1.0, counter("ledger.records.skipped", "reason", "insufficient_funds"));
        assertEquals(1.0, counter("ledger.records.skipped", "reason", "unknown_transaction"));
        assertEquals(1L, registry.get("ledger.replay.duration").timer().count());
    }

    @Test
    @DisplayName("A duplicate transaction id aborts the replay; later records are not read")
    void testAbortOnDuplicate() {
        AtomicInteger consumed = new AtomicInteger();
        Iterator<TransactionRecord> source = List.of(
            TransactionRecord.deposit(1, 1, amount("10")),
            TransactionRecord.deposit(1, 1, amount("5")),
            TransactionRecord.deposit(1, 2, amount("7"))
        ).iterator();
        Iterator<TransactionRecord> counting = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public TransactionRecord next() {
                consumed.incrementAndGet();
                return source.next();
            }
        };

        ReplayReport report = service.replay(counting);

        assertTrue(report.isAborted());
        assertInstanceOf(DuplicateTransactionException.class, report.getFailure());
        assertEquals(2, consumed.get());
        assertEquals(1, report.getAppliedCount());
        assertEquals(amount("10"), report.getAccounts().get(0).getTotal());
        assertEquals(1.0, counter("ledger.records.fatal", "error", "DuplicateTransactionException"));
    }

    @Test
    @DisplayName("A malformed record from the source aborts the replay with the state reached so far")
    void testAbortOnMalformedSource() {
        Iterator<TransactionRecord> source = new Iterator<>() {
            private int position;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public TransactionRecord next() {
                if (position++ == 0) {
                    return TransactionRecord.deposit(3, 1, amount("2.5"));
                }
                throw new MalformedRecordException("Record 2: Unknown record type: transfer");
            }
        };

        ReplayReport report = service.replay(source);

        assertTrue(report.isAborted());
        assertInstanceOf(MalformedRecordException.class, report.getFailure());
        assertEquals(1, report.getAccounts().size());
        assertEquals(amount("2.5"), report.getAccounts().get(0).getAvailable());
    }

    @Test
    @DisplayName("Client verification can be switched off")
    void testTrustingDisputeClient() {
        LedgerReplayService trusting = new LedgerReplayService(new LedgerMetrics(registry), false);
        List<TransactionRecord> records = List.of(
            TransactionRecord.deposit(1, 1, amount("10")),
            TransactionRecord.dispute(2, 1)
        );

        ReplayReport strict = service.replay(records.iterator());
        ReplayReport trusted = trusting.replay(records.iterator());

        assertEquals(1, strict.getSkippedCount());
        assertEquals(Amount.ZERO, strict.getAccounts().get(0).getHeld());
        assertEquals(0, trusted.getSkippedCount());
        assertEquals(amount("10"), trusted.getAccounts().get(0).getHeld());
    }

    @Test
    @DisplayName("A failure before the first record is counted as fatal with no accounts")
    void testAbortUnread() {
        MalformedRecordException failure = new MalformedRecordException("Unreadable CSV header: missing quote");

        ReplayReport report = service.abortUnread(failure);

        assertTrue(report.isAborted());
        assertSame(failure, report.getFailure());
        assertTrue(report.getAccounts().isEmpty());
        assertEquals(0, report.getAppliedCount());
        assertEquals(1.0, counter("ledger.records.fatal", "error", "MalformedRecordException"));
    }
}
