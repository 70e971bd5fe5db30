package com.flagship.payments_engine.replay;

import com.flagship.payments_engine.exception.LedgerException;
import com.flagship.payments_engine.ledger.ApplyResult;
import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.ledger.TransactionCache;
import com.flagship.payments_engine.observability.LedgerMetrics;
import com.flagship.payments_engine.record.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.stream.Collectors;

/**
 * Drives a fresh {@link LedgerEngine} over a stream of records.
 *
 * Fatal-vs-skip policy:
 * - skipped records are logged at DEBUG, counted, and the stream continues
 * - the first fatal condition (from the engine or from the record source) ends the replay
 *   immediately; no further record is read
 *
 * Either way the report carries the account snapshot held by the engine at that point.
 */
@Service
@Slf4j
public class LedgerReplayService {

    private final LedgerMetrics metrics;
    private final boolean verifyDisputeClient;

    public LedgerReplayService(LedgerMetrics metrics,
                               @Value("${ledger.dispute.verify-client:true}") boolean verifyDisputeClient) {
        this.metrics = metrics;
        this.verifyDisputeClient = verifyDisputeClient;
    }

    /**
     * Replays all records in order.
     *
     * @param records record source; a {@link LedgerException} thrown while reading it is treated
     *                like a fatal record
     * @return the final (or abort-time) snapshot and counters
     */
    public ReplayReport replay(Iterator<TransactionRecord> records) {
        return metrics.timeReplay(() -> replayAll(records));
    }

    /**
     * Reports a replay that failed before any record could be read, such as an unreadable header.
     *
     * @return an aborted report with no accounts
     */
    public ReplayReport abortUnread(LedgerException failure) {
        return abort(new LedgerEngine(new TransactionCache(), verifyDisputeClient), 0, 0, failure);
    }

    private ReplayReport replayAll(Iterator<TransactionRecord> records) {
        LedgerEngine engine = new LedgerEngine(new TransactionCache(), verifyDisputeClient);
        long applied = 0;
        long skipped = 0;

        while (true) {
            TransactionRecord record;
            try {
                if (!records.hasNext()) {
                    break;
                }
                record = records.next();
            } catch (LedgerException e) {
                return abort(engine, applied, skipped, e);
            }

            ApplyResult result = engine.apply(record);
            switch (result.getStatus()) {
                case APPLIED -> {
                    applied++;
                    metrics.recordApplied(record.getType());
                }
                case SKIPPED -> {
                    skipped++;
                    log.debug("Skipped {} tx={} client={}: {}",
                            record.getType().getCode(), record.getTxId(), record.getClientId(),
                            result.getSkipReason());
                    metrics.recordSkipped(record.getType(), result.getSkipReason());
                }
                case FATAL -> {
                    return abort(engine, applied, skipped, result.getFailure());
                }
            }
        }

        log.info("Replay completed: {} records applied, {} skipped, {} accounts, {} cached transactions",
                applied, skipped, engine.accountCount(), engine.transactionCount());
        return ReplayReport.completed(engine.snapshot().collect(Collectors.toList()), applied, skipped);
    }

    private ReplayReport abort(LedgerEngine engine, long applied, long skipped, LedgerException failure) {
        log.error("Replay aborted after {} records ({} applied, {} skipped): {}",
                applied + skipped, applied, skipped, failure.getMessage());
        metrics.recordFatal(failure);
        return ReplayReport.aborted(engine.snapshot().collect(Collectors.toList()), applied, skipped, failure);
    }
}
