package com.flagship.payments_engine.observability;

import com.flagship.payments_engine.ledger.SkipReason;
import com.flagship.payments_engine.record.RecordType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger replays.
 *
 * Metrics exposed:
 * - ledger.records.applied: Counter of applied records, tagged by record type
 * - ledger.records.skipped: Counter of rejected records, tagged by skip reason
 * - ledger.records.fatal: Counter of records that aborted a replay, tagged by error
 * - ledger.replay.duration: Timer for whole replays
 *
 * The engine keeps no audit trail of skipped records; these counters are the side channel.
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Timer replayTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.replayTimer = Timer.builder("ledger.replay.duration")
                .description("Time taken to replay a transaction stream")
                .register(registry);
    }

    public void recordApplied(RecordType type) {
        Counter.builder("ledger.records.applied")
                .description("Number of records applied to the ledger")
                .tag("type", type.getCode())
                .register(registry)
                .increment();
    }

    public void recordSkipped(RecordType type, SkipReason reason) {
        Counter.builder("ledger.records.skipped")
                .description("Number of records rejected without aborting the replay")
                .tag("type", type.getCode())
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordFatal(Exception error) {
        Counter.builder("ledger.records.fatal")
                .description("Number of records that aborted a replay")
                .tag("error", error.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    /**
     * Times a replay.
     */
    public <T> T timeReplay(Supplier<T> replay) {
        return replayTimer.record(replay);
    }
}
