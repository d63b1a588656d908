package com.darfledger.observability;

import com.darfledger.event.LedgerRecomputedEvent;
import com.darfledger.exception.ErrorCode;
import com.darfledger.repository.LedgerSnapshotRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics of the ledger:
 * <ul>
 *   <li><b>ledger.recompute.count</b> (counter): successful recompute passes</li>
 *   <li><b>ledger.recompute.failures</b> (counter, tags errorCode and fatal): aborted passes</li>
 *   <li><b>ledger.operations.rejected</b> (counter): operations left out by validation</li>
 *   <li><b>ledger.recompute.duration</b> (timer): wall time of a pass, success or not</li>
 *   <li><b>ledger.snapshot.version</b> (gauge): version of the published snapshot</li>
 * </ul>
 */
@Service
public class LedgerMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter recomputeCounter;
    private final Counter rejectedOperationsCounter;
    private final Timer recomputeTimer;

    public LedgerMetricsService(MeterRegistry meterRegistry, LedgerSnapshotRepository snapshotRepository) {
        this.meterRegistry = meterRegistry;

        this.recomputeCounter = Counter.builder("ledger.recompute.count")
                .description("Recompute passes that published a snapshot")
                .register(meterRegistry);

        this.rejectedOperationsCounter = Counter.builder("ledger.operations.rejected")
                .description("Operations left out of a recompute pass by validation")
                .register(meterRegistry);

        this.recomputeTimer = Timer.builder("ledger.recompute.duration")
                .description("Wall time of a full recompute pass")
                .register(meterRegistry);

        meterRegistry.gauge("ledger.snapshot.version", snapshotRepository, LedgerSnapshotRepository::currentVersion);
    }

    public Timer.Sample startRecompute() {
        return Timer.start(meterRegistry);
    }

    public void stopRecompute(Timer.Sample sample) {
        sample.stop(recomputeTimer);
    }

    public void recordFailure(ErrorCode errorCode) {
        meterRegistry
                .counter(
                        "ledger.recompute.failures",
                        "errorCode", errorCode.getCode(),
                        "fatal", String.valueOf(errorCode.isFatal()))
                .increment();
    }

    @EventListener
    public void onLedgerRecomputed(LedgerRecomputedEvent event) {
        recomputeCounter.increment();
        rejectedOperationsCounter.increment(event.getRejectedCount());
    }
}
