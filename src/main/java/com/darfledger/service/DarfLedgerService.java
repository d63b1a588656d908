package com.darfledger.service;

import com.darfledger.domain.model.LedgerSnapshot;
import com.darfledger.domain.model.MonthlyBucket;
import com.darfledger.domain.model.Operation;
import com.darfledger.event.EventPublisherHelper;
import com.darfledger.exception.BaseException;
import com.darfledger.ledger.PositionTracker;
import com.darfledger.ledger.RecomputeResult;
import com.darfledger.observability.LedgerMetricsService;
import com.darfledger.repository.LedgerSnapshotRepository;
import com.darfledger.repository.OperationStore;
import com.darfledger.tax.MonthlyAggregator;
import com.darfledger.tax.TaxRuleBook;
import com.darfledger.tax.TaxRuleEngine;
import com.darfledger.tax.TaxRun;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the full ledger pipeline and publishes its result.
 *
 * <p>One pass: load the whole history from the {@link OperationStore}, replay it through the
 * {@link PositionTracker}, aggregate sells into monthly buckets, fold the buckets through the
 * {@link TaxRuleEngine}, then publish a new immutable {@link LedgerSnapshot}.
 *
 * <p><b>Thread safety:</b> {@link #recompute()} runs under the {@link LedgerWriteLock} shared
 * with {@link OperationService}, so two passes never interleave and no store change slips in
 * between a write and the recompute that follows it. Each pass builds its positions and loss
 * carry state from scratch and the snapshot is swapped in atomically; readers go through
 * {@link LedgerSnapshotRepository} without locking. A pass that throws publishes nothing and
 * the previous snapshot stays current.
 */
@Service
public class DarfLedgerService {

    private static final Logger log = LoggerFactory.getLogger(DarfLedgerService.class);

    private final OperationStore operationStore;
    private final PositionTracker positionTracker;
    private final MonthlyAggregator monthlyAggregator;
    private final TaxRuleEngine taxRuleEngine;
    private final TaxRuleBook taxRuleBook;
    private final LedgerSnapshotRepository snapshotRepository;
    private final EventPublisherHelper eventPublisherHelper;
    private final LedgerMetricsService ledgerMetricsService;
    private final LedgerWriteLock ledgerWriteLock;

    public DarfLedgerService(
            OperationStore operationStore,
            PositionTracker positionTracker,
            MonthlyAggregator monthlyAggregator,
            TaxRuleEngine taxRuleEngine,
            TaxRuleBook taxRuleBook,
            LedgerSnapshotRepository snapshotRepository,
            EventPublisherHelper eventPublisherHelper,
            LedgerMetricsService ledgerMetricsService,
            LedgerWriteLock ledgerWriteLock) {
        this.operationStore = operationStore;
        this.positionTracker = positionTracker;
        this.monthlyAggregator = monthlyAggregator;
        this.taxRuleEngine = taxRuleEngine;
        this.taxRuleBook = taxRuleBook;
        this.snapshotRepository = snapshotRepository;
        this.eventPublisherHelper = eventPublisherHelper;
        this.ledgerMetricsService = ledgerMetricsService;
        this.ledgerWriteLock = ledgerWriteLock;
    }

    /**
     * Recomputes positions and taxes from the complete operation history.
     *
     * @return the newly published snapshot
     * @throws BaseException with a fatal error code (insufficient position, ordering violation,
     *     configuration error) when the pass aborts
     */
    public LedgerSnapshot recompute() {
        return ledgerWriteLock.execute(this::recomputeLocked);
    }

    private LedgerSnapshot recomputeLocked() {
        LedgerSnapshot snapshot = computeAndPublish();
        eventPublisherHelper.publishLedgerRecomputed(this, snapshot);
        return snapshot;
    }

    private LedgerSnapshot computeAndPublish() {
        Timer.Sample sample = ledgerMetricsService.startRecompute();
        try {
            List<Operation> operations = operationStore.findAll();
            LedgerSnapshot snapshot = compute(operations, snapshotRepository.currentVersion() + 1);
            RecomputeResult result = snapshot.getRecompute();

            snapshotRepository.publish(snapshot);

            log.info(
                    "Ledger recomputed: version={}, operations={}, rejected={}, sells={}, buckets={}",
                    snapshot.getVersion(),
                    operations.size(),
                    result.getRejections().size(),
                    result.getRealized().size(),
                    snapshot.getBuckets().size());
            return snapshot;
        } catch (BaseException ex) {
            if (ex.getErrorCode().isFatal()) {
                log.error("Ledger recompute aborted [{}]: {}", ex.getErrorCode().getCode(), ex.getMessage());
            } else {
                log.warn("Ledger recompute rejected [{}]: {}", ex.getErrorCode().getCode(), ex.getMessage());
            }
            ledgerMetricsService.recordFailure(ex.getErrorCode());
            throw ex;
        } finally {
            ledgerMetricsService.stopRecompute(sample);
        }
    }

    /**
     * Runs the pipeline over a candidate history without publishing anything. Used to check
     * that a change to the store leaves a history the ledger can still replay.
     *
     * @throws BaseException if the candidate history would abort a recompute
     */
    public LedgerSnapshot dryRun(List<Operation> operations) {
        return compute(operations, snapshotRepository.currentVersion());
    }

    public Optional<LedgerSnapshot> currentSnapshot() {
        return snapshotRepository.current();
    }

    private LedgerSnapshot compute(List<Operation> operations, long version) {
        RecomputeResult result = positionTracker.recompute(operations);
        List<MonthlyBucket> buckets = monthlyAggregator.aggregate(result.getRealized());
        TaxRun taxRun = taxRuleEngine.computeTaxes(buckets, taxRuleBook);

        return LedgerSnapshot.builder()
                .version(version)
                .computedAt(Instant.now())
                .operationCount(operations.size())
                .recompute(result)
                .buckets(buckets)
                .taxRun(taxRun)
                .build();
    }
}
