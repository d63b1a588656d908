package com.darfledger.reporting;

import com.darfledger.domain.model.LedgerSnapshot;
import com.darfledger.domain.model.TaxComputation;
import com.darfledger.exception.ValidationException;
import com.darfledger.repository.LedgerSnapshotRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-only queries over the published ledger snapshot.
 *
 * <p>Never recomputes and never mutates: it reads whatever snapshot is current at call time,
 * so calls are safe to repeat and to run concurrently with a recompute. Before the first
 * publish every month reports no obligation.
 */
@Service
public class DarfReporter {

    private static final Logger log = LoggerFactory.getLogger(DarfReporter.class);

    private final LedgerSnapshotRepository snapshotRepository;

    public DarfReporter(LedgerSnapshotRepository snapshotRepository) {
        this.snapshotRepository = snapshotRepository;
    }

    /**
     * Returns every tax computation of the month plus the grand total payable.
     *
     * @throws ValidationException if month is outside 1..12
     */
    public DarfReport query(int year, int month) {
        if (month < 1 || month > 12) {
            throw new ValidationException("Month must be between 1 and 12", Map.of("month", month));
        }
        return query(YearMonth.of(year, month));
    }

    public DarfReport query(YearMonth yearMonth) {
        return snapshotRepository
                .current()
                .map(snapshot -> report(yearMonth, snapshot.getTaxRun().forMonth(yearMonth), snapshot.getComputedAt()))
                .orElseGet(() -> report(yearMonth, List.of(), null));
    }

    /** Monthly reports of a calendar year, for months that had at least one sell. */
    public List<DarfReport> queryYear(int year) {
        LedgerSnapshot snapshot = snapshotRepository.current().orElse(null);
        if (snapshot == null) {
            return List.of();
        }

        TreeSet<YearMonth> months = new TreeSet<>();
        snapshot.getTaxRun().getComputations().stream()
                .map(TaxComputation::getYearMonth)
                .filter(ym -> ym.getYear() == year)
                .forEach(months::add);

        List<DarfReport> reports = new ArrayList<>(months.size());
        for (YearMonth month : months) {
            reports.add(report(month, snapshot.getTaxRun().forMonth(month), snapshot.getComputedAt()));
        }
        log.debug("Year {} has {} month(s) with sells", year, reports.size());
        return reports;
    }

    static DarfReport report(YearMonth yearMonth, List<TaxComputation> items, Instant computedAt) {
        return DarfReport.builder()
                .yearMonth(yearMonth)
                .items(List.copyOf(items))
                .totalDue(sum(items, TaxComputation::getNetTaxDue))
                .totalTaxDue(sum(items, TaxComputation::getTaxDue))
                .totalIrRetained(sum(items, TaxComputation::getIrRetained))
                .computedAt(computedAt)
                .build();
    }

    private static BigDecimal sum(List<TaxComputation> items, Function<TaxComputation, BigDecimal> field) {
        return items.stream()
                .map(field)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
