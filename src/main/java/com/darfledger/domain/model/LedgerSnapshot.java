package com.darfledger.domain.model;

import com.darfledger.ledger.RecomputeResult;
import com.darfledger.tax.TaxRun;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one recompute pass produced. Immutable once built, so it can be handed to any
 * number of concurrent readers after publication.
 */
@Value
@Builder
public class LedgerSnapshot {

    long version;
    Instant computedAt;
    int operationCount;
    RecomputeResult recompute;
    List<MonthlyBucket> buckets;
    TaxRun taxRun;
}
