package com.darfledger.tax;

import com.darfledger.domain.model.LossCarryState;
import com.darfledger.domain.model.TaxComputation;
import java.time.YearMonth;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Tax computations of every bucket, with the loss carry balances left after the last month. */
@Value
@Builder
public class TaxRun {

    List<TaxComputation> computations;
    LossCarryState closingLossCarry;

    public List<TaxComputation> forMonth(YearMonth month) {
        return computations.stream()
                .filter(c -> c.getYearMonth().equals(month))
                .toList();
    }
}
