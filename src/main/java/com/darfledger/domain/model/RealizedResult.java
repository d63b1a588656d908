package com.darfledger.domain.model;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.vo.Lane;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import lombok.Builder;
import lombok.Value;

/** Gain or loss realized by one sell, frozen at the moment the sell was replayed. */
@Value
@Builder
public class RealizedResult {

    String operationId;
    String assetCode;
    AssetType assetType;
    TradeCategory tradeCategory;
    LocalDate operationDate;
    BigDecimal quantity;
    BigDecimal proceeds;
    BigDecimal costBasisConsumed;

    /** proceeds - costBasisConsumed */
    BigDecimal gainLoss;

    BigDecimal irRetained;

    public YearMonth getYearMonth() {
        return YearMonth.from(operationDate);
    }

    public Lane getLane() {
        return Lane.of(assetType, tradeCategory);
    }
}
