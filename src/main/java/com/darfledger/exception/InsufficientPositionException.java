package com.darfledger.exception;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Thrown when a sell exceeds the quantity held for the asset. Short selling is not modelled,
 * and clamping the sale would misstate the tax liability, so the whole recompute pass aborts.
 */
public class InsufficientPositionException extends BaseException {

    public InsufficientPositionException(
            String assetCode, BigDecimal requested, BigDecimal held, LocalDate operationDate) {
        super(
                ErrorCode.INSUFFICIENT_POSITION,
                String.format(
                        "Cannot sell %s %s on %s: only %s held",
                        requested.toPlainString(), assetCode, operationDate, held.toPlainString()),
                Map.of(
                        "assetCode", assetCode,
                        "requested", requested,
                        "held", held,
                        "operationDate", operationDate));
    }
}
