package com.darfledger.ledger;

import com.darfledger.domain.model.Operation;
import com.darfledger.domain.model.Position;
import com.darfledger.domain.model.RealizedResult;
import com.darfledger.exception.ErrorCode;
import com.darfledger.exception.InsufficientPositionException;
import com.darfledger.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays the operation history into weighted-average cost positions and realized results.
 *
 * <p>Cost basis rules:
 * <ul>
 *   <li><b>Buy:</b> newQty = held + qty; newAvg = (held * avg + totalCost) / newQty. Fees are
 *       part of totalCost, so they raise the average.</li>
 *   <li><b>Sell:</b> costBasisConsumed = qty * avg; proceeds = qty * unitPrice;
 *       held -= qty. The average of the remaining units does not change.</li>
 * </ul>
 *
 * <p>{@link #recompute(List)} always starts from an empty position map, so the output is a
 * pure function of the operation list: no position survives between passes and two passes over
 * the same list produce equal results. Operations are stable-sorted by date, so same-day
 * operations keep the order of the input list (the store's insertion order).
 *
 * <p><b>Thread safety:</b> the tracker holds no state of its own; each pass works on local maps.
 */
@Service
public class PositionTracker {

    private static final Logger log = LoggerFactory.getLogger(PositionTracker.class);

    /** Scale of the running average unit cost. */
    static final int AVERAGE_COST_SCALE = 10;

    /** Scale of monetary amounts on realized results. */
    static final int MONEY_SCALE = 2;

    private final OperationValidator operationValidator;
    private final WithholdingPolicy withholdingPolicy;

    public PositionTracker(OperationValidator operationValidator, WithholdingPolicy withholdingPolicy) {
        this.operationValidator = operationValidator;
        this.withholdingPolicy = withholdingPolicy;
    }

    /**
     * Validates and replays the full operation history.
     *
     * <p>Invalid operations are collected in {@link RecomputeResult#getRejections()} and the rest
     * still replay. A sell larger than the held quantity aborts the whole pass.
     *
     * @param operations full history, in insertion order
     * @return positions, realized results and rejections of this pass
     * @throws InsufficientPositionException if any sell exceeds the quantity held at that point
     */
    public RecomputeResult recompute(List<Operation> operations) {
        List<Operation> accepted = new ArrayList<>(operations.size());
        List<OperationRejection> rejections = new ArrayList<>();

        for (Operation operation : operations) {
            try {
                operationValidator.validate(operation);
                accepted.add(operation);
            } catch (ValidationException ex) {
                log.warn("Operation {} rejected from recompute: {}", operation.getId(), ex.getMessage());
                rejections.add(OperationRejection.of(operation, ex));
            }
        }

        // List.sort is stable: same-day operations keep their insertion order
        accepted.sort(Comparator.comparing(Operation::getOperationDate));

        Map<String, Position> positions = new TreeMap<>();
        List<RealizedResult> realized = new ArrayList<>();

        for (Operation operation : accepted) {
            if (operation.isBuy()) {
                Position position = positions.computeIfAbsent(
                        operation.getAssetCode(), code -> Position.open(code, operation.getAssetType()));
                applyBuy(position, operation);
            } else {
                Position position = positions.get(operation.getAssetCode());
                if (position == null) {
                    throw new InsufficientPositionException(
                            operation.getAssetCode(),
                            operation.getQuantity(),
                            BigDecimal.ZERO,
                            operation.getOperationDate());
                }
                realized.add(applySell(position, operation));
            }
        }

        Map<String, Position> snapshot = new LinkedHashMap<>();
        positions.forEach((code, position) -> snapshot.put(code, position.copy()));

        log.debug(
                "Replayed {} operations: {} positions, {} sells, {} rejected",
                accepted.size(),
                snapshot.size(),
                realized.size(),
                rejections.size());

        return RecomputeResult.builder()
                .positions(Collections.unmodifiableMap(snapshot))
                .realized(List.copyOf(realized))
                .rejections(List.copyOf(rejections))
                .build();
    }

    /**
     * Adds a buy to the position and moves its weighted average cost.
     *
     * @throws ValidationException if the quantity is not positive
     */
    public void applyBuy(Position position, Operation operation) {
        requirePositiveQuantity(operation);

        BigDecimal held = position.getHeldQuantity();
        BigDecimal newQuantity = held.add(operation.getQuantity());
        BigDecimal heldCost = held.multiply(position.getAverageUnitCost());
        BigDecimal newAverage =
                heldCost.add(operation.getTotalCost()).divide(newQuantity, AVERAGE_COST_SCALE, RoundingMode.HALF_EVEN);

        position.setHeldQuantity(newQuantity);
        position.setAverageUnitCost(newAverage);
        position.setTotalInvested(position.getTotalInvested().add(operation.getTotalCost()));

        log.debug(
                "BUY {} {} @ {}: held={}, avg={}",
                operation.getQuantity(),
                operation.getAssetCode(),
                operation.getUnitPrice(),
                newQuantity,
                newAverage);
    }

    /**
     * Removes a sell from the position and returns the gain or loss it realized.
     *
     * @throws ValidationException if the quantity is not positive
     * @throws InsufficientPositionException if the sell exceeds the held quantity
     */
    public RealizedResult applySell(Position position, Operation operation) {
        requirePositiveQuantity(operation);

        BigDecimal held = position.getHeldQuantity();
        if (operation.getQuantity().compareTo(held) > 0) {
            throw new InsufficientPositionException(
                    operation.getAssetCode(), operation.getQuantity(), held, operation.getOperationDate());
        }

        BigDecimal proceeds = operation.grossValue().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal costBasisConsumed = operation.getQuantity()
                .multiply(position.getAverageUnitCost())
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal gainLoss = proceeds.subtract(costBasisConsumed);

        position.setHeldQuantity(held.subtract(operation.getQuantity()));
        position.setRealizedGainLoss(position.getRealizedGainLoss().add(gainLoss));

        log.debug(
                "SELL {} {} @ {}: proceeds={}, cost={}, result={}",
                operation.getQuantity(),
                operation.getAssetCode(),
                operation.getUnitPrice(),
                proceeds,
                costBasisConsumed,
                gainLoss);

        return RealizedResult.builder()
                .operationId(operation.getId())
                .assetCode(operation.getAssetCode())
                .assetType(operation.getAssetType())
                .tradeCategory(operation.getTradeCategory())
                .operationDate(operation.getOperationDate())
                .quantity(operation.getQuantity())
                .proceeds(proceeds)
                .costBasisConsumed(costBasisConsumed)
                .gainLoss(gainLoss)
                .irRetained(withholdingPolicy.retainedOn(operation, proceeds, gainLoss))
                .build();
    }

    private void requirePositiveQuantity(Operation operation) {
        if (operation.getQuantity() == null || operation.getQuantity().signum() <= 0) {
            throw new ValidationException(
                    ErrorCode.INVALID_OPERATION,
                    "Quantity must be positive for operation " + operation.getId(),
                    Map.of("quantity", String.valueOf(operation.getQuantity())));
        }
    }
}
