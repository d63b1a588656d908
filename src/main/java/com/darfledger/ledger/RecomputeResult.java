package com.darfledger.ledger;

import com.darfledger.domain.model.Position;
import com.darfledger.domain.model.RealizedResult;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one full replay of the operation history.
 *
 * <ul>
 *   <li>positions: one copy per asset code, sorted by code, unmodifiable</li>
 *   <li>realized: one result per sell, in replay order</li>
 *   <li>rejections: operations that failed validation and were left out</li>
 * </ul>
 */
@Value
@Builder
public class RecomputeResult {

    Map<String, Position> positions;
    List<RealizedResult> realized;
    List<OperationRejection> rejections;

    public List<Position> openPositions() {
        return positions.values().stream().filter(Position::isOpen).toList();
    }

    public boolean hasRejections() {
        return !rejections.isEmpty();
    }
}
