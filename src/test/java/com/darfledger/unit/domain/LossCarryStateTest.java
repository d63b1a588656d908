package com.darfledger.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.model.LossCarryState;
import com.darfledger.domain.vo.Lane;
import com.darfledger.exception.ErrorCode;
import com.darfledger.exception.OrderingViolationException;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LossCarryStateTest {

    private static final Lane STOCK_SWING = Lane.of(AssetType.STOCK, TradeCategory.SWING_TRADE);
    private static final Lane FII_SWING = Lane.of(AssetType.REAL_ESTATE_FUND, TradeCategory.SWING_TRADE);

    private static final YearMonth JAN = YearMonth.of(2025, 1);
    private static final YearMonth FEB = YearMonth.of(2025, 2);

    @Test
    @DisplayName("fold returns a new state and leaves the original untouched")
    void immutableFold() {
        LossCarryState start = LossCarryState.empty();
        LossCarryState next = start.fold(STOCK_SWING, JAN, BigDecimal.ZERO, new BigDecimal("100"));

        assertThat(start.balance(STOCK_SWING)).isEqualByComparingTo("0");
        assertThat(start.lastFolded(STOCK_SWING)).isEmpty();
        assertThat(next.balance(STOCK_SWING)).isEqualByComparingTo("100");
        assertThat(next.lastFolded(STOCK_SWING)).contains(JAN);
    }

    @Test
    @DisplayName("Consumption and accrual move the balance of their own lane only")
    void perLane() {
        LossCarryState state = LossCarryState.empty()
                .fold(STOCK_SWING, JAN, BigDecimal.ZERO, new BigDecimal("300"))
                .fold(FII_SWING, JAN, BigDecimal.ZERO, new BigDecimal("50"))
                .fold(STOCK_SWING, FEB, new BigDecimal("120"), BigDecimal.ZERO);

        assertThat(state.balance(STOCK_SWING)).isEqualByComparingTo("180");
        assertThat(state.balance(FII_SWING)).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("Folding the same or an earlier month raises an ordering violation")
    void goingBack() {
        LossCarryState state = LossCarryState.empty().fold(STOCK_SWING, FEB, BigDecimal.ZERO, BigDecimal.ONE);

        assertThatThrownBy(() -> state.fold(STOCK_SWING, FEB, BigDecimal.ZERO, BigDecimal.ONE))
                .isInstanceOf(OrderingViolationException.class);
        assertThatThrownBy(() -> state.fold(STOCK_SWING, JAN, BigDecimal.ZERO, BigDecimal.ONE))
                .isInstanceOfSatisfying(OrderingViolationException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ORDERING_VIOLATION));
        // another lane has its own clock
        assertThat(state.fold(FII_SWING, JAN, BigDecimal.ZERO, BigDecimal.ONE).balance(FII_SWING))
                .isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("Consuming more than carried is rejected")
    void overConsume() {
        LossCarryState state = LossCarryState.of(Map.of(STOCK_SWING, new BigDecimal("10")));

        assertThatThrownBy(() -> state.fold(STOCK_SWING, JAN, new BigDecimal("10.01"), BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Negative movements and opening balances are rejected")
    void negatives() {
        assertThatThrownBy(() -> LossCarryState.empty().fold(STOCK_SWING, JAN, BigDecimal.ZERO, new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LossCarryState.of(Map.of(STOCK_SWING, new BigDecimal("-1"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("States with the same balances and history are equal")
    void equality() {
        LossCarryState a = LossCarryState.empty().fold(STOCK_SWING, JAN, BigDecimal.ZERO, BigDecimal.TEN);
        LossCarryState b = LossCarryState.empty().fold(STOCK_SWING, JAN, BigDecimal.ZERO, BigDecimal.TEN);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(LossCarryState.empty());
    }
}
