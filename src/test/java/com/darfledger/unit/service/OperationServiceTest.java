package com.darfledger.unit.service;

import static com.darfledger.fixtures.OperationFixtures.buy;
import static com.darfledger.fixtures.OperationFixtures.stockBuy;
import static com.darfledger.fixtures.OperationFixtures.stockSell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.model.Operation;
import com.darfledger.exception.ErrorCode;
import com.darfledger.exception.InsufficientPositionException;
import com.darfledger.exception.ResourceNotFoundException;
import com.darfledger.exception.ValidationException;
import com.darfledger.ledger.OperationValidator;
import com.darfledger.repository.InMemoryOperationStore;
import com.darfledger.service.DarfLedgerService;
import com.darfledger.service.LedgerWriteLock;
import com.darfledger.service.OperationService;
import jakarta.validation.Validation;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OperationServiceTest {

    private static final LocalDate JAN_10 = LocalDate.of(2025, 1, 10);
    private static final LocalDate JAN_20 = LocalDate.of(2025, 1, 20);

    @Mock
    private DarfLedgerService darfLedgerService;

    private InMemoryOperationStore operationStore;
    private OperationService operationService;

    @BeforeEach
    void setUp() {
        operationStore = new InMemoryOperationStore();
        operationService = new OperationService(
                operationStore,
                new OperationValidator(Validation.buildDefaultValidatorFactory().getValidator()),
                darfLedgerService,
                new LedgerWriteLock());
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        @DisplayName("Stores the operation and recomputes")
        void storesAndRecomputes() {
            Operation stored = operationService.register(stockBuy(null, "petr4", "10", "30", JAN_10));

            assertThat(stored.getId()).isNotBlank();
            assertThat(stored.getAssetCode()).isEqualTo("PETR4");
            assertThat(operationStore.findAll()).containsExactly(stored);
            verify(darfLedgerService).recompute();
        }

        @Test
        @DisplayName("An invalid operation is neither stored nor recomputed")
        void invalidRejected() {
            Operation invalid = stockBuy("b1", "PETR4", "10", "30", JAN_10).toBuilder()
                    .quantity(new BigDecimal("-1"))
                    .build();

            assertThatThrownBy(() -> operationService.register(invalid)).isInstanceOf(ValidationException.class);
            assertThat(operationStore.findAll()).isEmpty();
            verifyNoInteractions(darfLedgerService);
        }

        @Test
        @DisplayName("A failed recompute removes the operation again")
        void rollsBack() {
            operationStore.append(stockBuy("b1", "PETR4", "10", "30", JAN_10));
            when(darfLedgerService.recompute())
                    .thenThrow(new InsufficientPositionException("PETR4", BigDecimal.TEN.add(BigDecimal.ONE),
                            BigDecimal.TEN, JAN_20));

            assertThatThrownBy(() -> operationService.register(stockSell("s1", "PETR4", "11", "31", JAN_20)))
                    .isInstanceOf(InsufficientPositionException.class);
            assertThat(operationStore.findAll()).extracting(Operation::getId).containsExactly("b1");
        }

        @Test
        @DisplayName("A failure after publishing keeps the operation the snapshot already holds")
        void keepsOperationOnNonLedgerFailure() {
            when(darfLedgerService.recompute()).thenThrow(new IllegalStateException("listener failed"));

            assertThatThrownBy(() -> operationService.register(stockBuy("b1", "PETR4", "10", "30", JAN_10)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("listener failed");
            assertThat(operationStore.findAll()).extracting(Operation::getId).containsExactly("b1");
        }
    }

    @Nested
    @DisplayName("list")
    class ListOperations {

        @BeforeEach
        void seed() {
            operationStore.append(stockBuy("b1", "PETR4", "10", "30", JAN_10));
            operationStore.append(stockBuy("b2", "VALE3", "10", "60", JAN_10));
            operationStore.append(buy("b3", "PETR4", AssetType.OPTION, TradeCategory.SWING_TRADE, "100", "1", "100", JAN_10));
        }

        @Test
        @DisplayName("No filters returns everything in insertion order")
        void all() {
            assertThat(operationService.list(null, null)).extracting(Operation::getId).containsExactly("b1", "b2", "b3");
        }

        @Test
        @DisplayName("Filters combine asset code and asset type")
        void combined() {
            assertThat(operationService.list("petr4", null)).extracting(Operation::getId).containsExactly("b1", "b3");
            assertThat(operationService.list("PETR4", AssetType.STOCK)).extracting(Operation::getId).containsExactly("b1");
            assertThat(operationService.list(" ", AssetType.OPTION)).extracting(Operation::getId).containsExactly("b3");
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("Unknown id is not found")
        void unknownId() {
            assertThatThrownBy(() -> operationService.delete("missing"))
                    .isInstanceOfSatisfying(ResourceNotFoundException.class, ex -> {
                        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
                        assertThat(ex.getErrorCode().isFatal()).isFalse();
                        assertThat(ex.getDetails()).containsEntry("id", "missing");
                        assertThat(ex).hasMessage("Operation missing does not exist");
                    });
            verifyNoInteractions(darfLedgerService);
        }

        @Test
        @DisplayName("Checks the remaining history, deletes and recomputes")
        @SuppressWarnings("unchecked")
        void deletes() {
            operationStore.append(stockBuy("b1", "PETR4", "10", "30", JAN_10));
            operationStore.append(stockBuy("b2", "PETR4", "10", "31", JAN_20));

            operationService.delete("b1");

            ArgumentCaptor<List<Operation>> captor = ArgumentCaptor.forClass(List.class);
            verify(darfLedgerService).dryRun(captor.capture());
            assertThat(captor.getValue()).extracting(Operation::getId).containsExactly("b2");
            assertThat(operationStore.findById("b1")).isEmpty();
            verify(darfLedgerService).recompute();
        }

        @Test
        @DisplayName("A delete that would strand a sell is refused")
        void refusesStrandingSell() {
            operationStore.append(stockBuy("b1", "PETR4", "10", "30", JAN_10));
            operationStore.append(stockSell("s1", "PETR4", "10", "31", JAN_20));
            when(darfLedgerService.dryRun(anyList()))
                    .thenThrow(new InsufficientPositionException("PETR4", BigDecimal.TEN, BigDecimal.ZERO, JAN_20));

            assertThatThrownBy(() -> operationService.delete("b1"))
                    .isInstanceOf(InsufficientPositionException.class);
            assertThat(operationStore.findById("b1")).isPresent();
            verify(darfLedgerService, never()).recompute();
        }
    }
}
