package com.darfledger.service;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.model.Operation;
import com.darfledger.exception.BaseException;
import com.darfledger.exception.ResourceNotFoundException;
import com.darfledger.exception.ValidationException;
import com.darfledger.ledger.OperationValidator;
import com.darfledger.repository.OperationStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers, lists and deletes operations, keeping the published ledger in step with the
 * store: every change is followed by a full recompute.
 *
 * <p>Each write holds the {@link LedgerWriteLock} from the first store read until its recompute
 * has published, so concurrent writes are applied one at a time against the history the
 * previous one left.
 */
@Service
public class OperationService {

    private static final Logger log = LoggerFactory.getLogger(OperationService.class);

    private final OperationStore operationStore;
    private final OperationValidator operationValidator;
    private final DarfLedgerService darfLedgerService;
    private final LedgerWriteLock ledgerWriteLock;

    public OperationService(
            OperationStore operationStore,
            OperationValidator operationValidator,
            DarfLedgerService darfLedgerService,
            LedgerWriteLock ledgerWriteLock) {
        this.operationStore = operationStore;
        this.operationValidator = operationValidator;
        this.darfLedgerService = darfLedgerService;
        this.ledgerWriteLock = ledgerWriteLock;
    }

    /**
     * Validates and stores a new operation, then recomputes the ledger.
     *
     * <p>If the recompute aborts with a ledger error (e.g. the new sell exceeds the held
     * quantity), the operation is removed again and the error propagates, so the store never
     * holds a history the ledger cannot replay. Any other failure, such as a throwing
     * {@code LedgerRecomputedEvent} listener, propagates without removing the operation, since
     * the snapshot has already been published with it.
     *
     * @return the stored operation, with its assigned id
     * @throws ValidationException if the operation breaks a field constraint
     */
    public Operation register(Operation operation) {
        operationValidator.validate(operation);
        return ledgerWriteLock.execute(() -> appendAndRecompute(operation));
    }

    private Operation appendAndRecompute(Operation operation) {
        Operation stored = operationStore.append(operation);
        log.info(
                "Operation registered: id={}, {} {} {} @ {} on {}",
                stored.getId(),
                stored.getOperationType(),
                stored.getQuantity(),
                stored.getAssetCode(),
                stored.getUnitPrice(),
                stored.getOperationDate());

        try {
            darfLedgerService.recompute();
        } catch (BaseException ex) {
            operationStore.delete(stored.getId());
            log.warn("Operation {} rolled back: {}", stored.getId(), ex.getMessage());
            throw ex;
        }
        return stored;
    }

    /** Lists operations, optionally filtered by asset code and/or asset type. */
    public List<Operation> list(String assetCode, AssetType assetType) {
        List<Operation> operations = assetCode != null && !assetCode.isBlank()
                ? operationStore.findByAssetCode(assetCode)
                : operationStore.findAll();
        if (assetType != null) {
            operations = operations.stream()
                    .filter(op -> op.getAssetType() == assetType)
                    .toList();
        }
        return operations;
    }

    /**
     * Deletes an operation and recomputes the ledger. The remaining history is replayed first;
     * if removing the operation would leave a sell without enough held quantity, nothing is
     * deleted and the error propagates.
     *
     * @throws ResourceNotFoundException if no operation has that id
     */
    public void delete(String id) {
        ledgerWriteLock.run(() -> checkAndDelete(id));
    }

    private void checkAndDelete(String id) {
        operationStore.findById(id).orElseThrow(() -> new ResourceNotFoundException("Operation", id));

        List<Operation> remaining = operationStore.findAll().stream()
                .filter(op -> !op.getId().equals(id))
                .toList();
        darfLedgerService.dryRun(remaining);

        operationStore.delete(id);
        log.info("Operation deleted: id={}", id);
        darfLedgerService.recompute();
    }
}
