package com.darfledger.repository;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.model.Operation;
import java.util.List;
import java.util.Optional;

/**
 * Source of the operation history. The ledger reads the full history on every recompute and
 * appends newly registered operations; how they are persisted is up to the implementation.
 *
 * <p>{@link #findAll()} must return operations in insertion order: it breaks ties between
 * operations on the same date.
 */
public interface OperationStore {

    /** Stores the operation, assigning an id and creation time when absent. */
    Operation append(Operation operation);

    List<Operation> findAll();

    Optional<Operation> findById(String id);

    List<Operation> findByAssetCode(String assetCode);

    List<Operation> findByAssetType(AssetType assetType);

    /** @return true if an operation was removed */
    boolean delete(String id);
}
