package com.darfledger.repository;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.model.Operation;
import com.darfledger.exception.ValidationException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link OperationStore} backed by an insertion-ordered map.
 *
 * <p>Reads return copies taken under a read lock, so a recompute pass always sees a consistent
 * history even while operations are being appended.
 */
@Repository
public class InMemoryOperationStore implements OperationStore {

    private final Map<String, Operation> operations = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Operation append(Operation operation) {
        Operation stored = operation.toBuilder()
                .id(operation.getId() != null ? operation.getId() : UUID.randomUUID().toString())
                .createdAt(operation.getCreatedAt() != null ? operation.getCreatedAt() : LocalDateTime.now())
                .build();

        lock.writeLock().lock();
        try {
            if (operations.containsKey(stored.getId())) {
                throw new ValidationException(
                        "Operation already stored: " + stored.getId(), Map.of("id", stored.getId()));
            }
            operations.put(stored.getId(), stored);
        } finally {
            lock.writeLock().unlock();
        }
        return stored;
    }

    @Override
    public List<Operation> findAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(operations.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Operation> findById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(operations.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Operation> findByAssetCode(String assetCode) {
        String normalized = Operation.normalizeAssetCode(assetCode);
        return findAll().stream()
                .filter(op -> op.getAssetCode() != null && op.getAssetCode().equals(normalized))
                .toList();
    }

    @Override
    public List<Operation> findByAssetType(AssetType assetType) {
        return findAll().stream().filter(op -> op.getAssetType() == assetType).toList();
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            return operations.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return operations.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
