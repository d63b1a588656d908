package com.darfledger.repository;

import com.darfledger.domain.model.LedgerSnapshot;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Repository;

/**
 * Holds the most recently published {@link LedgerSnapshot}.
 *
 * <p>Single writer, many readers: the recompute service replaces the whole snapshot in one
 * atomic set, and readers never lock. A failed pass never reaches {@link #publish}, so the
 * previous snapshot stays visible.
 */
@Repository
public class LedgerSnapshotRepository {

    private final AtomicReference<LedgerSnapshot> current = new AtomicReference<>();

    public void publish(LedgerSnapshot snapshot) {
        current.set(snapshot);
    }

    public Optional<LedgerSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public long currentVersion() {
        LedgerSnapshot snapshot = current.get();
        return snapshot != null ? snapshot.getVersion() : 0L;
    }
}
