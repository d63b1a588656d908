package com.darfledger.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single writer gate of the ledger.
 *
 * <p>Every change to the operation history and the recompute that follows it run while holding
 * this lock, so a store change and the snapshot computed from it form one step. Reentrant:
 * {@link DarfLedgerService#recompute()} takes it again when called from inside an
 * {@link OperationService} write. Readers never take it; they read the published snapshot.
 */
@Component
public class LedgerWriteLock {

    private static final Logger log = LoggerFactory.getLogger(LedgerWriteLock.class);

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T execute(Supplier<T> action) {
        if (!lock.tryLock()) {
            log.debug("Ledger write in progress, waiting ({} queued)", lock.getQueueLength());
            lock.lock();
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable action) {
        execute(() -> {
            action.run();
            return null;
        });
    }

    /** Number of threads waiting to write. */
    public int getQueueLength() {
        return lock.getQueueLength();
    }
}
