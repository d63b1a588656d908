package com.darfledger.event;

import com.darfledger.domain.model.LedgerSnapshot;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a recompute pass has produced and published a new {@link LedgerSnapshot}.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>LedgerMetricsService: counts passes and rejected operations</li>
 * </ul>
 */
public class LedgerRecomputedEvent extends ApplicationEvent {

    private final LedgerSnapshot snapshot;

    public LedgerRecomputedEvent(Object source, LedgerSnapshot snapshot) {
        super(source);
        this.snapshot = snapshot;
    }

    public LedgerSnapshot getSnapshot() {
        return snapshot;
    }

    public int getRejectedCount() {
        return snapshot.getRecompute().getRejections().size();
    }
}
