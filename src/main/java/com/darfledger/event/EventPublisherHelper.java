package com.darfledger.event;

import com.darfledger.domain.model.LedgerSnapshot;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for ledger events.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishLedgerRecomputed(Object source, LedgerSnapshot snapshot) {
        applicationEventPublisher.publishEvent(new LedgerRecomputedEvent(source, snapshot));
    }
}
