package com.openforge.kairn.event;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin facade over Spring's ApplicationEventPublisher.
 *
 * Listeners run synchronously on the caller's thread, inside the caller's
 * transaction: a listener that fails (e.g. the router cannot index a node)
 * rolls back the write that emitted the event.
 */
@Component
@RequiredArgsConstructor
public class KnowledgeEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(KnowledgeEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    public void publish(KnowledgeEventType type, Long entityId, Object payload) {
        publish(KnowledgeEvent.of(type, entityId, payload));
    }
}
