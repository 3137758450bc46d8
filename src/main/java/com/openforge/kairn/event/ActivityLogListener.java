package com.openforge.kairn.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Activity trail: one DEBUG line per workspace event.
 */
@Slf4j
@Component
public class ActivityLogListener {

    @EventListener
    public void onKnowledgeEvent(KnowledgeEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("[Activity] {} id={}", event.type(), event.entityId());
        }
    }
}
