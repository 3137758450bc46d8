package com.openforge.kairn.event;

/**
 * The single event envelope published for every state change.
 *
 * Fields:
 *   type      — discriminator
 *   entityId  — id of the node / experience concerned; null for workspace-wide events
 *   payload   — the entity itself or a small structured summary
 *   timestamp — epoch millis
 */
public record KnowledgeEvent(
        KnowledgeEventType type,
        Long               entityId,
        Object             payload,
        long               timestamp
) {

    public static KnowledgeEvent of(KnowledgeEventType type, Long entityId, Object payload) {
        return new KnowledgeEvent(type, entityId, payload, System.currentTimeMillis());
    }

    public static KnowledgeEvent of(KnowledgeEventType type, Object payload) {
        return of(type, null, payload);
    }
}
