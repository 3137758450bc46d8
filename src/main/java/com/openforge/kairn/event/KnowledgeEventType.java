package com.openforge.kairn.event;

/**
 * Classifies every state change the workspace emits.
 */
public enum KnowledgeEventType {

    NODE_CREATED,
    NODE_UPDATED,
    NODE_DELETED,
    NODE_RESTORED,

    EDGE_CREATED,
    /** connect() on an existing triple overwrote weight/properties. */
    EDGE_UPDATED,
    EDGE_DELETED,
    EDGE_RESTORED,

    EXPERIENCE_CREATED,
    EXPERIENCE_ACCESSED,
    /** Access count reached the promotion threshold. */
    EXPERIENCE_FLAGGED,
    EXPERIENCE_PROMOTED,
    EXPERIENCE_PRUNED,

    KNOWLEDGE_LEARNED,
    KNOWLEDGE_RECALLED,
    CROSSREF_FOUND,

    ROUTES_REBUILT
}
