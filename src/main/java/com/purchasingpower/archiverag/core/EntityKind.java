package com.purchasingpower.archiverag.core;

/**
 * Kinds of canonical entities held by the entity store.
 */
public enum EntityKind {
    PERSON,
    WORKGROUP,
    TOPIC
}
