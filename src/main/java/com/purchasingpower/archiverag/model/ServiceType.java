package com.purchasingpower.archiverag.model;

/**
 * Enumeration of collaborator types for unified call logging.
 *
 * @see com.purchasingpower.archiverag.util.ExternalCallLogger
 */
public enum ServiceType {
    ENTITY_STORE("🟠", "EntityStore"),
    VECTOR_INDEX("🔵", "VectorIndex"),
    LLM("🔴", "LLM"),
    AUDIT("🟢", "Audit"),
    SOURCE_URL("🔷", "SourceUrl");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
