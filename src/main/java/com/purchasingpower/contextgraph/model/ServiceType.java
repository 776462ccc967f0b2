package com.purchasingpower.contextgraph.model;

/**
 * Enumeration of external collaborators for unified call logging.
 *
 * @see com.purchasingpower.contextgraph.util.ExternalCallLogger
 */
public enum ServiceType {
    OLLAMA("🦙", "Ollama"),
    GRAPH_STORE("🟢", "GraphStore"),
    SOURCE("📥", "Source");

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
