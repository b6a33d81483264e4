package com.agentvet.component;

/**
 * A document under validation. {@code content} may be null when the
 * document could not be read; validators report that as a finding.
 */
public record Component(
        String content,
        String path,
        ComponentType type,
        String version
) {
    public Component(String content, String path, ComponentType type) {
        this(content, path, type, null);
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }
}
