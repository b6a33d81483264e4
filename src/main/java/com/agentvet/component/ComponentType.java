package com.agentvet.component;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ComponentType {
    AGENT("agent"),
    COMMAND("command"),
    SETTING("setting"),
    HOOK("hook"),
    MCP("mcp"),
    TEMPLATE("template");

    private final String id;

    ComponentType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() { return id; }

    @JsonCreator
    public static ComponentType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Component type is required");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ComponentType type : values()) {
            if (type.id.equals(normalized)) return type;
        }
        throw new IllegalArgumentException("Unknown component type: " + id);
    }
}
