package com.agentvet.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of reading the metadata header at the top of a document.
 * {@code fields} is only set for {@link Status#PARSED}; {@code body} is
 * the text after the header, or the whole document when there is none.
 */
public record Frontmatter(Status status, ObjectNode fields, String body, String error) {

    public enum Status { PARSED, MISSING, MALFORMED, NOT_AN_OBJECT }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public JsonNode field(String name) {
        if (fields == null) return null;
        JsonNode value = fields.get(name);
        return value == null || value.isNull() ? null : value;
    }

    /**
     * Text form of a scalar field, or null when the field is absent, blank
     * or not a scalar.
     */
    public String text(String name) {
        JsonNode value = field(name);
        if (value == null || !value.isValueNode()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    /** Absent, null, blank text, empty list, false and zero all count as missing. */
    public boolean isMissing(String name) {
        JsonNode value = field(name);
        if (value == null) return true;
        if (value.isTextual()) return value.asText().isBlank();
        if (value.isContainerNode()) return value.isEmpty();
        if (value.isBoolean()) return !value.asBoolean();
        if (value.isNumber()) return value.asDouble() == 0;
        return false;
    }
}
