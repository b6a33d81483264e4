package com.agentvet.validation.reference;

/**
 * A link or image target found in the document body.
 */
public record Reference(String label, String target, Kind kind, int index) {

    public enum Kind { LINK, IMAGE, BARE }

    public boolean isImage() {
        return kind == Kind.IMAGE;
    }
}
