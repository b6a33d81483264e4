package com.agentvet.validation;

/**
 * Position of a finding inside the document: character offset plus the
 * 1-based line/column and the trimmed text of that line.
 */
public record FindingLocation(int offset, int line, int column, String lineText) {

    public static FindingLocation at(String content, int index) {
        int bounded = Math.max(0, Math.min(index, content.length()));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < bounded; i++) {
            if (content.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = content.indexOf('\n', bounded);
        if (lineEnd < 0) lineEnd = content.length();
        String lineText = content.substring(lineStart, lineEnd).trim();
        return new FindingLocation(bounded, line, bounded - lineStart + 1, lineText);
    }

    public String position() {
        return line + ":" + column;
    }

    public FindingLocation withLineText(String replacement) {
        return new FindingLocation(offset, line, column, replacement);
    }
}
