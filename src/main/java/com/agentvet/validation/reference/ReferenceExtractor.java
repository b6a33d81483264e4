package com.agentvet.validation.reference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls {@code [label](target)} / {@code ![alt](src)} references and bare
 * {@code scheme://...} tokens out of markdown text. Each literal target is
 * reported once, keeping the first occurrence.
 */
public final class ReferenceExtractor {

    private static final Pattern MARKDOWN = Pattern.compile(
            "(!?)\\[([^\\]\\n]*)\\]\\(\\s*<?([^)\\s>]+)>?(?:\\s+\"[^\"]*\")?\\s*\\)");

    private static final Pattern BARE = Pattern.compile(
            "\\b[a-zA-Z][a-zA-Z0-9+.-]*://[^\\s<>\"'{}|\\\\^`\\[\\]()]+");

    private static final String TRAILING_PUNCTUATION = ".,;:!?";

    private ReferenceExtractor() {}

    public static List<Reference> extract(String content) {
        if (content == null || content.isEmpty()) return List.of();

        Map<String, Reference> byTarget = new LinkedHashMap<>();

        Matcher markdown = MARKDOWN.matcher(content);
        while (markdown.find()) {
            String target = markdown.group(3).trim();
            if (target.isEmpty()) continue;
            Reference.Kind kind = markdown.group(1).isEmpty() ? Reference.Kind.LINK : Reference.Kind.IMAGE;
            byTarget.putIfAbsent(target, new Reference(markdown.group(2), target, kind, markdown.start()));
        }

        Matcher bare = BARE.matcher(content);
        while (bare.find()) {
            String target = stripTrailingPunctuation(bare.group());
            byTarget.putIfAbsent(target, new Reference(target, target, Reference.Kind.BARE, bare.start()));
        }

        return new ArrayList<>(byTarget.values());
    }

    private static String stripTrailingPunctuation(String token) {
        int end = token.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(0, end);
    }
}
