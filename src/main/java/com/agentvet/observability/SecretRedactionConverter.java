package com.agentvet.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logback converter ({@code %redacted}) that masks secret-shaped values in
 * log messages. Extra patterns from {@code agentvet.logging.redact-patterns}
 * are pushed in by LoggingConfig at startup.
 */
public class SecretRedactionConverter extends ClassicConverter {

    static final String MASK = "[REDACTED]";

    // key=value style secrets keep the key, lose the value
    private static final Pattern KEY_VALUE = Pattern.compile(
            "(?i)\\b(password|passwd|pwd|api[_-]?key|apikey|secret|token)(\\s*[:=]\\s*)(['\"]?)[^\\s'\",;]+");

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("(?i)\\bbearer\\s+[a-z0-9._~+/-]{8,}=*"),
            Pattern.compile("\\bsk-[A-Za-z0-9_-]{16,}"),
            Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b")
    );

    private static volatile List<Pattern> configuredPatterns = null;

    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(DEFAULT_PATTERNS);
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = List.copyOf(compiled);
    }

    static void resetConfiguredPatterns() {
        configuredPatterns = null;
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redact(event.getFormattedMessage());
    }

    public static String redact(String message) {
        if (message == null) return "";

        Matcher keyValue = KEY_VALUE.matcher(message);
        String result = keyValue.replaceAll(m -> Matcher.quoteReplacement(m.group(1) + m.group(2) + m.group(3) + MASK));

        List<Pattern> patterns = configuredPatterns != null ? configuredPatterns : DEFAULT_PATTERNS;
        for (Pattern pattern : patterns) {
            result = pattern.matcher(result).replaceAll(MASK);
        }
        return result;
    }
}
