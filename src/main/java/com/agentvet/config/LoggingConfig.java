package com.agentvet.config;

import com.agentvet.observability.SecretRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Installs the extra secret patterns for the {@code %redacted} log converter.
 * A configured pattern that does not compile is skipped, not fatal.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final List<String> redactPatterns;

    public LoggingConfig(AgentvetProperties properties) {
        this.redactPatterns = properties.getLogging().getRedactPatterns();
    }

    @PostConstruct
    void installRedactionPatterns() {
        List<String> usable = usablePatterns(redactPatterns);
        SecretRedactionConverter.setConfiguredPatterns(usable);
        log.debug("Secret redaction active with {} extra pattern(s)", usable.size());
    }

    static List<String> usablePatterns(List<String> candidates) {
        List<String> usable = new ArrayList<>();
        if (candidates == null) return usable;
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) continue;
            try {
                Pattern.compile(candidate);
                usable.add(candidate);
            } catch (PatternSyntaxException e) {
                log.warn("Skipping redact pattern '{}': {}", candidate, e.getDescription());
            }
        }
        return usable;
    }
}
