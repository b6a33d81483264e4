package com.agentvet.config;

import com.agentvet.observability.SecretRedactionConverter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingConfigTest {

    @AfterEach
    void restoreDefaults() {
        SecretRedactionConverter.setConfiguredPatterns(List.of());
    }

    @Test
    void invalidAndBlankPatternsAreSkipped() {
        assertEquals(List.of("ticket-\\d+"),
                LoggingConfig.usablePatterns(List.of("ticket-\\d+", "([unclosed", "  ")));
        assertTrue(LoggingConfig.usablePatterns(null).isEmpty());
    }

    @Test
    void configuredPatternsReachTheConverter() {
        AgentvetProperties properties = new AgentvetProperties();
        properties.getLogging().setRedactPatterns(List.of("order-\\d{4}", "("));

        new LoggingConfig(properties).installRedactionPatterns();

        assertEquals("shipped [REDACTED] today", SecretRedactionConverter.redact("shipped order-1234 today"));
        assertEquals("password=[REDACTED]", SecretRedactionConverter.redact("password=hunter2"));
    }
}
