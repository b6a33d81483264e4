package com.agentvet.config;

import io.micrometer.common.KeyValue;
import io.micrometer.observation.ObservationFilter;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    static final String APPLICATION_KEY = "application";

    /** Turns {@code @Observed} on {@code validateComponent} into timed observations. */
    @Bean
    public ObservedAspect validationObservedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    /** Adds the application name as a low-cardinality key on every observation. */
    @Bean
    public ObservationFilter applicationTagFilter(@Value("${spring.application.name:agentvet}") String application) {
        return context -> context.addLowCardinalityKeyValue(KeyValue.of(APPLICATION_KEY, application));
    }
}
