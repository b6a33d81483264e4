package com.agentvet.observability;

import com.agentvet.validation.integrity.HashRegistry;
import com.agentvet.validation.integrity.HashRegistryException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class RegistryHealthIndicator implements HealthIndicator {

    private final HashRegistry registry;

    public RegistryHealthIndicator(HashRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        try {
            return Health.up()
                    .withDetail("entries", registry.size())
                    .build();
        } catch (HashRegistryException e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
