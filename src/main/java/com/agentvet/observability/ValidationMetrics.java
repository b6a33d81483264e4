package com.agentvet.observability;

import com.agentvet.component.ComponentType;
import com.agentvet.validation.ValidatorKind;
import com.agentvet.validation.ValidatorResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the validation pipeline.
 */
@Component
public class ValidationMetrics {

    private final MeterRegistry registry;

    public ValidationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordValidation(ComponentType type, boolean valid) {
        Counter.builder("agentvet.validations")
                .tag("type", type == null ? "unknown" : type.id())
                .tag("outcome", valid ? "valid" : "invalid")
                .register(registry).increment();
    }

    public void recordFindings(ValidatorKind validator, ValidatorResult result) {
        increment(validator, "error", result.errorCount());
        increment(validator, "warning", result.warningCount());
        increment(validator, "info", result.infoCount());
    }

    public Timer.Sample startValidatorTimer() {
        return Timer.start(registry);
    }

    public void stopValidatorTimer(Timer.Sample sample, ValidatorKind validator) {
        sample.stop(Timer.builder("agentvet.validator.latency")
                .tag("validator", validator.id())
                .register(registry));
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private void increment(ValidatorKind validator, String severity, int amount) {
        if (amount == 0) return;
        Counter.builder("agentvet.findings")
                .tag("validator", validator.id())
                .tag("severity", severity)
                .register(registry).increment(amount);
    }
}
