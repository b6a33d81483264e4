package com.agentvet.validation;

import com.agentvet.component.Component;
import com.agentvet.config.AgentvetProperties;
import com.agentvet.observability.ValidationMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the selected validators over a document and merges their verdicts.
 * Validators always run in {@link ValidatorKind} order. A validator that
 * throws is isolated: its slot holds a failed result and the other
 * validators still run.
 */
@org.springframework.stereotype.Component
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    static final String FAILURE_SUFFIX = "_E999";

    private final Map<ValidatorKind, ComponentValidator> validators = new EnumMap<>(ValidatorKind.class);
    private final ValidationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final ValidationReportRenderer renderer = new ValidationReportRenderer();
    private final int batchConcurrency;

    public ValidationOrchestrator(List<ComponentValidator> validators, ValidationMetrics metrics,
                                  AgentvetProperties properties, ObjectMapper objectMapper) {
        for (ComponentValidator validator : validators) {
            ComponentValidator previous = this.validators.putIfAbsent(validator.kind(), validator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate validator for " + validator.kind().id());
            }
        }
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.batchConcurrency = Math.max(1, properties.getBatch().getConcurrency());
    }

    public AggregateResult validateComponent(Component component) {
        return validateComponent(component, ValidationOptions.defaults());
    }

    @Observed(name = "agentvet.validate.component", contextualName = "validate-component")
    public AggregateResult validateComponent(Component component, ValidationOptions options) {
        ValidationOptions effective = options == null ? ValidationOptions.defaults() : options;
        MDC.put("componentPath", String.valueOf(component.path()));
        MDC.put("componentType", component.type() == null ? "unknown" : component.type().id());
        try {
            Map<String, ValidatorResult> results = new LinkedHashMap<>();
            for (ValidatorKind kind : ValidatorKind.values()) {
                if (!effective.runs(kind)) continue;
                ComponentValidator validator = validators.get(kind);
                if (validator == null) {
                    log.warn("No validator registered for {}", kind.id());
                    continue;
                }
                results.put(kind.id(), runIsolated(validator, component, effective));
            }

            AggregateResult aggregate = new AggregateResult(
                    new AggregateResult.ComponentSummary(component.path(), component.type()),
                    overall(results.values()),
                    results);

            metrics.recordValidation(component.type(), aggregate.overall().valid());
            if (aggregate.overall().valid()) {
                log.info("Validated {} valid=true score={} warnings={}", component.path(),
                        aggregate.overall().score(), aggregate.overall().warningCount());
            } else {
                log.warn("Validated {} valid=false score={} errors={} codes={}", component.path(),
                        aggregate.overall().score(), aggregate.overall().errorCount(), getErrorCodes(aggregate));
            }
            return aggregate;
        } finally {
            MDC.remove("componentPath");
            MDC.remove("componentType");
        }
    }

    public BatchResult validateComponents(List<Component> components) {
        return validateComponents(components, ValidationOptions.defaults());
    }

    public BatchResult validateComponents(List<Component> components, ValidationOptions options) {
        List<AggregateResult> results = validateComponentStream(components, options)
                .collectList()
                .block();
        if (results == null) {
            results = List.of();
        }

        int passed = 0;
        int warnings = 0;
        for (AggregateResult result : results) {
            if (result.overall().valid()) passed++;
            warnings += result.overall().warningCount();
        }
        BatchResult.Summary summary = new BatchResult.Summary(results.size(), passed, results.size() - passed, warnings);
        log.info("Batch validated total={} passed={} failed={}", summary.total(), summary.passed(), summary.failed());
        return new BatchResult(summary, results);
    }

    /**
     * Validates each document independently on a bounded worker pool.
     * Results are emitted in input order, whatever order the workers finish in.
     */
    public Flux<AggregateResult> validateComponentStream(List<Component> components, ValidationOptions options) {
        return Flux.fromIterable(components)
                .flatMapSequential(component -> Mono.fromCallable(() -> validateComponent(component, options))
                        .subscribeOn(Schedulers.boundedElastic()), batchConcurrency);
    }

    public String generateReport(AggregateResult result, ReportOptions options) {
        return renderer.render(result, options);
    }

    public String generateReport(BatchResult batch, ReportOptions options) {
        return renderer.render(batch, options);
    }

    public String generateJsonReport(AggregateResult result) {
        return toJson(result);
    }

    public String generateJsonReport(BatchResult batch) {
        return toJson(batch);
    }

    private String toJson(Object result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize validation report", e);
        }
    }

    public List<String> getErrorCodes(AggregateResult result) {
        List<String> codes = new ArrayList<>();
        for (ValidatorResult validator : result.validators().values()) {
            validator.errors().forEach(error -> codes.add(error.code()));
        }
        return codes;
    }

    public List<String> getErrorCodes(BatchResult batch) {
        List<String> codes = new ArrayList<>();
        batch.components().forEach(component -> codes.addAll(getErrorCodes(component)));
        return codes;
    }

    private ValidatorResult runIsolated(ComponentValidator validator, Component component, ValidationOptions options) {
        ValidatorKind kind = validator.kind();
        Timer.Sample sample = metrics.startValidatorTimer();
        ValidatorResult result;
        try {
            result = validator.validate(component, options);
        } catch (RuntimeException e) {
            log.error("Validator {} failed on {}", kind.id(), component.path(), e);
            result = new FindingCollector()
                    .error(kind.codePrefix() + FAILURE_SUFFIX, "Validator failure: " + e.getMessage(),
                            Map.of("exception", e.getClass().getName()))
                    .toResult();
        } finally {
            metrics.stopValidatorTimer(sample, kind);
        }
        metrics.recordFindings(kind, result);
        return result;
    }

    private static AggregateResult.Overall overall(Iterable<ValidatorResult> results) {
        boolean valid = true;
        int errors = 0;
        int warnings = 0;
        int scoreTotal = 0;
        int count = 0;
        for (ValidatorResult result : results) {
            valid &= result.errorCount() == 0;
            errors += result.errorCount();
            warnings += result.warningCount();
            scoreTotal += result.score();
            count++;
        }
        int score = count == 0 ? Scoring.MAX_SCORE : (int) Math.round((double) scoreTotal / count);
        return new AggregateResult.Overall(valid, errors, warnings, score);
    }
}
