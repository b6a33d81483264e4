package com.agentvet.api;

import com.agentvet.component.Component;
import com.agentvet.component.ComponentType;
import com.agentvet.validation.AggregateResult;
import com.agentvet.validation.BatchResult;
import com.agentvet.validation.ReportOptions;
import com.agentvet.validation.ValidationOptions;
import com.agentvet.validation.ValidationOrchestrator;
import com.agentvet.validation.ValidatorKind;
import com.agentvet.validation.semantic.SecurityReport;
import com.agentvet.validation.semantic.SemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/validation")
public class ValidationApiController {

    private static final Logger log = LoggerFactory.getLogger(ValidationApiController.class);

    private final ValidationOrchestrator orchestrator;
    private final SemanticValidator semanticValidator;

    public ValidationApiController(ValidationOrchestrator orchestrator, SemanticValidator semanticValidator) {
        this.orchestrator = orchestrator;
        this.semanticValidator = semanticValidator;
    }

    @PostMapping("/component")
    public AggregateResult validateComponent(@RequestBody ValidateRequest request) {
        return orchestrator.validateComponent(toComponent(request.component()), toOptions(request.options()));
    }

    @PostMapping("/batch")
    public BatchResult validateBatch(@RequestBody BatchRequest request) {
        if (request.components() == null) {
            throw new IllegalArgumentException("components is required");
        }
        List<Component> components = request.components().stream().map(this::toComponent).toList();
        return orchestrator.validateComponents(components, toOptions(request.options()));
    }

    @PostMapping(value = "/report", produces = "text/plain;charset=UTF-8")
    public String report(@RequestBody ReportRequest request) {
        AggregateResult result = orchestrator.validateComponent(
                toComponent(request.component()), toOptions(request.options()));
        return orchestrator.generateReport(result, new ReportOptions(request.verbose(), request.colors()));
    }

    @PostMapping("/security-report")
    public SecurityReport securityReport(@RequestBody ComponentPayload component) {
        return semanticValidator.generateSecurityReport(toComponent(component));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleBadRequest(IllegalArgumentException e) {
        log.debug("Rejected validation request: {}", e.getMessage());
        return Map.of("error", "bad_request", "message", String.valueOf(e.getMessage()));
    }

    private Component toComponent(ComponentPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("component is required");
        }
        ComponentType type = payload.type() == null ? null : ComponentType.fromId(payload.type());
        return new Component(payload.content(), payload.path(), type, payload.version());
    }

    private ValidationOptions toOptions(OptionsPayload payload) {
        if (payload == null) return ValidationOptions.defaults();
        List<ValidatorKind> kinds = payload.validators() == null ? List.of()
                : payload.validators().stream().map(ValidatorKind::fromId).toList();
        return ValidationOptions.defaults()
                .withValidators(kinds)
                .withStrict(payload.strict())
                .withStrictHttps(payload.strictHttps())
                .withExpectedHash(payload.expectedHash())
                .withUpdateRegistry(payload.updateRegistry());
    }

    public record ComponentPayload(
            String content,
            String path,
            String type,
            String version
    ) {}

    public record OptionsPayload(
            List<String> validators,
            boolean strict,
            boolean strictHttps,
            String expectedHash,
            boolean updateRegistry
    ) {}

    public record ValidateRequest(
            ComponentPayload component,
            OptionsPayload options
    ) {}

    public record BatchRequest(
            List<ComponentPayload> components,
            OptionsPayload options
    ) {}

    public record ReportRequest(
            ComponentPayload component,
            OptionsPayload options,
            boolean verbose,
            boolean colors
    ) {}
}
