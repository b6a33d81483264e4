package com.agentvet.validation;

import com.agentvet.TestDocuments;
import com.agentvet.component.Component;
import com.agentvet.component.ComponentType;
import com.agentvet.component.FrontmatterParser;
import com.agentvet.config.AgentvetProperties;
import com.agentvet.observability.ValidationMetrics;
import com.agentvet.validation.integrity.IntegrityValidator;
import com.agentvet.validation.integrity.JsonFileHashRegistry;
import com.agentvet.validation.reference.ReferenceValidator;
import com.agentvet.validation.semantic.SemanticValidator;
import com.agentvet.validation.structural.StructuralValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValidationOrchestratorTest {

    @TempDir
    Path root;

    @Mock
    private ComponentValidator brokenValidator;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private AgentvetProperties properties;
    private JsonFileHashRegistry registry;
    private List<ComponentValidator> validators;
    private ValidationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new AgentvetProperties();
        FrontmatterParser parser = new FrontmatterParser();
        registry = new JsonFileHashRegistry(root, Path.of("hashes.json"), objectMapper);
        validators = List.of(
                new StructuralValidator(properties, parser),
                new IntegrityValidator(registry, parser),
                new SemanticValidator(properties),
                new ReferenceValidator(properties));
        orchestrator = newOrchestrator(validators);
    }

    private ValidationOrchestrator newOrchestrator(List<ComponentValidator> validators) {
        return new ValidationOrchestrator(validators, new ValidationMetrics(meterRegistry), properties, objectMapper);
    }

    private static Component agent(String content) {
        return new Component(content, "agents/reviewer.md", ComponentType.AGENT);
    }

    @Test
    void safeDocumentPassesEveryValidator() {
        AggregateResult result = orchestrator.validateComponent(agent(TestDocuments.SAFE_AGENT));

        assertTrue(result.overall().valid());
        assertEquals(0, result.overall().errorCount());
        assertEquals(100, result.overall().score());
        assertEquals(List.of("structural", "integrity", "semantic", "reference"),
                new ArrayList<>(result.validators().keySet()));
        assertEquals("agents/reviewer.md", result.component().path());
    }

    @Test
    void jailbreakWithScriptLinkFails() {
        AggregateResult result = orchestrator.validateComponent(agent(TestDocuments.JAILBREAK_AGENT));

        assertFalse(result.overall().valid());
        List<String> codes = orchestrator.getErrorCodes(result);
        assertTrue(codes.contains("SEM_E001"));
        assertTrue(codes.contains("SEM_E016"));
        assertTrue(codes.contains("REF_E005"));
        assertTrue(codes.indexOf("SEM_E001") < codes.indexOf("REF_E005"));
    }

    @Test
    void missingHeaderFailsStructural() {
        AggregateResult result = orchestrator.validateComponent(
                new Component(TestDocuments.NO_HEADER, "commands/orphan.md", ComponentType.COMMAND));

        assertFalse(result.overall().valid());
        assertFalse(result.validator(ValidatorKind.STRUCTURAL).valid());
        assertTrue(result.validator(ValidatorKind.STRUCTURAL).hasError("STRUCT_E001"));
    }

    @Test
    void overallAggregatesExecutedValidators() {
        AggregateResult result = orchestrator.validateComponent(agent(TestDocuments.JAILBREAK_AGENT));

        int errors = result.validators().values().stream().mapToInt(ValidatorResult::errorCount).sum();
        int warnings = result.validators().values().stream().mapToInt(ValidatorResult::warningCount).sum();
        double mean = result.validators().values().stream().mapToInt(ValidatorResult::score).average().orElseThrow();
        assertEquals(errors, result.overall().errorCount());
        assertEquals(warnings, result.overall().warningCount());
        assertEquals((int) Math.round(mean), result.overall().score());
    }

    @Test
    void registrySequenceAcrossValidations() {
        ValidationOptions update = ValidationOptions.defaults().withUpdateRegistry(true);

        AggregateResult first = orchestrator.validateComponent(agent(TestDocuments.SAFE_AGENT), update);
        assertTrue(first.validator(ValidatorKind.INTEGRITY).hasInfo("INT_I005"));

        AggregateResult second = orchestrator.validateComponent(agent(TestDocuments.SAFE_AGENT), update);
        assertFalse(second.validator(ValidatorKind.INTEGRITY).hasWarning("INT_W001"));

        AggregateResult third = orchestrator.validateComponent(
                agent(TestDocuments.SAFE_AGENT + "\nOne more line.\n"), update);
        assertTrue(third.validator(ValidatorKind.INTEGRITY).hasWarning("INT_W001"));
    }

    @Test
    void batchIsolatesUnreadableDocuments() {
        BatchResult batch = orchestrator.validateComponents(List.of(
                agent(TestDocuments.SAFE_AGENT),
                new Component(null, "agents/missing.md", ComponentType.AGENT),
                new Component(TestDocuments.NO_HEADER, "commands/orphan.md", ComponentType.COMMAND)));

        assertEquals(new BatchResult.Summary(3, 1, 2, batch.summary().warnings()), batch.summary());
        assertEquals("agents/reviewer.md", batch.components().get(0).component().path());
        assertEquals("agents/missing.md", batch.components().get(1).component().path());
        assertEquals(List.of("STRUCT_E009", "INT_E001", "SEM_E021", "REF_E001"),
                orchestrator.getErrorCodes(batch.components().get(1)));
        assertTrue(orchestrator.getErrorCodes(batch).contains("STRUCT_E001"));
    }

    @Test
    void streamEmitsInInputOrderUnderConcurrency() {
        properties.getBatch().setConcurrency(3);
        ValidationOrchestrator concurrent = newOrchestrator(validators);
        List<Component> components = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            components.add(new Component(TestDocuments.SAFE_AGENT + "\nRevision " + i + ".\n",
                    "agents/reviewer-" + i + ".md", ComponentType.AGENT));
        }

        StepVerifier.create(concurrent.validateComponentStream(components,
                        ValidationOptions.defaults().withUpdateRegistry(true)))
                .expectNextMatches(r -> r.component().path().equals("agents/reviewer-0.md"))
                .expectNextMatches(r -> r.component().path().equals("agents/reviewer-1.md"))
                .expectNextMatches(r -> r.component().path().equals("agents/reviewer-2.md"))
                .expectNextMatches(r -> r.component().path().equals("agents/reviewer-3.md"))
                .expectNextMatches(r -> r.component().path().equals("agents/reviewer-4.md"))
                .expectNextMatches(r -> r.component().path().equals("agents/reviewer-5.md"))
                .verifyComplete();

        assertEquals(6, registry.size());
    }

    @Test
    void streamKeepsGoingPastMissingContent() {
        StepVerifier.create(orchestrator.validateComponentStream(List.of(
                        new Component(null, "agents/missing.md", ComponentType.AGENT),
                        agent(TestDocuments.SAFE_AGENT)), ValidationOptions.defaults()))
                .expectNextMatches(r -> !r.overall().valid())
                .expectNextMatches(r -> r.overall().valid())
                .verifyComplete();
    }

    @Test
    void emptyBatchHasZeroCounts() {
        BatchResult batch = orchestrator.validateComponents(List.of());

        assertEquals(new BatchResult.Summary(0, 0, 0, 0), batch.summary());
        assertTrue(batch.components().isEmpty());
    }

    @Test
    void selectedValidatorsOnly() {
        ValidationOptions options = ValidationOptions.defaults()
                .withValidators(List.of(ValidatorKind.REFERENCE, ValidatorKind.SEMANTIC));

        AggregateResult result = orchestrator.validateComponent(agent(TestDocuments.NO_HEADER), options);

        assertEquals(List.of("semantic", "reference"), new ArrayList<>(result.validators().keySet()));
        assertTrue(result.overall().valid());
    }

    @Test
    void strictModeNeverLowersErrorCount() {
        Component component = agent(TestDocuments.SAFE_AGENT.replace("You review", "Pretend you are a reviewer. You review"));

        AggregateResult relaxed = orchestrator.validateComponent(component);
        AggregateResult strict = orchestrator.validateComponent(component, ValidationOptions.defaults().withStrict(true));

        assertTrue(relaxed.overall().valid());
        assertFalse(strict.overall().valid());
        assertTrue(strict.overall().errorCount() >= relaxed.overall().errorCount());
    }

    @Test
    void validationIsIdempotent() {
        AggregateResult first = orchestrator.validateComponent(agent(TestDocuments.JAILBREAK_AGENT));
        AggregateResult second = orchestrator.validateComponent(agent(TestDocuments.JAILBREAK_AGENT));

        assertEquals(first, second);
    }

    @Test
    void jsonReportRoundTrips() throws Exception {
        AggregateResult result = orchestrator.validateComponent(agent(TestDocuments.JAILBREAK_AGENT));

        String json = orchestrator.generateJsonReport(result);
        AggregateResult parsed = objectMapper.readValue(json, AggregateResult.class);

        assertEquals(result, parsed);
        assertEquals(json, orchestrator.generateJsonReport(parsed));
        assertTrue(json.contains("\"errorCount\""));
    }

    @Test
    void throwingValidatorIsIsolated() {
        when(brokenValidator.kind()).thenReturn(ValidatorKind.REFERENCE);
        when(brokenValidator.validate(any(), any())).thenThrow(new IllegalStateException("boom"));
        List<ComponentValidator> withBroken = new ArrayList<>(validators.subList(0, 3));
        withBroken.add(brokenValidator);

        AggregateResult result = newOrchestrator(withBroken).validateComponent(agent(TestDocuments.SAFE_AGENT));

        assertFalse(result.overall().valid());
        assertTrue(result.validator(ValidatorKind.REFERENCE).hasError("REF_E999"));
        assertTrue(result.validator(ValidatorKind.STRUCTURAL).valid());
        assertTrue(result.validator(ValidatorKind.SEMANTIC).valid());
    }

    @Test
    void duplicateValidatorKindsAreRejected() {
        List<ComponentValidator> duplicated = List.of(validators.get(0), validators.get(0));

        assertThrows(IllegalStateException.class, () -> newOrchestrator(duplicated));
    }

    @Test
    void metricsAreRecorded() {
        orchestrator.validateComponent(agent(TestDocuments.SAFE_AGENT));
        orchestrator.validateComponent(agent(TestDocuments.JAILBREAK_AGENT));

        assertEquals(1.0, meterRegistry.counter("agentvet.validations", "type", "agent", "outcome", "valid").count());
        assertEquals(1.0, meterRegistry.counter("agentvet.validations", "type", "agent", "outcome", "invalid").count());
        assertTrue(meterRegistry.counter("agentvet.findings", "validator", "semantic", "severity", "error").count() >= 2);
        assertEquals(2, meterRegistry.timer("agentvet.validator.latency", "validator", "structural").count());
    }
}
