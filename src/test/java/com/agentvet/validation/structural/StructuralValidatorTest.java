package com.agentvet.validation.structural;

import com.agentvet.TestDocuments;
import com.agentvet.component.Component;
import com.agentvet.component.ComponentType;
import com.agentvet.component.FrontmatterParser;
import com.agentvet.config.AgentvetProperties;
import com.agentvet.validation.ValidatorResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralValidatorTest {

    private static final String BODY = """

            # Usage

            Run this command to format every staged file before committing changes.
            """;

    private StructuralValidator validator;

    @BeforeEach
    void setUp() {
        validator = new StructuralValidator(new AgentvetProperties(), new FrontmatterParser());
    }

    private ValidatorResult validate(String content, ComponentType type) {
        return validator.validate(new Component(content, "test.md", type));
    }

    private static String command(String header) {
        return "---\n" + header + "\n---\n" + BODY;
    }

    @Test
    void wellFormedAgentScoresFullMarks() {
        ValidatorResult result = validate(TestDocuments.SAFE_AGENT, ComponentType.AGENT);

        assertTrue(result.valid());
        assertEquals(0, result.warningCount(), () -> result.warnings().toString());
        assertEquals(100, result.score());
        assertTrue(result.hasInfo("STRUCT_I002"));
        assertTrue(result.hasInfo("STRUCT_I001"));
        assertTrue(result.hasInfo("STRUCT_I004"));
    }

    @Test
    void emptyContentShortCircuits() {
        ValidatorResult result = validate("", ComponentType.AGENT);

        assertFalse(result.valid());
        assertEquals(1, result.errorCount());
        assertTrue(result.hasError("STRUCT_E009"));
    }

    @Test
    void missingHeaderIsAnError() {
        ValidatorResult result = validate(TestDocuments.NO_HEADER, ComponentType.COMMAND);

        assertTrue(result.hasError("STRUCT_E001"));
        assertFalse(result.hasError("STRUCT_E006"));
    }

    @Test
    void malformedHeaderUsesDistinctCode() {
        ValidatorResult result = validate(command("name: [unclosed"), ComponentType.COMMAND);

        assertTrue(result.hasError("STRUCT_E002"));
        assertFalse(result.hasError("STRUCT_E001"));
    }

    @Test
    void requiredFieldsDependOnType() {
        ValidatorResult agent = validate(command("name: lonely"), ComponentType.AGENT);
        assertEquals(2, agent.errors().stream().filter(f -> f.code().equals("STRUCT_E006")).count());

        ValidatorResult hook = validate(command("name: h\ndescription: Runs after every tool invocation completes."),
                ComponentType.HOOK);
        assertTrue(hook.hasError("STRUCT_E006"));
        assertEquals("trigger", hook.errors().get(0).detail("field"));

        ValidatorResult cmd = validate(command("name: c\ndescription: Formats staged files before a commit."),
                ComponentType.COMMAND);
        assertFalse(cmd.hasError("STRUCT_E006"));
    }

    @Test
    void descriptionLengthBounds() {
        assertTrue(validate(command("name: c\ndescription: too short"), ComponentType.COMMAND)
                .hasWarning("STRUCT_W003"));
        assertTrue(validate(command("name: c\ndescription: " + "x".repeat(501)), ComponentType.COMMAND)
                .hasWarning("STRUCT_W004"));
    }

    @Test
    void nonStringDescriptionIsAnError() {
        ValidatorResult result = validate(command("name: c\ndescription: [a, b]"), ComponentType.COMMAND);

        assertTrue(result.hasError("STRUCT_E007"));
    }

    @Test
    void toolsAreCheckedAgainstKnownSet() {
        String header = "name: a\ndescription: Reviews pull requests for style issues.\nmodel: sonnet\n";

        assertTrue(validate(command(header + "tools: Read, Teleport"), ComponentType.AGENT)
                .hasWarning("STRUCT_W006"));
        assertTrue(validate(command(header + "tools: 5"), ComponentType.AGENT)
                .hasError("STRUCT_E008"));
        ValidatorResult listed = validate(command(header + "tools: [Read, Bash]"), ComponentType.AGENT);
        assertFalse(listed.hasWarning("STRUCT_W006"));
        assertTrue(listed.valid());
    }

    @Test
    void modelIsRecommendedForAgents() {
        String header = "name: a\ndescription: Reviews pull requests for style issues.\ntools: Read\n";

        assertTrue(validate(command(header), ComponentType.AGENT).hasWarning("STRUCT_W007"));
        ValidatorResult unknown = validate(command(header + "model: gpt-9"), ComponentType.AGENT);
        assertTrue(unknown.hasWarning("STRUCT_W008"));
        assertTrue(unknown.valid());

        assertFalse(validate(command("name: c\ndescription: Formats staged files before a commit."),
                ComponentType.COMMAND).hasWarning("STRUCT_W007"));
    }

    @Test
    void sizeCeilingAndSoftThreshold() {
        String header = "---\nname: big\ndescription: A very large command document for testing.\n---\n# Big\n";

        ValidatorResult over = validate(header + "a".repeat(110 * 1024), ComponentType.COMMAND);
        assertTrue(over.hasError("STRUCT_E003"));

        ValidatorResult near = validate(header + "a".repeat(90 * 1024), ComponentType.COMMAND);
        assertFalse(near.hasError("STRUCT_E003"));
        assertTrue(near.hasWarning("STRUCT_W002"));
    }

    @Test
    void binaryAndControlCharactersAreErrors() {
        assertTrue(validate(command("name: c\ndescription: Formats staged files before a commit.") + "\0",
                ComponentType.COMMAND).hasError("STRUCT_E005"));
        assertTrue(validate(command("name: c\ndescription: Formats staged files before a commit.") + "\u0007",
                ComponentType.COMMAND).hasError("STRUCT_E004"));
    }

    @Test
    void bodyOrganizationHeuristics() {
        String header = "---\nname: c\ndescription: Formats staged files before a commit.\n---\n";

        assertTrue(validate(header + "tiny", ComponentType.COMMAND).hasWarning("STRUCT_W009"));
        assertTrue(validate(header + "plain text ".repeat(10), ComponentType.COMMAND).hasWarning("STRUCT_W010"));

        StringBuilder many = new StringBuilder(header);
        for (int i = 0; i < 21; i++) {
            many.append("## Section ").append(i).append("\ncontent\n");
        }
        ValidatorResult fragmented = validate(many.toString(), ComponentType.COMMAND);
        assertTrue(fragmented.hasWarning("STRUCT_W011"));
        assertEquals("21", fragmented.info().stream()
                .filter(f -> f.code().equals("STRUCT_I004")).findFirst().orElseThrow().detail("count"));
    }

    @Test
    void scoreDeductsPerFinding() {
        // one error (missing header) and two warnings (short body, no sections)
        ValidatorResult result = validate("just words", ComponentType.COMMAND);

        assertEquals(1, result.errorCount());
        assertEquals(2, result.warningCount());
        assertEquals(100 - 25 - 10, result.score());
    }
}
