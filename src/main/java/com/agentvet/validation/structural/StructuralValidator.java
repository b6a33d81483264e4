package com.agentvet.validation.structural;

import com.agentvet.component.Component;
import com.agentvet.component.ComponentType;
import com.agentvet.component.Frontmatter;
import com.agentvet.component.FrontmatterParser;
import com.agentvet.config.AgentvetProperties;
import com.agentvet.validation.ComponentValidator;
import com.agentvet.validation.FindingCollector;
import com.agentvet.validation.ValidationOptions;
import com.agentvet.validation.ValidatorKind;
import com.agentvet.validation.ValidatorResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that a document is well-formed: header present and parseable,
 * required fields, size and description bounds, declared tools/model,
 * body organization and encoding sanity.
 */
@org.springframework.stereotype.Component
@Order(1)
public class StructuralValidator implements ComponentValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private static final Pattern SECTION_HEADER = Pattern.compile("^#{1,6}\\s+\\S.*$", Pattern.MULTILINE);

    private static final List<String> DEFAULT_REQUIRED = List.of("name", "description");

    private static final Map<ComponentType, List<String>> REQUIRED_FIELDS = new EnumMap<>(Map.of(
            ComponentType.AGENT, List.of("name", "description", "tools"),
            ComponentType.MCP, List.of("name", "description", "command"),
            ComponentType.HOOK, List.of("name", "description", "trigger")
    ));

    private static final Map<ComponentType, List<String>> RECOMMENDED_FIELDS = new EnumMap<>(Map.of(
            ComponentType.AGENT, List.of("model"),
            ComponentType.COMMAND, List.of("usage", "examples"),
            ComponentType.MCP, List.of("args"),
            ComponentType.SETTING, List.of("type"),
            ComponentType.HOOK, List.of("conditions")
    ));

    private final AgentvetProperties.StructuralProperties limits;
    private final FrontmatterParser frontmatterParser;
    private final Set<String> knownTools;
    private final Set<String> knownModels;

    public StructuralValidator(AgentvetProperties properties, FrontmatterParser frontmatterParser) {
        this.limits = properties.getStructural();
        this.frontmatterParser = frontmatterParser;
        this.knownTools = new LinkedHashSet<>(limits.getKnownTools());
        this.knownModels = new LinkedHashSet<>();
        for (String model : limits.getKnownModels()) {
            knownModels.add(model.toLowerCase(Locale.ROOT));
        }
    }

    @Override
    public ValidatorKind kind() { return ValidatorKind.STRUCTURAL; }

    @Override
    public ValidatorResult validate(Component component, ValidationOptions options) {
        FindingCollector findings = new FindingCollector();
        String content = component.content();
        String path = component.path();

        if (!component.hasContent()) {
            findings.error("STRUCT_E009", "Component content is empty or missing", Map.of("path", nullSafe(path)));
            return findings.toResult();
        }

        checkSize(content, findings);
        checkEncoding(content, findings);

        Frontmatter frontmatter = frontmatterParser.parse(content);
        switch (frontmatter.status()) {
            case MISSING -> findings.error("STRUCT_E001",
                    "Missing YAML frontmatter (must start with --- and end with ---)");
            case MALFORMED -> findings.error("STRUCT_E002",
                    "Invalid YAML syntax in frontmatter: " + frontmatter.error());
            case NOT_AN_OBJECT -> findings.error("STRUCT_E002", "Frontmatter is empty or not a valid object");
            case PARSED -> {
                findings.info("STRUCT_I002", "Valid YAML frontmatter found");
                checkRequiredFields(frontmatter, component.type(), findings);
                checkDescription(frontmatter, findings);
                checkTools(frontmatter, findings);
                if (component.type() == ComponentType.AGENT) {
                    checkModel(frontmatter, findings);
                }
                checkRecommendedFields(frontmatter, component.type(), findings);
            }
        }

        checkBody(frontmatter.body(), findings);

        ValidatorResult result = findings.toResult();
        log.debug("Structural check path={} errors={} warnings={} score={}",
                path, result.errorCount(), result.warningCount(), result.score());
        return result;
    }

    void checkSize(String content, FindingCollector findings) {
        int size = content.getBytes(StandardCharsets.UTF_8).length;
        int limit = limits.getMaxFileSizeBytes();
        Map<String, String> details = Map.of("size", String.valueOf(size), "limit", String.valueOf(limit));

        if (size > limit) {
            findings.error("STRUCT_E003", String.format(Locale.ROOT,
                    "File size (%.2fKB) exceeds maximum allowed size (%.0fKB)", size / 1024.0, limit / 1024.0), details);
        } else if (size > limit * limits.getSizeWarningRatio()) {
            findings.warning("STRUCT_W002", String.format(Locale.ROOT,
                    "File size (%.2fKB) is approaching the limit", size / 1024.0), details);
        }
        findings.info("STRUCT_I001", String.format(Locale.ROOT, "File size: %.2fKB", size / 1024.0),
                Map.of("size", String.valueOf(size)));
    }

    void checkEncoding(String content, FindingCollector findings) {
        if (content.indexOf('\0') >= 0) {
            findings.error("STRUCT_E005", "File contains null bytes (possible binary content)");
        }

        int controlIndex = -1;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            boolean control = c != '\0' && c != '\n' && c != '\r' && c != '\t'
                    && (c < 0x20 || c == 0x7F);
            boolean brokenSurrogate = Character.isHighSurrogate(c)
                    ? i + 1 >= content.length() || !Character.isLowSurrogate(content.charAt(i + 1))
                    : Character.isLowSurrogate(c) && (i == 0 || !Character.isHighSurrogate(content.charAt(i - 1)));
            if (control || brokenSurrogate || c == '\uFFFD') {
                controlIndex = i;
                break;
            }
        }
        if (controlIndex >= 0) {
            findings.error("STRUCT_E004",
                    "File contains control characters or invalid UTF-8 sequences",
                    Map.of("offset", String.valueOf(controlIndex)));
        }
    }

    void checkRequiredFields(Frontmatter frontmatter, ComponentType type, FindingCollector findings) {
        List<String> required = type == null ? DEFAULT_REQUIRED : REQUIRED_FIELDS.getOrDefault(type, DEFAULT_REQUIRED);
        for (String field : required) {
            if (frontmatter.isMissing(field)) {
                findings.error("STRUCT_E006", "Missing required field: " + field, Map.of("field", field));
            }
        }
    }

    void checkDescription(Frontmatter frontmatter, FindingCollector findings) {
        JsonNode description = frontmatter.field("description");
        if (description == null || frontmatter.isMissing("description")) return;

        if (!description.isTextual()) {
            findings.error("STRUCT_E007", "Description must be a string",
                    Map.of("type", description.getNodeType().name().toLowerCase(Locale.ROOT)));
            return;
        }

        int length = description.asText().trim().length();
        if (length < limits.getMinDescriptionLength()) {
            findings.warning("STRUCT_W003", String.format(Locale.ROOT,
                    "Description is too short (%d chars, minimum %d)", length, limits.getMinDescriptionLength()));
        }
        if (length > limits.getMaxDescriptionLength()) {
            findings.warning("STRUCT_W004", String.format(Locale.ROOT,
                    "Description is too long (%d chars, maximum %d)", length, limits.getMaxDescriptionLength()));
        }
    }

    void checkTools(Frontmatter frontmatter, FindingCollector findings) {
        JsonNode tools = frontmatter.field("tools");
        if (tools == null) return;

        List<String> declared = new ArrayList<>();
        if (tools.isTextual()) {
            Arrays.stream(tools.asText().split(","))
                    .map(String::trim)
                    .filter(t -> !t.isEmpty())
                    .forEach(declared::add);
        } else if (tools.isArray()) {
            tools.forEach(t -> {
                String name = t.asText().trim();
                if (!name.isEmpty()) declared.add(name);
            });
        } else {
            findings.error("STRUCT_E008", "Tools field must be a string or array",
                    Map.of("type", tools.getNodeType().name().toLowerCase(Locale.ROOT)));
            return;
        }

        if (declared.isEmpty()) {
            findings.warning("STRUCT_W005", "Tools field is empty");
            return;
        }

        List<String> unknown = declared.stream().filter(t -> !knownTools.contains(t)).toList();
        if (!unknown.isEmpty()) {
            findings.warning("STRUCT_W006", "Unknown tools specified: " + String.join(", ", unknown),
                    Map.of("tools", String.join(",", unknown)));
        }
    }

    void checkModel(Frontmatter frontmatter, FindingCollector findings) {
        String model = frontmatter.text("model");
        if (model == null) {
            findings.warning("STRUCT_W007", "No model specified (recommended)");
            return;
        }
        if (!knownModels.contains(model.toLowerCase(Locale.ROOT))) {
            findings.warning("STRUCT_W008", "Unknown model: " + model + ". Valid models: "
                    + String.join(", ", limits.getKnownModels()), Map.of("model", model));
        }
    }

    void checkRecommendedFields(Frontmatter frontmatter, ComponentType type, FindingCollector findings) {
        if (type == null) return;
        List<String> missing = RECOMMENDED_FIELDS.getOrDefault(type, List.of()).stream()
                .filter(frontmatter::isMissing)
                .toList();
        if (!missing.isEmpty()) {
            findings.info("STRUCT_I003", "Missing recommended fields: " + String.join(", ", missing));
        }
    }

    void checkBody(String body, FindingCollector findings) {
        int length = body.trim().length();
        if (length < limits.getMinBodyLength()) {
            findings.warning("STRUCT_W009", String.format(Locale.ROOT,
                    "Component content is very short (less than %d characters)", limits.getMinBodyLength()),
                    Map.of("length", String.valueOf(length)));
        }

        int sections = 0;
        Matcher matcher = SECTION_HEADER.matcher(body);
        while (matcher.find()) {
            sections++;
        }
        if (sections == 0) {
            findings.warning("STRUCT_W010", "No markdown headers found in content (recommended for organization)");
        } else if (sections > limits.getMaxSectionCount()) {
            findings.warning("STRUCT_W011", String.format(Locale.ROOT,
                    "Too many sections (%d), may cause context overflow. Maximum recommended: %d",
                    sections, limits.getMaxSectionCount()));
        }
        findings.info("STRUCT_I004", "Section count: " + sections, Map.of("count", String.valueOf(sections)));
    }

    private static String nullSafe(String value) {
        return value == null ? "" : value;
    }
}
