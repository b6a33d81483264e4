package com.agentvet.validation.semantic;

import com.agentvet.component.Component;
import com.agentvet.config.AgentvetProperties;
import com.agentvet.validation.ComponentValidator;
import com.agentvet.validation.Finding;
import com.agentvet.validation.FindingCollector;
import com.agentvet.validation.FindingLocation;
import com.agentvet.validation.Severity;
import com.agentvet.validation.ValidationOptions;
import com.agentvet.validation.ValidatorKind;
import com.agentvet.validation.ValidatorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Pattern-based detection of prompt injection, jailbreak phrasing, embedded
 * secrets, markup injection and destructive shell idioms. Best effort: a
 * clean result does not prove a document is benign.
 */
@org.springframework.stereotype.Component
@Order(3)
public class SemanticValidator implements ComponentValidator {

    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    static final String REDACTED = "<REDACTED>";

    private final List<PatternRule> rules;
    private final int contextRadius;

    @Autowired
    public SemanticValidator(AgentvetProperties properties) {
        this(SemanticRuleCatalog.defaultRules(), properties.getSemantic().getSeverityOverrides(),
                properties.getSemantic().getContextRadius());
    }

    SemanticValidator(List<PatternRule> catalog, Map<String, String> severityOverrides, int contextRadius) {
        this.rules = applyOverrides(catalog, severityOverrides);
        this.contextRadius = contextRadius;
    }

    @Override
    public ValidatorKind kind() { return ValidatorKind.SEMANTIC; }

    public List<PatternRule> getRules() {
        return rules;
    }

    @Override
    public ValidatorResult validate(Component component, ValidationOptions options) {
        FindingCollector findings = new FindingCollector();
        if (!component.hasContent()) {
            findings.error("SEM_E021", "Component content is empty or missing");
            return findings.toResult();
        }

        String content = component.content();
        for (PatternRule rule : rules) {
            if (rule.appliesTo(component.type())) {
                apply(rule, content, findings);
            }
        }

        if (options.strict()) {
            for (Finding warning : findings.warnings()) {
                findings.add(new Finding(warning.code(), Severity.ERROR, warning.message() + " (strict mode)",
                        warning.location(), warning.context(), warning.metadata()));
            }
        }

        ValidatorResult result = findings.toResult();
        log.debug("Semantic check path={} rules={} errors={} warnings={}",
                component.path(), rules.size(), result.errorCount(), result.warningCount());
        return result;
    }

    public SecurityReport generateSecurityReport(Component component) {
        ValidatorResult result = validate(component, ValidationOptions.defaults());

        Map<RiskLevel, List<Finding>> buckets = new LinkedHashMap<>();
        for (RiskLevel level : RiskLevel.values()) {
            buckets.put(level, new ArrayList<>());
        }
        List<Finding> reported = new ArrayList<>(result.errors());
        reported.addAll(result.warnings());
        for (Finding finding : reported) {
            String risk = finding.detail("riskSeverity");
            RiskLevel level = risk == null ? defaultRisk(finding.severity())
                    : RiskLevel.valueOf(risk.toUpperCase(Locale.ROOT));
            buckets.get(level).add(finding);
        }

        List<Finding> critical = List.copyOf(buckets.get(RiskLevel.CRITICAL));
        List<Finding> high = List.copyOf(buckets.get(RiskLevel.HIGH));
        List<Finding> medium = List.copyOf(buckets.get(RiskLevel.MEDIUM));
        List<Finding> low = List.copyOf(buckets.get(RiskLevel.LOW));

        return new SecurityReport(
                result.valid() && result.warningCount() == 0,
                calculateRiskLevel(critical.size(), high.size(), medium.size()),
                new SecurityReport.Summary(critical.size(), high.size(), medium.size(), low.size()),
                new SecurityReport.Issues(critical, high, medium, low));
    }

    public static RiskLevel calculateRiskLevel(int critical, int high, int medium) {
        if (critical > 0) return RiskLevel.CRITICAL;
        if (high > 0) return RiskLevel.HIGH;
        if (medium > 0) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    /**
     * Window of {@code radius} characters either side of {@code index},
     * with {@code ...} marking each truncated end.
     */
    public static String getContext(String content, int index, int radius) {
        int start = Math.max(0, index - radius);
        int end = Math.min(content.length(), index + radius);
        if (start >= end) return "";
        return (start > 0 ? "..." : "") + content.substring(start, end) + (end < content.length() ? "..." : "");
    }

    private void apply(PatternRule rule, String content, FindingCollector findings) {
        Matcher matcher = rule.pattern().matcher(content);
        if (!matcher.find()) return;

        int index = matcher.start();
        String matched = matcher.group();
        int count = 1;
        while (matcher.find()) {
            count++;
        }

        FindingLocation location = FindingLocation.at(content, index);
        String context;
        if (rule.redact()) {
            matched = redact(matched);
            location = location.withLineText(redact(location.lineText()));
            context = null;
        } else {
            context = getContext(content, index, contextRadius);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("riskSeverity", rule.risk().id());
        metadata.put("matches", String.valueOf(count));
        metadata.put("match", matched);
        findings.add(new Finding(rule.code(), rule.severity(), rule.message(), location, context, metadata));
    }

    static String redact(String text) {
        return text.replaceFirst("([:=]).*", "$1" + REDACTED);
    }

    private static RiskLevel defaultRisk(Severity severity) {
        return severity == Severity.ERROR ? RiskLevel.HIGH : RiskLevel.MEDIUM;
    }

    private static List<PatternRule> applyOverrides(List<PatternRule> catalog, Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) return List.copyOf(catalog);

        Map<String, Severity> resolved = new LinkedHashMap<>();
        overrides.forEach((code, value) -> {
            try {
                resolved.put(code, Severity.fromId(value));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring severity override {}={}: {}", code, value, e.getMessage());
            }
        });

        List<PatternRule> result = new ArrayList<>(catalog.size());
        for (PatternRule rule : catalog) {
            Severity override = resolved.remove(rule.code());
            result.add(override != null ? rule.withSeverity(override) : rule);
        }
        resolved.keySet().forEach(code -> log.warn("Ignoring severity override for unknown rule {}", code));
        return List.copyOf(result);
    }
}
