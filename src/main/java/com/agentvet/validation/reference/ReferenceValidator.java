package com.agentvet.validation.reference;

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
import org.springframework.core.annotation.Order;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates every link and image target in a document for protocol and
 * host safety. Evaluation is purely syntactic; nothing is fetched.
 */
@org.springframework.stereotype.Component
@Order(4)
public class ReferenceValidator implements ComponentValidator {

    private static final Logger log = LoggerFactory.getLogger(ReferenceValidator.class);

    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*):");

    private final int maxInlineImageDataUriLength;
    private final List<String> suspiciousTlds;

    public ReferenceValidator(AgentvetProperties properties) {
        AgentvetProperties.ReferenceProperties config = properties.getReference();
        this.maxInlineImageDataUriLength = config.getMaxInlineImageDataUriLength();
        this.suspiciousTlds = List.copyOf(config.getSuspiciousTlds());
    }

    @Override
    public ValidatorKind kind() { return ValidatorKind.REFERENCE; }

    @Override
    public ValidatorResult validate(Component component, ValidationOptions options) {
        FindingCollector findings = new FindingCollector();
        if (!component.hasContent()) {
            findings.error("REF_E001", "Component content is empty or missing");
            return findings.toResult();
        }

        String content = component.content();
        List<Reference> references = ReferenceExtractor.extract(content);
        for (Reference reference : references) {
            evaluate(reference, content, options.strictHttps(), findings);
        }
        findings.info("REF_I001", "References found: " + references.size(),
                Map.of("count", String.valueOf(references.size())));

        ValidatorResult result = findings.toResult();
        log.debug("Reference check path={} references={} errors={} warnings={}",
                component.path(), references.size(), result.errorCount(), result.warningCount());
        return result;
    }

    public ReferenceReport generateReferenceReport(Component component) {
        ValidatorResult result = validate(component, ValidationOptions.defaults());
        List<Reference> references = ReferenceExtractor.extract(component.content());

        int https = 0;
        int http = 0;
        for (Reference reference : references) {
            String target = reference.target().toLowerCase(Locale.ROOT);
            if (target.startsWith("https://")) {
                https++;
            } else if (target.startsWith("http://")) {
                http++;
            }
        }
        double percentage = references.isEmpty() ? 0.0
                : Math.round(https * 1000.0 / references.size()) / 10.0;

        List<ReferenceReport.ReferenceStatus> statuses = references.stream()
                .map(r -> new ReferenceReport.ReferenceStatus(r.target(), r.kind(),
                        result.errors().stream().noneMatch(e -> r.target().equals(e.detail("url")))))
                .toList();

        return new ReferenceReport(result.valid(), references.size(), https, http, percentage,
                result.errors(), result.warnings(), statuses);
    }

    void evaluate(Reference reference, String content, boolean strictHttps, FindingCollector findings) {
        String target = reference.target();
        Matcher schemeMatcher = SCHEME.matcher(target);
        if (!schemeMatcher.find()) {
            // relative path or in-page anchor
            return;
        }
        String scheme = schemeMatcher.group(1).toLowerCase(Locale.ROOT);
        FindingLocation location = FindingLocation.at(content, reference.index());

        switch (scheme) {
            case "javascript" -> {
                report(findings, "REF_E005", Severity.ERROR,
                        "Dangerous protocol in link: javascript: (script execution)", reference, location);
                return;
            }
            case "vbscript" -> {
                report(findings, "REF_E007", Severity.ERROR,
                        "Dangerous protocol in link: vbscript: (script execution)", reference, location);
                return;
            }
            case "file" -> {
                report(findings, "REF_E002", Severity.ERROR,
                        "Blocked protocol detected: file: (local file disclosure)", reference, location);
                return;
            }
            case "ftp" -> {
                report(findings, "REF_E008", Severity.ERROR,
                        "Blocked protocol detected: ftp:", reference, location);
                return;
            }
            case "data" -> {
                evaluateDataUri(reference, location, findings);
                return;
            }
            case "mailto", "tel" -> {
                return;
            }
            case "http" -> {
                if (strictHttps) {
                    report(findings, "REF_E003", Severity.ERROR,
                            "HTTP protocol not allowed (HTTPS required)", reference, location);
                } else {
                    report(findings, "REF_W002", Severity.WARNING,
                            "HTTP protocol detected (HTTPS recommended)", reference, location);
                }
            }
            case "https" -> {
                // host checks below
            }
            default -> {
                report(findings, "REF_W001", Severity.WARNING,
                        "Unknown protocol: " + scheme + ":", reference, location);
                if (!target.regionMatches(schemeMatcher.end(), "//", 0, 2)) return;
            }
        }

        String host;
        try {
            host = new URI(target).getHost();
        } catch (URISyntaxException e) {
            report(findings, "REF_W005", Severity.WARNING,
                    "Invalid URL format: " + e.getReason(), reference, location);
            return;
        }
        if (host == null || host.isBlank()) {
            report(findings, "REF_W005", Severity.WARNING,
                    "Invalid URL format: missing host", reference, location);
            return;
        }

        if (HostClassifier.isPrivateAddress(host)) {
            report(findings, "REF_E004", Severity.ERROR,
                    "Private IP address detected (potential SSRF risk)", reference, location, host);
        } else if (HostClassifier.isLocalhostName(host)) {
            report(findings, "REF_W003", Severity.WARNING,
                    "Localhost reference detected", reference, location, host);
        }

        if (HostClassifier.hasSuspiciousTld(host, suspiciousTlds)) {
            report(findings, "REF_W004", Severity.WARNING,
                    "Suspicious or uncommon TLD detected", reference, location, host);
        }
    }

    private void evaluateDataUri(Reference reference, FindingLocation location, FindingCollector findings) {
        int length = reference.target().length();
        if (!reference.isImage()) {
            report(findings, "REF_E006", Severity.ERROR,
                    "Blocked protocol detected: data: outside an inline image", reference, location);
        } else if (length > maxInlineImageDataUriLength) {
            report(findings, "REF_W006", Severity.WARNING, String.format(Locale.ROOT,
                    "Large data URI in image (%.2fKB)", length / 1024.0), reference, location);
        }
    }

    private void report(FindingCollector findings, String code, Severity severity, String message,
                        Reference reference, FindingLocation location) {
        report(findings, code, severity, message, reference, location, null);
    }

    private void report(FindingCollector findings, String code, Severity severity, String message,
                        Reference reference, FindingLocation location, String host) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("url", reference.target());
        metadata.put("kind", reference.kind().name().toLowerCase(Locale.ROOT));
        if (host != null) {
            metadata.put("hostname", host);
        }
        findings.add(new Finding(code, severity, message, location, null, metadata));
    }
}
