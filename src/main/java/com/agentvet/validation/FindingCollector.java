package com.agentvet.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only accumulator for a single validation run. A fresh collector is
 * created per call so validators stay stateless.
 */
public class FindingCollector {

    private final List<Finding> errors = new ArrayList<>();
    private final List<Finding> warnings = new ArrayList<>();
    private final List<Finding> info = new ArrayList<>();

    public FindingCollector add(Finding finding) {
        switch (finding.severity()) {
            case ERROR -> errors.add(finding);
            case WARNING -> warnings.add(finding);
            case INFO -> info.add(finding);
        }
        return this;
    }

    public FindingCollector error(String code, String message) {
        return add(new Finding(code, Severity.ERROR, message));
    }

    public FindingCollector error(String code, String message, Map<String, String> metadata) {
        return add(new Finding(code, Severity.ERROR, message, null, null, metadata));
    }

    public FindingCollector warning(String code, String message) {
        return add(new Finding(code, Severity.WARNING, message));
    }

    public FindingCollector warning(String code, String message, Map<String, String> metadata) {
        return add(new Finding(code, Severity.WARNING, message, null, null, metadata));
    }

    public FindingCollector info(String code, String message) {
        return add(new Finding(code, Severity.INFO, message));
    }

    public FindingCollector info(String code, String message, Map<String, String> metadata) {
        return add(new Finding(code, Severity.INFO, message, null, null, metadata));
    }

    public List<Finding> errors() { return List.copyOf(errors); }

    public List<Finding> warnings() { return List.copyOf(warnings); }

    public ValidatorResult toResult() {
        return ValidatorResult.of(errors, warnings, info);
    }

    public ValidatorResult toResult(String hash, String version) {
        return ValidatorResult.of(errors, warnings, info, hash, version);
    }
}
