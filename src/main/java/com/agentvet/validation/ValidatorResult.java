package com.agentvet.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one validator for one document. {@code hash} and
 * {@code version} are only populated by the integrity validator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidatorResult(
        boolean valid,
        int score,
        List<Finding> errors,
        List<Finding> warnings,
        List<Finding> info,
        @JsonInclude(JsonInclude.Include.NON_NULL) String hash,
        @JsonInclude(JsonInclude.Include.NON_NULL) String version
) {
    public ValidatorResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        info = info == null ? List.of() : List.copyOf(info);
    }

    public static ValidatorResult of(List<Finding> errors, List<Finding> warnings, List<Finding> info) {
        return of(errors, warnings, info, null, null);
    }

    public static ValidatorResult of(List<Finding> errors, List<Finding> warnings, List<Finding> info,
                                     String hash, String version) {
        return new ValidatorResult(errors.isEmpty(), Scoring.deduct(errors.size(), warnings.size()),
                errors, warnings, info, hash, version);
    }

    @JsonProperty(value = "errorCount", access = JsonProperty.Access.READ_ONLY)
    public int errorCount() {
        return errors.size();
    }

    @JsonProperty(value = "warningCount", access = JsonProperty.Access.READ_ONLY)
    public int warningCount() {
        return warnings.size();
    }

    @JsonProperty(value = "infoCount", access = JsonProperty.Access.READ_ONLY)
    public int infoCount() {
        return info.size();
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(f -> f.code().equals(code));
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(f -> f.code().equals(code));
    }

    public boolean hasInfo(String code) {
        return info.stream().anyMatch(f -> f.code().equals(code));
    }
}
