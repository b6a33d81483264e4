package com.agentvet.validation;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-call options. An empty {@code validators} set selects all four.
 *
 * @param strict         semantic warnings are additionally counted as errors
 * @param strictHttps    plain http references are errors instead of warnings
 * @param expectedHash   direct tamper check that bypasses the registry lookup
 * @param updateRegistry persist the new hash/version after comparison
 */
public record ValidationOptions(
        Set<ValidatorKind> validators,
        boolean strict,
        boolean strictHttps,
        String expectedHash,
        boolean updateRegistry
) {
    public ValidationOptions {
        validators = validators == null || validators.isEmpty()
                ? EnumSet.allOf(ValidatorKind.class)
                : EnumSet.copyOf(validators);
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(null, false, false, null, false);
    }

    public boolean runs(ValidatorKind kind) {
        return validators.contains(kind);
    }

    public ValidationOptions withValidators(Collection<ValidatorKind> kinds) {
        Set<ValidatorKind> selected = kinds == null || kinds.isEmpty()
                ? null : EnumSet.copyOf(kinds);
        return new ValidationOptions(selected, strict, strictHttps, expectedHash, updateRegistry);
    }

    public ValidationOptions withStrict(boolean value) {
        return new ValidationOptions(validators, value, strictHttps, expectedHash, updateRegistry);
    }

    public ValidationOptions withStrictHttps(boolean value) {
        return new ValidationOptions(validators, strict, value, expectedHash, updateRegistry);
    }

    public ValidationOptions withExpectedHash(String value) {
        return new ValidationOptions(validators, strict, strictHttps, value, updateRegistry);
    }

    public ValidationOptions withUpdateRegistry(boolean value) {
        return new ValidationOptions(validators, strict, strictHttps, expectedHash, value);
    }
}
