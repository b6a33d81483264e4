package com.agentvet.validation.integrity;

import com.agentvet.component.Component;
import com.agentvet.component.FrontmatterParser;
import com.agentvet.validation.ComponentValidator;
import com.agentvet.validation.FindingCollector;
import com.agentvet.validation.ValidationOptions;
import com.agentvet.validation.ValidatorKind;
import com.agentvet.validation.ValidatorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Hashes document content (SHA-256) and compares it against an expected
 * hash or the persisted registry to detect tampering and drift.
 */
@org.springframework.stereotype.Component
@Order(2)
public class IntegrityValidator implements ComponentValidator {

    private static final Logger log = LoggerFactory.getLogger(IntegrityValidator.class);

    private static final Pattern VERSION_SHAPE = Pattern.compile("^[vV]?\\d+(\\.\\d+)*$");
    private static final String UNVERSIONED = "unversioned";

    private final HashRegistry registry;
    private final FrontmatterParser frontmatterParser;

    public IntegrityValidator(HashRegistry registry, FrontmatterParser frontmatterParser) {
        this.registry = registry;
        this.frontmatterParser = frontmatterParser;
    }

    @Override
    public ValidatorKind kind() { return ValidatorKind.INTEGRITY; }

    @Override
    public ValidatorResult validate(Component component, ValidationOptions options) {
        FindingCollector findings = new FindingCollector();
        String path = component.path();

        if (!component.hasContent()) {
            findings.error("INT_E001", "Component content is empty or missing");
            return findings.toResult();
        }

        String hash = generateHash(component.content());
        findings.info("INT_I001", "Generated SHA256 hash",
                Map.of("hash", hash.substring(0, 16) + "...", "fullHash", hash));

        String version = resolveVersion(component);
        if (version == null) {
            findings.warning("INT_W002", "No version specified (semantic versioning recommended)");
        } else if (!VERSION_SHAPE.matcher(version).matches()) {
            findings.warning("INT_W003", "Version format \"" + version
                    + "\" doesn't follow semantic versioning (X.Y.Z)", Map.of("version", version));
        } else {
            findings.info("INT_I007", "Valid version: " + version, Map.of("version", version));
        }

        String key = registry.keyFor(path);
        boolean tampered = false;
        if (options.expectedHash() != null && !options.expectedHash().isBlank()) {
            tampered = !verifyHash(hash, options.expectedHash(), findings);
        } else {
            compareWithRegistry(key, hash, version, findings);
        }

        if (options.updateRegistry()) {
            if (tampered) {
                findings.info("INT_I010", "Registry not updated: content failed hash verification");
            } else {
                updateRegistry(key, component, hash, version, findings);
            }
        }

        ValidatorResult result = findings.toResult(hash, version);
        log.debug("Integrity check path={} key={} hash={} errors={} warnings={}",
                path, key, hash.substring(0, 16), result.errorCount(), result.warningCount());
        return result;
    }

    public String generateHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public IntegrityReport generateIntegrityReport(Component component) {
        ValidatorResult result = validate(component, ValidationOptions.defaults());
        return new IntegrityReport(result.valid(), result.hash(), result.version(),
                Instant.now().toString(), result.errors(), result.warnings());
    }

    /**
     * Validates each component independently; registry updates, when
     * requested, apply per component in the same pass.
     */
    public IntegrityBatchResult batchValidate(List<Component> components, ValidationOptions options) {
        int passed = 0;
        int failed = 0;
        int warnings = 0;
        List<IntegrityBatchResult.Entry> entries = new ArrayList<>();
        for (Component component : components) {
            ValidatorResult result = validate(component, options);
            entries.add(new IntegrityBatchResult.Entry(component.path(), result.valid(), result.hash(),
                    result.errorCount(), result.warningCount()));
            if (result.valid()) {
                passed++;
            } else {
                failed++;
            }
            warnings += result.warningCount();
        }
        return new IntegrityBatchResult(components.size(), passed, failed, warnings, entries);
    }

    private boolean verifyHash(String actual, String expected, FindingCollector findings) {
        String normalized = expected.trim().toLowerCase(Locale.ROOT);
        if (!actual.equals(normalized)) {
            findings.error("INT_E002", "Hash mismatch: Component content has been modified",
                    Map.of("expected", normalized, "actual", actual));
            return false;
        }
        findings.info("INT_I002", "Hash verification passed");
        return true;
    }

    private void compareWithRegistry(String key, String hash, String version, FindingCollector findings) {
        Optional<HashRegistryEntry> stored;
        try {
            stored = registry.find(key);
        } catch (HashRegistryException e) {
            log.warn("Hash registry unreadable while checking key={}: {}", key, e.getMessage());
            findings.warning("INT_W005", "Hash registry could not be read: " + e.getMessage());
            return;
        }

        if (stored.isEmpty()) {
            findings.info("INT_I005", "Component not in registry (new component)");
            return;
        }

        HashRegistryEntry previous = stored.get();
        if (!hash.equals(previous.hash())) {
            findings.warning("INT_W001", "Component hash has changed since last validation", Map.of(
                    "previousHash", abbreviate(previous.hash()),
                    "currentHash", abbreviate(hash),
                    "lastValidated", String.valueOf(previous.timestamp())));
        } else {
            findings.info("INT_I003", "Hash matches registry",
                    Map.of("lastValidated", String.valueOf(previous.timestamp())));
        }

        String previousVersion = previous.version();
        if (version != null && previousVersion != null && !UNVERSIONED.equals(previousVersion)
                && !previousVersion.equals(version)) {
            findings.info("INT_I004", "Version updated",
                    Map.of("previousVersion", previousVersion, "currentVersion", version));
        }
    }

    private void updateRegistry(String key, Component component, String hash, String version,
                                FindingCollector findings) {
        HashRegistryEntry entry = new HashRegistryEntry(hash,
                component.type() != null ? component.type().id() : null,
                version != null ? version : UNVERSIONED,
                Instant.now().toString(),
                component.path());
        try {
            registry.upsert(key, entry);
            findings.info("INT_I008", "Hash registry updated", Map.of("hash", abbreviate(hash)));
        } catch (HashRegistryException e) {
            log.warn("Failed to update hash registry for key={}: {}", key, e.getMessage());
            findings.warning("INT_W004", "Failed to update hash registry: " + e.getMessage());
        }
    }

    private String resolveVersion(Component component) {
        if (component.version() != null && !component.version().isBlank()) {
            return component.version().trim();
        }
        return frontmatterParser.parse(component.content()).text("version");
    }

    private static String abbreviate(String hash) {
        if (hash == null) return "";
        return hash.length() > 16 ? hash.substring(0, 16) + "..." : hash;
    }
}
