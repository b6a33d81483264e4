package com.agentvet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "agentvet")
public class AgentvetProperties {

    private StructuralProperties structural = new StructuralProperties();
    private IntegrityProperties integrity = new IntegrityProperties();
    private ReferenceProperties reference = new ReferenceProperties();
    private SemanticProperties semantic = new SemanticProperties();
    private BatchProperties batch = new BatchProperties();
    private AuditProperties audit = new AuditProperties();
    private LoggingProperties logging = new LoggingProperties();

    public StructuralProperties getStructural() { return structural; }
    public void setStructural(StructuralProperties structural) { this.structural = structural; }

    public IntegrityProperties getIntegrity() { return integrity; }
    public void setIntegrity(IntegrityProperties integrity) { this.integrity = integrity; }

    public ReferenceProperties getReference() { return reference; }
    public void setReference(ReferenceProperties reference) { this.reference = reference; }

    public SemanticProperties getSemantic() { return semantic; }
    public void setSemantic(SemanticProperties semantic) { this.semantic = semantic; }

    public BatchProperties getBatch() { return batch; }
    public void setBatch(BatchProperties batch) { this.batch = batch; }

    public AuditProperties getAudit() { return audit; }
    public void setAudit(AuditProperties audit) { this.audit = audit; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public static class StructuralProperties {
        private int maxFileSizeBytes = 100 * 1024;
        private double sizeWarningRatio = 0.8;
        private int minDescriptionLength = 20;
        private int maxDescriptionLength = 500;
        private int minBodyLength = 50;
        private int maxSectionCount = 20;
        private List<String> knownTools = new ArrayList<>(List.of(
                "Read", "Write", "Edit", "MultiEdit", "Bash", "Glob", "Grep", "LS",
                "WebSearch", "WebFetch", "Task", "TodoWrite", "NotebookEdit", "*"));
        private List<String> knownModels = new ArrayList<>(List.of(
                "sonnet", "opus", "haiku", "inherit",
                "claude-3-5-sonnet", "claude-3-opus", "claude-3-haiku"));

        public int getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(int maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }
        public double getSizeWarningRatio() { return sizeWarningRatio; }
        public void setSizeWarningRatio(double sizeWarningRatio) { this.sizeWarningRatio = sizeWarningRatio; }
        public int getMinDescriptionLength() { return minDescriptionLength; }
        public void setMinDescriptionLength(int v) { this.minDescriptionLength = v; }
        public int getMaxDescriptionLength() { return maxDescriptionLength; }
        public void setMaxDescriptionLength(int v) { this.maxDescriptionLength = v; }
        public int getMinBodyLength() { return minBodyLength; }
        public void setMinBodyLength(int minBodyLength) { this.minBodyLength = minBodyLength; }
        public int getMaxSectionCount() { return maxSectionCount; }
        public void setMaxSectionCount(int maxSectionCount) { this.maxSectionCount = maxSectionCount; }
        public List<String> getKnownTools() { return knownTools; }
        public void setKnownTools(List<String> knownTools) { this.knownTools = knownTools; }
        public List<String> getKnownModels() { return knownModels; }
        public void setKnownModels(List<String> knownModels) { this.knownModels = knownModels; }
    }

    public static class IntegrityProperties {
        private String root;
        private String registryPath = ".claude/security/component-hashes.json";

        /** Working root used to relativize registry keys; blank means the process working directory. */
        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getRegistryPath() { return registryPath; }
        public void setRegistryPath(String registryPath) { this.registryPath = registryPath; }
    }

    public static class ReferenceProperties {
        private int maxInlineImageDataUriLength = 10_000;
        private List<String> suspiciousTlds = new ArrayList<>(List.of(
                ".tk", ".ml", ".ga", ".cf", ".gq", ".zip", ".mov", ".xyz"));

        public int getMaxInlineImageDataUriLength() { return maxInlineImageDataUriLength; }
        public void setMaxInlineImageDataUriLength(int v) { this.maxInlineImageDataUriLength = v; }
        public List<String> getSuspiciousTlds() { return suspiciousTlds; }
        public void setSuspiciousTlds(List<String> suspiciousTlds) { this.suspiciousTlds = suspiciousTlds; }
    }

    public static class SemanticProperties {
        private int contextRadius = 50;
        private Map<String, String> severityOverrides = new LinkedHashMap<>();

        public int getContextRadius() { return contextRadius; }
        public void setContextRadius(int contextRadius) { this.contextRadius = contextRadius; }

        /** Rule code to ERROR, WARNING or INFO. */
        public Map<String, String> getSeverityOverrides() { return severityOverrides; }
        public void setSeverityOverrides(Map<String, String> severityOverrides) { this.severityOverrides = severityOverrides; }
    }

    public static class BatchProperties {
        private int concurrency = 4;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    }

    public static class AuditProperties {
        private boolean enabled = false;
        private String directory = ".";
        private boolean verbose = false;
        private boolean json = false;
        private boolean colors = true;
        private boolean strict = false;
        private boolean strictHttps = false;
        private boolean updateRegistry = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public boolean isVerbose() { return verbose; }
        public void setVerbose(boolean verbose) { this.verbose = verbose; }
        public boolean isJson() { return json; }
        public void setJson(boolean json) { this.json = json; }
        public boolean isColors() { return colors; }
        public void setColors(boolean colors) { this.colors = colors; }
        public boolean isStrict() { return strict; }
        public void setStrict(boolean strict) { this.strict = strict; }
        public boolean isStrictHttps() { return strictHttps; }
        public void setStrictHttps(boolean strictHttps) { this.strictHttps = strictHttps; }
        public boolean isUpdateRegistry() { return updateRegistry; }
        public void setUpdateRegistry(boolean updateRegistry) { this.updateRegistry = updateRegistry; }
    }

    public static class LoggingProperties {
        private List<String> redactPatterns = new ArrayList<>();

        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
