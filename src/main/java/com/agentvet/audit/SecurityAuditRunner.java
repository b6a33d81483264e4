package com.agentvet.audit;

import com.agentvet.component.Component;
import com.agentvet.config.AgentvetProperties;
import com.agentvet.validation.BatchResult;
import com.agentvet.validation.ReportOptions;
import com.agentvet.validation.ValidationOptions;
import com.agentvet.validation.ValidationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * One-shot audit of a component directory. Prints the batch report and
 * exits non-zero when any document fails validation.
 */
@org.springframework.stereotype.Component
@ConditionalOnProperty(prefix = "agentvet.audit", name = "enabled", havingValue = "true")
public class SecurityAuditRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SecurityAuditRunner.class);

    private final ComponentScanner scanner;
    private final ValidationOrchestrator orchestrator;
    private final AgentvetProperties.AuditProperties audit;
    private final PrintStream out;
    private volatile int exitCode = 0;

    @Autowired
    public SecurityAuditRunner(ComponentScanner scanner, ValidationOrchestrator orchestrator,
                               AgentvetProperties properties) {
        this(scanner, orchestrator, properties, System.out);
    }

    SecurityAuditRunner(ComponentScanner scanner, ValidationOrchestrator orchestrator,
                        AgentvetProperties properties, PrintStream out) {
        this.scanner = scanner;
        this.orchestrator = orchestrator;
        this.audit = properties.getAudit();
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path root = Path.of(audit.getDirectory());
        List<Component> components = scanner.scan(root);
        if (components.isEmpty()) {
            log.warn("No components found under {}", root.toAbsolutePath());
            out.println("No components found under " + root);
            exitCode = 0;
            return;
        }

        ValidationOptions options = ValidationOptions.defaults()
                .withStrict(audit.isStrict())
                .withStrictHttps(audit.isStrictHttps())
                .withUpdateRegistry(audit.isUpdateRegistry());
        BatchResult result = orchestrator.validateComponents(components, options);

        if (audit.isJson()) {
            out.println(orchestrator.generateJsonReport(result));
        } else {
            out.print(orchestrator.generateReport(result, new ReportOptions(audit.isVerbose(), audit.isColors())));
        }

        exitCode = result.summary().failed() > 0 ? 1 : 0;
        if (exitCode != 0) {
            log.warn("Audit failed: {} of {} components invalid, codes={}", result.summary().failed(),
                    result.summary().total(), orchestrator.getErrorCodes(result));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
