package com.agentvet.validation;

import java.util.List;
import java.util.Map;

/**
 * Plain-text rendering of aggregate and batch results. Output depends only
 * on the result and the options, so the same input always renders the same
 * text.
 */
public class ValidationReportRenderer {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String BLUE = "\u001B[34m";
    private static final String GRAY = "\u001B[90m";

    private static final String RULE = "━".repeat(60);

    public String render(AggregateResult result, ReportOptions options) {
        StringBuilder out = new StringBuilder();
        appendComponent(out, result, options);
        out.append(paint(RULE, GRAY, options)).append('\n');
        return out.toString();
    }

    public String render(BatchResult batch, ReportOptions options) {
        StringBuilder out = new StringBuilder();
        BatchResult.Summary summary = batch.summary();
        out.append('\n')
                .append(paint("Security Audit Report", BLUE, options)).append('\n')
                .append(paint(RULE, GRAY, options)).append("\n\n")
                .append("Summary:\n")
                .append("   Total components: ").append(summary.total()).append('\n')
                .append("   ").append(paint("Passed", GREEN, options)).append(": ").append(summary.passed()).append('\n')
                .append("   ").append(paint("Failed", RED, options)).append(": ").append(summary.failed()).append('\n')
                .append("   ").append(paint("Warnings", YELLOW, options)).append(": ").append(summary.warnings()).append("\n\n");
        for (AggregateResult component : batch.components()) {
            appendComponent(out, component, options);
        }
        out.append(paint(RULE, GRAY, options)).append('\n');
        return out.toString();
    }

    private void appendComponent(StringBuilder out, AggregateResult result, ReportOptions options) {
        AggregateResult.Overall overall = result.overall();
        String status = overall.valid() ? paint("PASS", GREEN, options) : paint("FAIL", RED, options);
        out.append(status).append(' ')
                .append(result.component().path() == null ? "<unnamed>" : result.component().path()).append(' ')
                .append(scoreBadge(overall.score(), options)).append('\n');

        for (Map.Entry<String, ValidatorResult> entry : result.validators().entrySet()) {
            ValidatorResult validator = entry.getValue();
            String mark = validator.valid() ? paint("ok", GREEN, options) : paint("x", RED, options);
            String verdict = validator.errorCount() == 0 ? "PASS" : validator.errorCount() + " errors";
            out.append("   ├─ ").append(mark).append(' ').append(entry.getKey()).append(": ").append(verdict)
                    .append(' ').append(paint("(" + validator.score() + "/100)", GRAY, options)).append('\n');

            if (options.verbose()) {
                appendFindings(out, validator.errors(), "ERROR", RED, options);
                appendFindings(out, validator.warnings(), "WARNING", YELLOW, options);
                appendFindings(out, validator.info(), "INFO", BLUE, options);
            }
        }
        out.append('\n');
    }

    private void appendFindings(StringBuilder out, List<Finding> findings, String label, String color,
                                ReportOptions options) {
        for (Finding finding : findings) {
            out.append("   │  ").append(paint(label, color, options)).append(": ").append(finding.message())
                    .append(' ').append(paint("[" + finding.code() + "]", GRAY, options));
            if (finding.location() != null) {
                out.append(' ').append(paint("line " + finding.location().position(), GRAY, options));
            }
            out.append('\n');
        }
    }

    private String scoreBadge(int score, ReportOptions options) {
        String badge = "[" + score + "/100]";
        if (score >= 90) return paint(badge, GREEN, options);
        if (score >= 70) return paint(badge, YELLOW, options);
        if (score >= 50) return paint(badge, RED, options);
        return paint(badge, GRAY, options);
    }

    private static String paint(String text, String color, ReportOptions options) {
        return options.colors() ? color + text + RESET : text;
    }
}
