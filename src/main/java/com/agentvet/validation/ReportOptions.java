package com.agentvet.validation;

public record ReportOptions(boolean verbose, boolean colors) {

    public static ReportOptions plain() {
        return new ReportOptions(false, false);
    }

    public static ReportOptions verbosePlain() {
        return new ReportOptions(true, false);
    }
}
