package com.myorg.tocparser.model;

/**
 * Content-level anomalies. None of them stops the pipeline.
 */
public enum DiagnosticType {
    DUPLICATE_SIBLING_NUMBER(Severity.WARNING),
    UNCLASSIFIED_CHAPTER(Severity.WARNING),
    DIVISION_BOUNDARY_INCONSISTENT(Severity.WARNING),
    END_PAGE_CLAMPED(Severity.WARNING),
    START_PAGE_OUT_OF_RANGE(Severity.ERROR),
    START_AFTER_END(Severity.ERROR);

    private final Severity severity;

    DiagnosticType(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
