package com.myorg.tocparser.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of division classification: one span per division (always all five), the chapters
 * whose label is not in the table, and the diagnostics raised on the way.
 */
@Getter
@ToString
public final class DivisionReport {

    private final Map<Division, DivisionSpan> spans;
    private final List<OutlineNode> unclassified;
    private final List<Diagnostic> diagnostics;

    public DivisionReport(Map<Division, DivisionSpan> spans, List<OutlineNode> unclassified, List<Diagnostic> diagnostics) {
        EnumMap<Division, DivisionSpan> copy = new EnumMap<>(Division.class);
        for (Division division : Division.values()) {
            DivisionSpan span = spans.get(division);
            copy.put(division, span != null ? span : DivisionSpan.builder().division(division).build());
        }
        this.spans = Collections.unmodifiableMap(copy);
        this.unclassified = List.copyOf(unclassified);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public DivisionSpan span(Division division) {
        return spans.get(division);
    }

    /** Divisions that received no chapter, in canonical order. */
    public List<Division> missingDivisions() {
        return spans.values().stream()
                .filter(span -> !span.isPopulated())
                .map(DivisionSpan::getDivision)
                .collect(Collectors.toList());
    }
}
