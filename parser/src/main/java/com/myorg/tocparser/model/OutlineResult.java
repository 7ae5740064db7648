package com.myorg.tocparser.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * Everything one pipeline run produces for a dump.
 */
@Getter
@Builder
@ToString
public class OutlineResult {

    private final String sourceName;
    private final int totalPages;
    private final SortedSet<Integer> tocPages;
    private final PageForest forest;
    private final DivisionReport divisions;
    private final RangeResolution ranges;

    /** Tree, division and range diagnostics, in that order. */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(forest.getDiagnostics());
        all.addAll(divisions.getDiagnostics());
        all.addAll(ranges.getDiagnostics());
        return all;
    }
}
