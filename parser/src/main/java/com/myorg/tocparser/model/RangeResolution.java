package com.myorg.tocparser.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Validated chapter ranges in document order, plus the chapters that were rejected and why.
 */
@Getter
@ToString
public final class RangeResolution {

    private final List<ChapterRange> ranges;
    private final List<OutlineNode> rejected;
    private final List<Diagnostic> diagnostics;

    public RangeResolution(List<ChapterRange> ranges, List<OutlineNode> rejected, List<Diagnostic> diagnostics) {
        this.ranges = List.copyOf(ranges);
        this.rejected = List.copyOf(rejected);
        this.diagnostics = List.copyOf(diagnostics);
    }
}
