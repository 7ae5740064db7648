package com.myorg.tocparser.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of classifying one dump line (plus the following line for chapter markers).
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class LineClassification {

    private final LineKind kind;

    /** Chapter number or dashed item number; null for {@link LineKind#OTHER}. */
    private final String number;

    @Builder.Default
    private final String title = "";

    /**
     * Printed page number. Null only for a chapter marker whose title line was missing,
     * in which case the caller falls back to the dump page of the marker.
     */
    private final Integer targetPage;

    /** 2 when the chapter title on the next line was merged in, otherwise 1. */
    @Builder.Default
    private final int linesConsumed = 1;

    public boolean hasTargetPage() {
        return targetPage != null;
    }
}
