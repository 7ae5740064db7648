package com.myorg.tocparser.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One line of the page-segmented text dump, as produced by the external extractor.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(staticName = "of")
public class Line {

    /** Physical page of the dump the line appears on. */
    private final int page;

    /** 1-based line number within the page. */
    private final int lineNumber;

    private final String text;
}
