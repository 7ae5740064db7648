package com.myorg.tocparser.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Page span of one division. Both pages are null when no chapter was classified into it.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class DivisionSpan {

    private final Division division;

    private final Integer startPage;

    private final Integer endPage;

    @Builder.Default
    private final List<OutlineNode> chapters = List.of();

    public boolean isPopulated() {
        return startPage != null;
    }

    public List<OutlineNode> getChapters() {
        return chapters == null ? List.of() : List.copyOf(chapters);
    }
}
