package com.myorg.tocparser.service;

import com.myorg.tocparser.model.Line;

import java.util.List;
import java.util.SortedSet;

public interface TocPageDetector {

    /**
     * Finds the pages that carry printed table-of-contents text.
     *
     * @param lines page-ordered dump lines
     * @return sorted, de-duplicated page numbers; empty when no contents heading was found
     */
    SortedSet<Integer> detect(List<Line> lines);
}
