package com.myorg.tocparser.service;

import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.model.PageForest;

import java.util.List;
import java.util.Set;

public interface OutlineTreeBuilder {

    /**
     * Builds the outline forest of every TOC page. Lines of other pages are ignored.
     */
    PageForest build(Set<Integer> tocPages, List<Line> lines);
}
