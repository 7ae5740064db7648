package com.myorg.tocparser.service;

import com.myorg.tocparser.model.OutlineNode;
import com.myorg.tocparser.model.RangeResolution;

import java.util.List;

public interface ChapterRangeResolver {

    /**
     * Derives the inclusive page range of every chapter from the start page of the next one.
     *
     * @param chapters   chapter nodes in document order; each node's page is its start page
     * @param totalPages page count of the paginated source
     */
    RangeResolution resolve(List<OutlineNode> chapters, int totalPages);
}
