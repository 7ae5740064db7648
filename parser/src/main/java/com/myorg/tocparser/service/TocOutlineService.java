package com.myorg.tocparser.service;

import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.model.OutlineResult;

import java.util.List;

public interface TocOutlineService {

    /**
     * Runs page detection, tree building, division classification and range resolution.
     *
     * @param sourceName name of the source document, for logs and output metadata
     * @param lines      page-ordered dump lines
     * @param totalPages page count of the paginated source
     */
    OutlineResult process(String sourceName, List<Line> lines, int totalPages);
}
