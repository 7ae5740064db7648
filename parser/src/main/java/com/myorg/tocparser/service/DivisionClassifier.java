package com.myorg.tocparser.service;

import com.myorg.tocparser.model.DivisionReport;
import com.myorg.tocparser.model.OutlineNode;

import java.util.List;

public interface DivisionClassifier {

    /**
     * Assigns chapters to divisions and computes each division's page span.
     *
     * @param chapters      chapter nodes in document order
     * @param lastKnownPage end page of the last populated division
     */
    DivisionReport classify(List<OutlineNode> chapters, int lastKnownPage);
}
