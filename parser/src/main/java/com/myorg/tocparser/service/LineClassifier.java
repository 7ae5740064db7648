package com.myorg.tocparser.service;

import com.myorg.tocparser.model.LineClassification;

import java.util.Optional;

public interface LineClassifier {

    /**
     * Classifies one line of a TOC page.
     *
     * @param text     the line text
     * @param nextText the following line on the same page, or null; only looked at for chapter markers
     * @return the classification, or empty for noise
     */
    Optional<LineClassification> classify(String text, String nextText);

    default Optional<LineClassification> classify(String text) {
        return classify(text, null);
    }
}
