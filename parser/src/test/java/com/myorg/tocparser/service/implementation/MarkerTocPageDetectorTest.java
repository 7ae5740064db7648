package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.config.OutlineParserProperties;
import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.Line;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarkerTocPageDetectorTest {

    private final MarkerTocPageDetector detector = new MarkerTocPageDetector();

    @Test
    void headingFollowedByPageNumber() {
        List<Line> lines = List.of(
                Line.of(2, 1, "목  차"),
                Line.of(2, 2, "2"),
                Line.of(2, 3, "제1장"));

        assertThat(detector.detect(lines)).containsExactly(2);
    }

    @Test
    void pageNumberFollowedByHeading() {
        List<Line> lines = List.of(
                Line.of(3, 1, "3"),
                Line.of(3, 2, "목차"));

        assertThat(detector.detect(lines)).containsExactly(3);
    }

    @Test
    void resultIsSortedAndUnique() {
        List<Line> lines = List.of(
                Line.of(2, 1, "목 차"),
                Line.of(2, 2, "4"),
                Line.of(3, 1, "2"),
                Line.of(3, 2, "목 차"),
                Line.of(4, 1, "목 차"),
                Line.of(4, 2, "4"));

        assertThat(detector.detect(lines)).containsExactly(2, 4);
    }

    @Test
    void pairSplitAcrossPagesIsIgnored() {
        List<Line> lines = List.of(
                Line.of(2, 7, "목 차"),
                Line.of(3, 1, "3"));

        assertThat(detector.detect(lines)).isEmpty();
    }

    @Test
    void headingInsideSentenceIsNotAMarker() {
        List<Line> lines = List.of(
                Line.of(9, 1, "목차는 다음과 같다"),
                Line.of(9, 2, "9"));

        assertThat(detector.detect(lines)).isEmpty();
    }

    @Test
    void noHeadingAnywhereGivesEmptySet() {
        List<Line> lines = List.of(
                Line.of(1, 1, "2024 건설공사 표준품셈"),
                Line.of(1, 2, "1"),
                Line.of(2, 1, "제1장 적용기준"));

        assertThat(detector.detect(lines)).isEmpty();
        assertThat(detector.detect(List.of())).isEmpty();
    }

    @Test
    void headingPatternIsConfigurable() {
        OutlineParserProperties properties = new OutlineParserProperties();
        properties.setContentsHeadingPattern("(?i)contents");
        MarkerTocPageDetector english = new MarkerTocPageDetector(properties);

        List<Line> lines = List.of(
                Line.of(5, 1, "CONTENTS"),
                Line.of(5, 2, "5"));

        assertThat(english.detect(lines)).containsExactly(5);
    }

    @Test
    void unorderedLinesViolateContract() {
        List<Line> lines = List.of(
                Line.of(4, 1, "목 차"),
                Line.of(3, 1, "3"));

        assertThatThrownBy(() -> detector.detect(lines)).isInstanceOf(InputContractException.class);
        assertThatThrownBy(() -> detector.detect(null)).isInstanceOf(InputContractException.class);
    }
}
