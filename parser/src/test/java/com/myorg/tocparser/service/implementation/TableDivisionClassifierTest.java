package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.Diagnostic;
import com.myorg.tocparser.model.DiagnosticType;
import com.myorg.tocparser.model.Division;
import com.myorg.tocparser.model.DivisionReport;
import com.myorg.tocparser.model.DivisionSpan;
import com.myorg.tocparser.model.OutlineNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableDivisionClassifierTest {

    private final TableDivisionClassifier classifier = new TableDivisionClassifier();

    @Test
    void divisionsEndWhereTheNextOneStarts() {
        List<OutlineNode> chapters = List.of(
                OutlineNode.chapter("1", "적용기준", 5),
                OutlineNode.chapter("2", "가설공사", 12),
                OutlineNode.chapter("1", "도로포장공사", 30),
                OutlineNode.chapter("1", "철골공사", 60),
                OutlineNode.chapter("1", "배관공사", 90),
                OutlineNode.chapter("1", "공 통", 120));

        DivisionReport report = classifier.classify(chapters, 150);

        assertSpan(report.span(Division.COMMON), 5, 29);
        assertSpan(report.span(Division.CIVIL), 30, 59);
        assertSpan(report.span(Division.ARCHITECTURE), 60, 89);
        assertSpan(report.span(Division.MECHANICAL), 90, 119);
        assertSpan(report.span(Division.MAINTENANCE), 120, 150);
        assertThat(report.span(Division.COMMON).getChapters()).extracting(OutlineNode::label)
                .containsExactly("제1장 적용기준", "제2장 가설공사");
        assertThat(report.missingDivisions()).isEmpty();
        assertThat(report.getDiagnostics()).isEmpty();
    }

    @Test
    void firstChapterFixesTheStartPage() {
        List<OutlineNode> chapters = List.of(
                OutlineNode.chapter("2", "가설공사", 12),
                OutlineNode.chapter("1", "적용기준", 5));

        assertSpan(classifier.classify(chapters, 40).span(Division.COMMON), 12, 40);
    }

    @Test
    void skippedDivisionsAreLookedPast() {
        List<OutlineNode> chapters = List.of(
                OutlineNode.chapter("1", "적용기준", 3),
                OutlineNode.chapter("1", "배관공사", 100));

        DivisionReport report = classifier.classify(chapters, 140);

        assertSpan(report.span(Division.COMMON), 3, 99);
        assertSpan(report.span(Division.MECHANICAL), 100, 140);
        assertThat(report.span(Division.CIVIL).getStartPage()).isNull();
        assertThat(report.span(Division.CIVIL).getEndPage()).isNull();
        assertThat(report.missingDivisions())
                .containsExactly(Division.CIVIL, Division.ARCHITECTURE, Division.MAINTENANCE);
    }

    @Test
    void unknownLabelIsReportedNotDefaulted() {
        List<OutlineNode> chapters = List.of(
                OutlineNode.chapter("1", "적용기준", 3),
                OutlineNode.chapter("9", "기타", 80),
                OutlineNode.chapter("1", "측량", 90));

        DivisionReport report = classifier.classify(chapters, 100);

        assertThat(report.getUnclassified()).extracting(OutlineNode::label).containsExactly("제9장 기타", "제1장 측량");
        assertThat(report.getDiagnostics()).extracting(Diagnostic::getType)
                .containsExactly(DiagnosticType.UNCLASSIFIED_CHAPTER, DiagnosticType.UNCLASSIFIED_CHAPTER);
        assertThat(report.span(Division.COMMON).getChapters()).hasSize(1);
        assertSpan(report.span(Division.COMMON), 3, 100);
    }

    @Test
    void spacedTitlesMatchExactly() {
        DivisionReport report = classifier.classify(List.of(OutlineNode.chapter("9", "측 량", 70)), 80);

        assertSpan(report.span(Division.CIVIL), 70, 80);
    }

    @Test
    void invertedBoundaryIsPinnedToStartAndReported() {
        List<OutlineNode> chapters = List.of(
                OutlineNode.chapter("1", "적용기준", 50),
                OutlineNode.chapter("1", "도로포장공사", 20));

        DivisionReport report = classifier.classify(chapters, 90);

        assertSpan(report.span(Division.COMMON), 50, 50);
        assertSpan(report.span(Division.CIVIL), 20, 90);
        assertThat(report.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.getType()).isEqualTo(DiagnosticType.DIVISION_BOUNDARY_INCONSISTENT));
    }

    @Test
    void noChaptersLeavesEveryDivisionEmpty() {
        DivisionReport report = classifier.classify(List.of(), 10);

        assertThat(report.getSpans()).hasSize(5);
        assertThat(report.missingDivisions()).containsExactly(Division.values());
    }

    @Test
    void contractViolationsThrow() {
        assertThatThrownBy(() -> classifier.classify(null, 10)).isInstanceOf(InputContractException.class);
        assertThatThrownBy(() -> classifier.classify(List.of(), 0)).isInstanceOf(InputContractException.class);
        assertThatThrownBy(() -> classifier.classify(List.of(OutlineNode.item("1-1", "일반사항", 3)), 10))
                .isInstanceOf(InputContractException.class);
    }

    private static void assertSpan(DivisionSpan span, int start, int end) {
        assertThat(span.isPopulated()).isTrue();
        assertThat(span.getStartPage()).isEqualTo(start);
        assertThat(span.getEndPage()).isEqualTo(end);
    }
}
