package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.config.OutlineParserProperties;
import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.ChapterRange;
import com.myorg.tocparser.model.Diagnostic;
import com.myorg.tocparser.model.DiagnosticType;
import com.myorg.tocparser.model.Division;
import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.model.OutlineNode;
import com.myorg.tocparser.model.OutlineResult;
import com.myorg.tocparser.service.processing.TextDumpReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class DefaultTocOutlineServiceTest {

    private final DefaultTocOutlineService service = DefaultTocOutlineService.fromProperties(new OutlineParserProperties());

    private List<Line> lines;

    @BeforeEach
    void loadDump() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/dumps/price_list_dump.txt");
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            lines = TextDumpReader.read(reader);
        }
    }

    @Test
    void runsEveryStageOverTheDump() {
        OutlineResult result = service.process("2024_standard_price_list.pdf", lines, 60);

        assertThat(result.getTocPages()).containsExactly(2, 3, 4);
        assertThat(result.getForest().getPages()).containsOnlyKeys(2, 3, 4);
        assertThat(result.getForest().totalNodes()).isEqualTo(11);
        assertThat(result.getForest().chapters()).extracting(OutlineNode::label)
                .containsExactly("제1장 적용기준", "제2장 가설공사", "제1장 도로포장공사", "제1장 배관공사");
    }

    @Test
    void classifiesDivisionsAndResolvesRanges() {
        OutlineResult result = service.process("2024_standard_price_list.pdf", lines, 60);

        assertThat(result.getDivisions().span(Division.COMMON).getStartPage()).isEqualTo(5);
        assertThat(result.getDivisions().span(Division.COMMON).getEndPage()).isEqualTo(29);
        assertThat(result.getDivisions().span(Division.CIVIL).getEndPage()).isEqualTo(44);
        assertThat(result.getDivisions().span(Division.MECHANICAL).getEndPage()).isEqualTo(60);
        assertThat(result.getDivisions().missingDivisions())
                .containsExactly(Division.ARCHITECTURE, Division.MAINTENANCE);

        assertThat(result.getRanges().getRanges())
                .extracting(ChapterRange::getStartPage, ChapterRange::getEndPage)
                .containsExactly(tuple(5, 11), tuple(12, 29), tuple(30, 44), tuple(45, 60));
        assertThat(result.allDiagnostics()).isEmpty();
    }

    @Test
    void diagnosticsFromAllStagesAreMerged() {
        OutlineResult result = service.process("short.pdf", lines, 40);

        assertThat(result.allDiagnostics()).extracting(Diagnostic::getType)
                .containsExactly(DiagnosticType.DIVISION_BOUNDARY_INCONSISTENT,
                        DiagnosticType.END_PAGE_CLAMPED, DiagnosticType.START_PAGE_OUT_OF_RANGE);
        assertThat(result.getDivisions().span(Division.MECHANICAL).getEndPage()).isEqualTo(45);
        assertThat(result.getRanges().getRanges()).hasSize(3);
    }

    @Test
    void dumpWithoutContentsHeadingIsAnEmptyOutline() {
        List<Line> body = List.of(Line.of(1, 1, "제1장"), Line.of(1, 2, "적용기준 ······· 3"));

        OutlineResult result = service.process("body.pdf", body, 10);

        assertThat(result.getTocPages()).isEmpty();
        assertThat(result.getForest().isEmpty()).isTrue();
        assertThat(result.getRanges().getRanges()).isEmpty();
        assertThat(result.getDivisions().missingDivisions()).hasSize(5);
    }

    @Test
    void missingTotalPagesViolatesContract() {
        assertThatThrownBy(() -> service.process("book.pdf", lines, 0)).isInstanceOf(InputContractException.class);
        assertThatThrownBy(() -> service.process("book.pdf", null, 60)).isInstanceOf(InputContractException.class);
    }
}
