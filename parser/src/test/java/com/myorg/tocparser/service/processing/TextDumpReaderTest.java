package com.myorg.tocparser.service.processing;

import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.Line;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextDumpReaderTest {

    @Test
    void readsNumberedLinesPerPage() {
        String dump = String.join("\n",
                "파일: sample.pdf",
                "=== 1페이지 ===",
                "1줄: 표지",
                "----",
                "",
                "=== 3페이지 ===",
                "1줄: 목  차",
                "2줄: 3",
                "4줄: 제1장",
                "----");

        List<Line> lines = TextDumpReader.parse(dump);

        assertThat(lines).containsExactly(
                Line.of(1, 1, "표지"),
                Line.of(3, 1, "목  차"),
                Line.of(3, 2, "3"),
                Line.of(3, 4, "제1장"));
    }

    @Test
    void unprefixedLinesAreNumberedInOrder() {
        String dump = String.join("\n",
                "=== 2페이지 ===",
                "목 차",
                "2",
                "1-1 일반사항 ······ 3");

        assertThat(TextDumpReader.parse(dump)).containsExactly(
                Line.of(2, 1, "목 차"),
                Line.of(2, 2, "2"),
                Line.of(2, 3, "1-1 일반사항 ······ 3"));
    }

    @Test
    void textOutsidePagesIsSkipped() {
        String dump = String.join("\n",
                "추출 도구 v1.2",
                "=== 1페이지 ===",
                "1줄: 본문",
                "----",
                "페이지 사이 메모",
                "=== 요약 ===",
                "총 1페이지");

        assertThat(TextDumpReader.parse(dump)).containsExactly(Line.of(1, 1, "본문"));
    }

    @Test
    void pagesGoingBackwardsViolateContract() {
        String dump = String.join("\n",
                "=== 5페이지 ===",
                "1줄: a",
                "=== 4페이지 ===",
                "1줄: b");

        assertThatThrownBy(() -> TextDumpReader.parse(dump))
                .isInstanceOf(InputContractException.class)
                .hasMessageContaining("page 4");
        assertThatThrownBy(() -> TextDumpReader.parse(null)).isInstanceOf(InputContractException.class);
    }

    @Test
    void oversizedLinePrefixIsKeptAsUnprefixedText() {
        String dump = String.join("\n",
                "=== 3페이지 ===",
                "1줄: 목  차",
                "2줄: 3",
                "99999999999줄: 1-1 일반사항 ······ 3",
                "----");

        assertThat(TextDumpReader.parse(dump)).containsExactly(
                Line.of(3, 1, "목  차"),
                Line.of(3, 2, "3"),
                Line.of(3, 3, "99999999999줄: 1-1 일반사항 ······ 3"));
    }

    @Test
    void oversizedPageHeaderViolatesContract() {
        assertThatThrownBy(() -> TextDumpReader.parse("=== 99999999999페이지 ===\n1줄: x\n"))
                .isInstanceOf(InputContractException.class)
                .hasMessageContaining("99999999999");
    }

    @Test
    void readsBundledPriceListDump() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/dumps/price_list_dump.txt");
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            List<Line> lines = TextDumpReader.read(reader);

            assertThat(lines).hasSize(25);
            assertThat(lines).extracting(Line::getPage).isSorted();
            assertThat(lines.get(0)).isEqualTo(Line.of(1, 1, "2024 건설공사 표준품셈"));
        }
    }
}
