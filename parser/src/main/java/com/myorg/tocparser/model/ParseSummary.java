package com.myorg.tocparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response body of the parse endpoint: divisions, chapter ranges and diagnostics of one run.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseSummary {

    @JsonProperty("source_name")
    private String sourceName;

    @JsonProperty("total_pages")
    private Integer totalPages;

    @JsonProperty("toc_pages")
    private List<Integer> tocPages;

    @JsonProperty("total_nodes")
    private Integer totalNodes;

    @JsonProperty("divisions")
    private List<DivisionEntry> divisions;

    @JsonProperty("missing_divisions")
    private List<String> missingDivisions;

    @JsonProperty("unclassified_chapters")
    private List<String> unclassifiedChapters;

    @JsonProperty("chapter_ranges")
    private List<ChapterRange> chapterRanges;

    @JsonProperty("diagnostics")
    private List<Diagnostic> diagnostics;

    @Getter
    @Builder
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DivisionEntry {

        @JsonProperty("division")
        private String division;

        @JsonProperty("name")
        private String name;

        @JsonProperty("start_page")
        private Integer startPage;

        @JsonProperty("end_page")
        private Integer endPage;

        @JsonProperty("chapters")
        private List<String> chapters;
    }

    public static ParseSummary from(OutlineResult result) {
        List<DivisionEntry> divisions = new ArrayList<>();
        for (DivisionSpan span : result.getDivisions().getSpans().values()) {
            divisions.add(DivisionEntry.builder()
                    .division(span.getDivision().key())
                    .name(span.getDivision().displayName())
                    .startPage(span.getStartPage())
                    .endPage(span.getEndPage())
                    .chapters(span.getChapters().stream().map(OutlineNode::label).collect(Collectors.toList()))
                    .build());
        }
        return ParseSummary.builder()
                .sourceName(result.getSourceName())
                .totalPages(result.getTotalPages())
                .tocPages(new ArrayList<>(result.getTocPages()))
                .totalNodes(result.getForest().totalNodes())
                .divisions(divisions)
                .missingDivisions(result.getDivisions().missingDivisions().stream()
                        .map(Division::key)
                        .collect(Collectors.toList()))
                .unclassifiedChapters(result.getDivisions().getUnclassified().stream()
                        .map(OutlineNode::label)
                        .collect(Collectors.toList()))
                .chapterRanges(result.getRanges().getRanges())
                .diagnostics(result.allDiagnostics())
                .build();
    }
}
