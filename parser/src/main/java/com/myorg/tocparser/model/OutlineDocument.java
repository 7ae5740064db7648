package com.myorg.tocparser.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Persisted interchange document read by the page splitter and the report renderer.
 * Field names and nesting are part of the contract.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"metadata", "toc_tree", "statistics"})
public class OutlineDocument {

    @JsonProperty("metadata")
    private Metadata metadata;

    /** Keys are dump page numbers as strings, ascending. */
    @JsonProperty("toc_tree")
    private Map<String, List<Node>> tocTree;

    @JsonProperty("statistics")
    private Statistics statistics;

    @Getter
    @Builder
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"source_name", "generated_at", "total_pages", "version"})
    public static class Metadata {

        @JsonProperty("source_name")
        private String sourceName;

        @JsonProperty("generated_at")
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        private LocalDateTime generatedAt;

        @JsonProperty("total_pages")
        private Integer totalPages;

        @JsonProperty("version")
        private String version;
    }

    @Getter
    @Builder
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"type", "title", "page", "level", "number", "children"})
    public static class Node {

        @JsonProperty("type")
        private String type;

        @JsonProperty("title")
        private String title;

        @JsonProperty("page")
        private Integer page;

        @JsonProperty("level")
        private Integer level;

        // items only
        @JsonProperty("number")
        private String number;

        @Builder.Default
        @JsonProperty("children")
        private List<Node> children = List.of();
    }

    @Getter
    @Builder
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Statistics {

        @JsonProperty("total_nodes")
        private Integer totalNodes;
    }
}
