package com.myorg.tocparser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Inclusive page range a chapter occupies in the paginated source.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ChapterRange {

    @JsonIgnore
    private final OutlineNode chapter;

    @JsonProperty("start_page")
    private final int startPage;

    @JsonProperty("end_page")
    private final int endPage;

    @JsonProperty("chapter_label")
    public String getChapterLabel() {
        return chapter.label();
    }

    @JsonProperty("page_count")
    public int pageCount() {
        return endPage - startPage + 1;
    }
}
