package com.myorg.tocparser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A reportable anomaly found while building the outline, classifying divisions or resolving
 * chapter ranges. Returned as data next to the normal result.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Diagnostic {

    @JsonProperty("type")
    private final DiagnosticType type;

    @JsonProperty("message")
    private final String message;

    /** Dump page the offending line was on (tree building only). */
    @JsonProperty("page")
    private final Integer page;

    @JsonProperty("line_number")
    private final Integer lineNumber;

    @JsonIgnore
    private final OutlineNode chapter;

    /** Second chapter involved, e.g. the next chapter whose page caused an inverted range. */
    @JsonIgnore
    private final OutlineNode relatedChapter;

    @JsonProperty("severity")
    public Severity getSeverity() {
        return type.severity();
    }

    @JsonProperty("chapter_label")
    public String getChapterLabel() {
        return chapter == null ? null : chapter.label();
    }
}
