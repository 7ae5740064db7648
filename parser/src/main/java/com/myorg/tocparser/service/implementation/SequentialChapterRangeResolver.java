package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.ChapterRange;
import com.myorg.tocparser.model.Diagnostic;
import com.myorg.tocparser.model.DiagnosticType;
import com.myorg.tocparser.model.OutlineNode;
import com.myorg.tocparser.model.RangeResolution;
import com.myorg.tocparser.service.ChapterRangeResolver;
import com.myorg.tocparser.service.processing.InputContracts;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Chapter i runs from its own page to the page before chapter i+1 (the last one to
 * {@code totalPages}). Every chapter is validated on its own:
 * a start outside {@code [1, totalPages]} rejects it, an end past {@code totalPages} is clamped,
 * and a start after the end (next chapter printed earlier) rejects it.
 */
@Slf4j
public class SequentialChapterRangeResolver implements ChapterRangeResolver {

    @Override
    public RangeResolution resolve(List<OutlineNode> chapters, int totalPages) {
        InputContracts.requireList(chapters, "chapters");
        InputContracts.requirePositive(totalPages, "totalPages");

        List<ChapterRange> ranges = new ArrayList<>();
        List<OutlineNode> rejected = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (int i = 0; i < chapters.size(); i++) {
            OutlineNode chapter = chapters.get(i);
            if (chapter == null) {
                throw new InputContractException("chapters[" + i + "] is null");
            }
            OutlineNode next = i + 1 < chapters.size() ? chapters.get(i + 1) : null;
            int start = chapter.getPage();
            int end = next != null ? next.getPage() - 1 : totalPages;

            if (start < 1 || start > totalPages) {
                rejected.add(chapter);
                diagnostics.add(Diagnostic.builder()
                        .type(DiagnosticType.START_PAGE_OUT_OF_RANGE)
                        .message(String.format("'%s' starts at p.%d, outside the document's %d pages",
                                chapter.label(), start, totalPages))
                        .chapter(chapter)
                        .build());
                continue;
            }

            if (end > totalPages) {
                diagnostics.add(Diagnostic.builder()
                        .type(DiagnosticType.END_PAGE_CLAMPED)
                        .message(String.format("'%s' end page %d clamped to %d", chapter.label(), end, totalPages))
                        .chapter(chapter)
                        .relatedChapter(next)
                        .build());
                end = totalPages;
            }

            if (start > end) {
                rejected.add(chapter);
                diagnostics.add(Diagnostic.builder()
                        .type(DiagnosticType.START_AFTER_END)
                        .message(String.format("'%s' starts at p.%d but next chapter '%s' starts at p.%d",
                                chapter.label(), start, next == null ? "-" : next.label(), next == null ? totalPages : next.getPage()))
                        .chapter(chapter)
                        .relatedChapter(next)
                        .build());
                continue;
            }

            ranges.add(new ChapterRange(chapter, start, end));
        }

        log.info("Resolved {} chapter ranges over {} pages ({} rejected)", ranges.size(), totalPages, rejected.size());
        return new RangeResolution(ranges, rejected, diagnostics);
    }
}
