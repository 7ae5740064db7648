package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.Diagnostic;
import com.myorg.tocparser.model.DiagnosticType;
import com.myorg.tocparser.model.Division;
import com.myorg.tocparser.model.DivisionReport;
import com.myorg.tocparser.model.DivisionSpan;
import com.myorg.tocparser.model.OutlineNode;
import com.myorg.tocparser.service.DivisionClassifier;
import com.myorg.tocparser.service.processing.InputContracts;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies chapters by exact lookup of their printed label in {@link Division}'s table.
 * A division starts at the page of its first chapter and ends one page before the next
 * populated division starts; the last populated division ends at {@code lastKnownPage}.
 */
@Slf4j
public class TableDivisionClassifier implements DivisionClassifier {

    @Override
    public DivisionReport classify(List<OutlineNode> chapters, int lastKnownPage) {
        InputContracts.requireList(chapters, "chapters");
        InputContracts.requirePositive(lastKnownPage, "lastKnownPage");

        Map<Division, List<OutlineNode>> assigned = new EnumMap<>(Division.class);
        Map<Division, Integer> startPages = new EnumMap<>(Division.class);
        List<OutlineNode> unclassified = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (OutlineNode chapter : chapters) {
            if (chapter == null || !chapter.isChapter()) {
                throw new InputContractException("chapters must contain chapter nodes only, got " + chapter);
            }
            Optional<Division> division = Division.forChapterLabel(chapter.label());
            if (division.isEmpty()) {
                unclassified.add(chapter);
                diagnostics.add(Diagnostic.builder()
                        .type(DiagnosticType.UNCLASSIFIED_CHAPTER)
                        .message("Chapter '" + chapter.label() + "' (p." + chapter.getPage() + ") is not in the division table")
                        .chapter(chapter)
                        .build());
                continue;
            }
            assigned.computeIfAbsent(division.get(), d -> new ArrayList<>()).add(chapter);
            startPages.putIfAbsent(division.get(), chapter.getPage());
        }

        // backward pass: each populated division ends where the next populated one starts
        Map<Division, DivisionSpan> spans = new EnumMap<>(Division.class);
        Division[] order = Division.values();
        Integer nextStart = null;
        for (int i = order.length - 1; i >= 0; i--) {
            Division division = order[i];
            Integer start = startPages.get(division);
            if (start == null) {
                spans.put(division, DivisionSpan.builder().division(division).build());
                continue;
            }
            int end = nextStart != null ? nextStart - 1 : lastKnownPage;
            if (end < start) {
                diagnostics.add(Diagnostic.builder()
                        .type(DiagnosticType.DIVISION_BOUNDARY_INCONSISTENT)
                        .message(String.format("Division %s starts at p.%d but its computed end is p.%d; end set to start",
                                division.key(), start, end))
                        .chapter(assigned.get(division).get(0))
                        .build());
                end = start;
            }
            spans.put(division, DivisionSpan.builder()
                    .division(division)
                    .startPage(start)
                    .endPage(end)
                    .chapters(assigned.get(division))
                    .build());
            nextStart = start;
        }

        DivisionReport report = new DivisionReport(spans, unclassified, diagnostics);
        log.info("Classified {} chapters: {} unclassified, missing divisions {}",
                chapters.size(), unclassified.size(), report.missingDivisions());
        return report;
    }
}
