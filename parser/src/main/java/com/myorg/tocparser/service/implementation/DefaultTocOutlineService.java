package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.config.OutlineParserProperties;
import com.myorg.tocparser.metrics.PerfProbe;
import com.myorg.tocparser.model.Diagnostic;
import com.myorg.tocparser.model.DivisionReport;
import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.model.OutlineNode;
import com.myorg.tocparser.model.OutlineResult;
import com.myorg.tocparser.model.PageForest;
import com.myorg.tocparser.model.RangeResolution;
import com.myorg.tocparser.service.ChapterRangeResolver;
import com.myorg.tocparser.service.DivisionClassifier;
import com.myorg.tocparser.service.OutlineTreeBuilder;
import com.myorg.tocparser.service.TocOutlineService;
import com.myorg.tocparser.service.TocPageDetector;
import com.myorg.tocparser.service.processing.InputContracts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.SortedSet;

/**
 * Runs the stages in order: TOC page detection, tree building, division classification over
 * the flattened chapters, chapter range resolution. The last known page handed to division
 * classification is {@code totalPages}.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultTocOutlineService implements TocOutlineService {

    private final TocPageDetector pageDetector;
    private final OutlineTreeBuilder treeBuilder;
    private final DivisionClassifier divisionClassifier;
    private final ChapterRangeResolver rangeResolver;

    public static DefaultTocOutlineService fromProperties(OutlineParserProperties properties) {
        return new DefaultTocOutlineService(
                new MarkerTocPageDetector(properties),
                new StackOutlineTreeBuilder(new RegexLineClassifier(properties)),
                new TableDivisionClassifier(),
                new SequentialChapterRangeResolver());
    }

    @Override
    public OutlineResult process(String sourceName, List<Line> lines, int totalPages) {
        InputContracts.requirePageOrdered(lines);
        InputContracts.requirePositive(totalPages, "totalPages");

        PerfProbe probe = new PerfProbe(sourceName == null ? "outline" : sourceName);

        SortedSet<Integer> tocPages = pageDetector.detect(lines);
        probe.mark("TOC pages detected", lines.size());

        PageForest forest = tocPages.isEmpty() ? PageForest.empty() : treeBuilder.build(tocPages, lines);
        probe.mark("Outline built", forest.totalNodes());

        List<OutlineNode> chapters = forest.chapters();
        DivisionReport divisions = divisionClassifier.classify(chapters, totalPages);
        probe.mark("Divisions classified", chapters.size());

        RangeResolution ranges = rangeResolver.resolve(chapters, totalPages);
        probe.mark("Chapter ranges resolved", chapters.size());

        OutlineResult result = OutlineResult.builder()
                .sourceName(sourceName)
                .totalPages(totalPages)
                .tocPages(tocPages)
                .forest(forest)
                .divisions(divisions)
                .ranges(ranges)
                .build();

        List<Diagnostic> diagnostics = result.allDiagnostics();
        for (Diagnostic d : diagnostics) {
            log.warn("[{}] {} {}: {}", sourceName, d.getSeverity(), d.getType(), d.getMessage());
        }
        probe.done("Outline pipeline");

        log.info("Processed {}: {} TOC pages, {} nodes, {} chapters, {} ranges, {} diagnostics",
                sourceName, tocPages.size(), forest.totalNodes(), chapters.size(),
                ranges.getRanges().size(), diagnostics.size());
        return result;
    }
}
