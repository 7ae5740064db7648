package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.config.OutlineParserProperties;
import com.myorg.tocparser.model.ChapterRange;
import com.myorg.tocparser.model.Division;
import com.myorg.tocparser.model.DivisionSpan;
import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.model.OutlineDocument;
import com.myorg.tocparser.model.OutlineResult;
import com.myorg.tocparser.service.OutlineWriter;
import com.myorg.tocparser.service.PageCounter;
import com.myorg.tocparser.service.TocOutlineService;
import com.myorg.tocparser.service.processing.OutlineDocumentMapper;
import com.myorg.tocparser.service.processing.TextDumpReader;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Standalone runner: reads a page-segmented text dump, builds the outline and writes the
 * interchange JSON.
 *
 * Usage: {@code OutlineParserRunner <dump.txt> <totalPages|source.pdf> [out.json]}
 *
 * When the second argument is a PDF path its page count is read with PDFBox.
 */
@Slf4j
public class OutlineParserRunner {

    static final String DEFAULT_OUTPUT = "toc_tree.json";

    private final TocOutlineService service;
    private final OutlineWriter writer;
    private final PageCounter pageCounter;
    private final Clock clock;

    public OutlineParserRunner(TocOutlineService service, OutlineWriter writer, PageCounter pageCounter, Clock clock) {
        this.service = service;
        this.writer = writer;
        this.pageCounter = pageCounter;
        this.clock = clock;
    }

    public OutlineParserRunner() {
        this(DefaultTocOutlineService.fromProperties(new OutlineParserProperties()),
                new JacksonOutlineWriter(), new PdfBoxPageCounter(), Clock.systemDefaultZone());
    }

    /**
     * Run parsing and write the outline JSON.
     *
     * @param dumpPath   page-segmented text dump
     * @param pagesArg   total page count, or the path of the source PDF
     * @param outputPath output JSON file path
     * @throws IOException on IO errors
     */
    public OutlineResult run(Path dumpPath, String pagesArg, Path outputPath) throws IOException {
        File dumpFile = dumpPath.toFile();
        if (!dumpFile.exists()) {
            throw new FileNotFoundException("Dump not found: " + dumpFile.getAbsolutePath());
        }
        int totalPages = resolveTotalPages(pagesArg);

        log.info("Reading dump: {}", dumpFile.getAbsolutePath());
        List<Line> lines;
        try (Reader reader = Files.newBufferedReader(dumpPath, StandardCharsets.UTF_8)) {
            lines = TextDumpReader.read(reader);
        }
        log.info("Read {} lines", lines.size());

        String sourceName = sourceNameOf(pagesArg, dumpPath);
        OutlineResult result = service.process(sourceName, lines, totalPages);

        OutlineDocument document = OutlineDocumentMapper.toDocument(
                sourceName, LocalDateTime.now(clock), totalPages, result.getForest());
        writer.write(outputPath.toFile(), document);

        logSummary(result);
        log.info("Completed: {} nodes -> {}", result.getForest().totalNodes(), outputPath);
        return result;
    }

    int resolveTotalPages(String pagesArg) throws IOException {
        if (pagesArg.matches("\\d{1,9}")) {
            return Integer.parseInt(pagesArg);
        }
        if (pagesArg.toLowerCase().endsWith(".pdf")) {
            return pageCounter.countPages(new File(pagesArg));
        }
        throw new IllegalArgumentException("Expected a page count or a PDF path, got: " + pagesArg);
    }

    private static String sourceNameOf(String pagesArg, Path dumpPath) {
        if (pagesArg.toLowerCase().endsWith(".pdf")) {
            return Path.of(pagesArg).getFileName().toString();
        }
        return dumpPath.getFileName().toString();
    }

    private void logSummary(OutlineResult result) {
        for (Division division : Division.values()) {
            DivisionSpan span = result.getDivisions().span(division);
            if (span.isPopulated()) {
                log.info("{} ({}): p.{}-{}, {} chapters", division.displayName(), division.key(),
                        span.getStartPage(), span.getEndPage(), span.getChapters().size());
            } else {
                log.info("{} ({}): not found", division.displayName(), division.key());
            }
        }
        for (ChapterRange range : result.getRanges().getRanges()) {
            log.info("{}: p.{}-{} ({} pages)", range.getChapterLabel(), range.getStartPage(), range.getEndPage(), range.pageCount());
        }
    }

    /* ----------------- main for quick testing ----------------- */
    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            log.error("Usage: OutlineParserRunner <dump.txt> <totalPages|source.pdf> [out.json]");
            System.exit(2);
        }
        Path dump = Path.of(args[0]);
        Path out = (args.length >= 3) ? Path.of(args[2]) : Path.of(DEFAULT_OUTPUT);
        new OutlineParserRunner().run(dump, args[1], out);
    }
}
