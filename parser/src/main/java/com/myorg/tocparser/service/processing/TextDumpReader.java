package com.myorg.tocparser.service.processing;

import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.Line;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the extractor's page-segmented dump:
 * <pre>
 * === 3페이지 ===
 * 1줄: 목  차
 * 2줄: 3
 * ----
 * </pre>
 * Text before the first page header and between a page's {@code ----} and the next header is skipped.
 */
@Slf4j
public final class TextDumpReader {

    private static final Pattern PAGE_HEADER = Pattern.compile("^===\\s*(\\d+)\\s*페이지\\s*===$");
    private static final Pattern OTHER_HEADER = Pattern.compile("^===.*===$");
    private static final Pattern NUMBERED_LINE = Pattern.compile("^(\\d{1,9})줄:\\s?(.*)$");
    private static final String PAGE_END = "----";

    private TextDumpReader() {}

    public static List<Line> parse(String dump) {
        if (dump == null) {
            throw new InputContractException("dump must not be null");
        }
        try {
            return read(new StringReader(dump));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<Line> read(Reader source) throws IOException {
        if (source == null) {
            throw new InputContractException("source must not be null");
        }
        List<Line> lines = new ArrayList<>();
        Integer currentPage = null;
        int lastPage = Integer.MIN_VALUE;
        int lastLineNumber = 0;

        try (BufferedReader reader = new BufferedReader(source)) {
            String raw;
            while ((raw = reader.readLine()) != null) {
                String line = raw.strip();
                if (line.isEmpty()) continue;

                Matcher header = PAGE_HEADER.matcher(line);
                if (header.matches()) {
                    if (header.group(1).length() > 9) {
                        throw new InputContractException("page header number out of range: " + line);
                    }
                    int page = Integer.parseInt(header.group(1));
                    if (page < lastPage) {
                        throw new InputContractException("dump pages are out of order: page " + page + " after page " + lastPage);
                    }
                    if (page != lastPage) {
                        lastLineNumber = 0;
                    }
                    currentPage = page;
                    lastPage = page;
                    continue;
                }
                if (PAGE_END.equals(line) || OTHER_HEADER.matcher(line).matches()) {
                    currentPage = null;
                    continue;
                }
                if (currentPage == null) continue;

                Matcher numbered = NUMBERED_LINE.matcher(line);
                if (numbered.matches()) {
                    int lineNumber = Integer.parseInt(numbered.group(1));
                    lines.add(Line.of(currentPage, Math.max(1, lineNumber), numbered.group(2)));
                    lastLineNumber = Math.max(lastLineNumber, lineNumber);
                } else {
                    // dumps written without the "N줄:" prefix, or with an oversized one
                    lastLineNumber++;
                    lines.add(Line.of(currentPage, lastLineNumber, line));
                }
            }
        }
        log.debug("Read {} dump lines up to page {}", lines.size(), lastPage == Integer.MIN_VALUE ? "-" : lastPage);
        return lines;
    }
}
