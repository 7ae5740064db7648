package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.config.OutlineParserProperties;
import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.service.TocPageDetector;
import com.myorg.tocparser.service.processing.InputContracts;
import com.myorg.tocparser.util.PageNumbers;
import com.myorg.tocparser.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Recognises TOC pages by the printed page number sitting next to the contents heading:
 * either the heading followed by a bare number, or a bare number followed by the heading.
 * Both lines have to be on the same dump page.
 */
@Slf4j
public class MarkerTocPageDetector implements TocPageDetector {

    private final Pattern contentsHeading;

    public MarkerTocPageDetector() {
        this(new OutlineParserProperties());
    }

    public MarkerTocPageDetector(OutlineParserProperties properties) {
        this.contentsHeading = Pattern.compile("^(?:" + properties.getContentsHeadingPattern() + ")$");
    }

    @Override
    public SortedSet<Integer> detect(List<Line> lines) {
        InputContracts.requirePageOrdered(lines);
        TreeSet<Integer> tocPages = new TreeSet<>();

        for (int i = 0; i + 1 < lines.size(); i++) {
            Line current = lines.get(i);
            Line next = lines.get(i + 1);
            if (current.getPage() != next.getPage()) continue;

            String a = TextNormalizer.normalize(current.getText());
            String b = TextNormalizer.normalize(next.getText());

            if (isHeading(a) && PageNumbers.isBareInteger(b)) {
                addPage(tocPages, b, current);
            } else if (PageNumbers.isBareInteger(a) && isHeading(b)) {
                addPage(tocPages, a, current);
            }
        }

        if (tocPages.isEmpty()) {
            log.info("No contents heading found in {} lines", lines.size());
        } else {
            log.info("Detected {} TOC pages: {}", tocPages.size(), tocPages);
        }
        return Collections.unmodifiableSortedSet(tocPages);
    }

    private boolean isHeading(String text) {
        return contentsHeading.matcher(text).matches();
    }

    private static void addPage(SortedSet<Integer> tocPages, String number, Line at) {
        int page = PageNumbers.safeParseInt(number);
        if (page > 0) {
            tocPages.add(page);
            log.debug("Contents heading on dump page {} line {} -> TOC page {}", at.getPage(), at.getLineNumber(), page);
        }
    }
}
