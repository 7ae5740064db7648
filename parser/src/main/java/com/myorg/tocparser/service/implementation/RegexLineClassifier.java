package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.config.OutlineParserProperties;
import com.myorg.tocparser.model.LineClassification;
import com.myorg.tocparser.model.LineKind;
import com.myorg.tocparser.service.LineClassifier;
import com.myorg.tocparser.util.PageNumbers;
import com.myorg.tocparser.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered regex rules for TOC lines; the first rule that matches wins:
 * <ol>
 *   <li>chapter marker ({@code 제1장}), merged with a title line that follows it</li>
 *   <li>dash-numbered item ({@code 1-1 일반사항 ······ 3})</li>
 *   <li>other titled entry ({@code 참 고 자 료 ······ 120})</li>
 * </ol>
 * A title is separated from its page number by a filler run: at least {@code minFillerRun}
 * characters out of the configured filler set plus space.
 */
@Slf4j
public class RegexLineClassifier implements LineClassifier {

    private final Pattern chapterMarker;
    private final Pattern chapterTitle;
    private final Pattern item;
    private final Pattern other;

    public RegexLineClassifier() {
        this(new OutlineParserProperties());
    }

    public RegexLineClassifier(OutlineParserProperties properties) {
        if (properties.getMinFillerRun() < 1) {
            throw new IllegalArgumentException("minFillerRun must be at least 1");
        }
        String fillerSet = characterSet(properties.getFillerCharacters());
        String filler = "[" + fillerSet + "]{" + properties.getMinFillerRun() + ",}";
        String trailingPage = filler + "(?<page>\\d{1,6})$";

        this.chapterMarker = Pattern.compile("^(?:" + properties.getChapterMarkerPattern() + ")$");
        this.chapterTitle = Pattern.compile("^(?<title>[^" + fillerSet + "].*?)" + trailingPage);
        this.item = Pattern.compile("^(?<number>\\d+(?:-\\d+)+)\\s*(?<title>.*?)" + trailingPage);
        this.other = Pattern.compile("^(?<title>[^\\d" + fillerSet + "].*?)" + trailingPage);
    }

    @Override
    public Optional<LineClassification> classify(String text, String nextText) {
        String line = TextNormalizer.normalize(text);
        if (line.isEmpty()) return Optional.empty();

        Matcher m = chapterMarker.matcher(line);
        if (m.matches()) {
            return Optional.of(chapter(m.groupCount() >= 1 ? m.group(1) : "", nextText));
        }

        m = item.matcher(line);
        if (m.matches()) {
            return Optional.of(LineClassification.builder()
                    .kind(LineKind.ITEM)
                    .number(m.group("number"))
                    .title(m.group("title").trim())
                    .targetPage(PageNumbers.safeParseInt(m.group("page")))
                    .build());
        }

        m = other.matcher(line);
        if (m.matches()) {
            return Optional.of(LineClassification.builder()
                    .kind(LineKind.OTHER)
                    .title(m.group("title").trim())
                    .targetPage(PageNumbers.safeParseInt(m.group("page")))
                    .build());
        }

        log.debug("noise: '{}'", line);
        return Optional.empty();
    }

    private LineClassification chapter(String number, String nextText) {
        String next = TextNormalizer.normalize(nextText);
        // an item or another marker on the next line is never taken as the title
        if (!next.isEmpty() && !item.matcher(next).matches() && !chapterMarker.matcher(next).matches()) {
            Matcher title = chapterTitle.matcher(next);
            if (title.matches()) {
                return LineClassification.builder()
                        .kind(LineKind.CHAPTER)
                        .number(number.trim())
                        .title(title.group("title").trim())
                        .targetPage(PageNumbers.safeParseInt(title.group("page")))
                        .linesConsumed(2)
                        .build();
            }
        }
        log.debug("chapter {} has no title line, next was '{}'", number, next);
        return LineClassification.builder()
                .kind(LineKind.CHAPTER)
                .number(number.trim())
                .build();
    }

    /** Body of a regex character class holding the filler characters and a space. */
    private static String characterSet(String fillerCharacters) {
        StringBuilder set = new StringBuilder(" ");
        if (fillerCharacters != null) {
            for (char c : fillerCharacters.toCharArray()) {
                if (c == ' ') continue;
                if ("\\^-[]&".indexOf(c) >= 0) set.append('\\');
                set.append(c);
            }
        }
        return set.toString();
    }
}
