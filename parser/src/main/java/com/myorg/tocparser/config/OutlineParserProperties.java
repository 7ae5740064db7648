package com.myorg.tocparser.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typography of the table of contents being parsed. The defaults match the Korean
 * construction price-list layout ({@code 목  차} heading, {@code 제N장} markers, dot leaders).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "toc.parser")
public class OutlineParserProperties {

    /** Whole-line regex of the contents heading. */
    private String contentsHeadingPattern = "목\\s*차";

    /** Whole-line regex of a chapter marker; group 1 captures the chapter number. */
    private String chapterMarkerPattern = "제\\s*(\\d+)\\s*장";

    /** Characters that make up a dot leader. A space is always included. */
    private String fillerCharacters = ".·";

    private int minFillerRun = 3;
}
