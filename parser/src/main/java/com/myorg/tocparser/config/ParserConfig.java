package com.myorg.tocparser.config;

import com.myorg.tocparser.service.ChapterRangeResolver;
import com.myorg.tocparser.service.DivisionClassifier;
import com.myorg.tocparser.service.LineClassifier;
import com.myorg.tocparser.service.OutlineTreeBuilder;
import com.myorg.tocparser.service.OutlineWriter;
import com.myorg.tocparser.service.PageCounter;
import com.myorg.tocparser.service.TocOutlineService;
import com.myorg.tocparser.service.TocPageDetector;
import com.myorg.tocparser.service.implementation.DefaultTocOutlineService;
import com.myorg.tocparser.service.implementation.JacksonOutlineWriter;
import com.myorg.tocparser.service.implementation.MarkerTocPageDetector;
import com.myorg.tocparser.service.implementation.OutlineParserRunner;
import com.myorg.tocparser.service.implementation.PdfBoxPageCounter;
import com.myorg.tocparser.service.implementation.RegexLineClassifier;
import com.myorg.tocparser.service.implementation.SequentialChapterRangeResolver;
import com.myorg.tocparser.service.implementation.StackOutlineTreeBuilder;
import com.myorg.tocparser.service.implementation.TableDivisionClassifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({OutlineParserProperties.class, StorageProperties.class})
public class ParserConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public LineClassifier lineClassifier(OutlineParserProperties properties) {
        return new RegexLineClassifier(properties);
    }

    @Bean
    public TocPageDetector tocPageDetector(OutlineParserProperties properties) {
        return new MarkerTocPageDetector(properties);
    }

    @Bean
    public OutlineTreeBuilder outlineTreeBuilder(LineClassifier lineClassifier) {
        return new StackOutlineTreeBuilder(lineClassifier);
    }

    @Bean
    public DivisionClassifier divisionClassifier() {
        return new TableDivisionClassifier();
    }

    @Bean
    public ChapterRangeResolver chapterRangeResolver() {
        return new SequentialChapterRangeResolver();
    }

    @Bean
    public TocOutlineService tocOutlineService(TocPageDetector detector, OutlineTreeBuilder builder,
                                               DivisionClassifier divisionClassifier, ChapterRangeResolver resolver) {
        return new DefaultTocOutlineService(detector, builder, divisionClassifier, resolver);
    }

    @Bean
    public OutlineWriter outlineWriter() {
        return new JacksonOutlineWriter();
    }

    @Bean
    public PageCounter pageCounter() {
        return new PdfBoxPageCounter();
    }

    @Bean
    public OutlineParserRunner outlineParserRunner(TocOutlineService service, OutlineWriter writer,
                                                   PageCounter pageCounter, Clock clock) {
        return new OutlineParserRunner(service, writer, pageCounter, clock);
    }
}
