package com.myorg.tocparser.service.implementation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.myorg.tocparser.model.OutlineDocument;
import com.myorg.tocparser.service.OutlineWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes the outline interchange document as pretty-printed UTF-8 JSON using Jackson.
 * Hangul is written as-is, not escaped.
 */
@Slf4j
public class JacksonOutlineWriter implements OutlineWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectWriter OBJECT_WRITER = MAPPER.writer();

    @Override
    public void write(File outputFile, OutlineDocument document) throws IOException {
        if (outputFile == null) {
            throw new IllegalArgumentException("outputFile must not be null");
        }
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }

        File parent = outputFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create parent directories: " + parent.getAbsolutePath());
        }

        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(outputFile), StandardCharsets.UTF_8))) {
            OBJECT_WRITER.writeValue(writer, document);
        }
        log.info("Outline JSON written: {} pages, {} nodes -> {}",
                document.getTocTree() == null ? 0 : document.getTocTree().size(),
                document.getStatistics() == null ? 0 : document.getStatistics().getTotalNodes(),
                outputFile.getAbsolutePath());
    }

    @Override
    public String writeAsString(OutlineDocument document) throws IOException {
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        return OBJECT_WRITER.writeValueAsString(document);
    }
}
