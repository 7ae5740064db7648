package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.service.PageCounter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Reads the page count of the paginated source with PDFBox. Nothing else is extracted.
 */
@Slf4j
public class PdfBoxPageCounter implements PageCounter {

    @Override
    public int countPages(File sourceFile) throws IOException {
        if (sourceFile == null || !sourceFile.isFile()) {
            throw new FileNotFoundException("PDF not found: " + (sourceFile == null ? "null" : sourceFile.getAbsolutePath()));
        }
        try (PDDocument document = PDDocument.load(sourceFile)) {
            int pages = document.getNumberOfPages();
            log.info("{} has {} pages", sourceFile.getName(), pages);
            return pages;
        }
    }
}
