package com.myorg.tocparser.controller;

import com.myorg.tocparser.config.StorageProperties;
import com.myorg.tocparser.exception.ValidationException;
import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.model.OutlineDocument;
import com.myorg.tocparser.model.OutlineResult;
import com.myorg.tocparser.model.ParseSummary;
import com.myorg.tocparser.service.OutlineWriter;
import com.myorg.tocparser.service.TocOutlineService;
import com.myorg.tocparser.service.processing.OutlineDocumentMapper;
import com.myorg.tocparser.service.processing.TextDumpReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/toc")
public class OutlineController {

    private final StorageProperties storageProperties;
    private final TocOutlineService outlineService;
    private final OutlineWriter outlineWriter;
    private final Clock clock;

    @PostMapping("/parse")
    public ResponseEntity<ParseSummary> parseDump(@RequestParam("file") MultipartFile file,
                                                  @RequestParam("totalPages") int totalPages) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please upload a non-empty text dump.");
        }

        final String originalName = file.getOriginalFilename();
        if (originalName == null || originalName.isBlank()) {
            throw new ValidationException("Uploaded file has no filename.");
        }

        final String lower = originalName.toLowerCase();
        final String contentType = file.getContentType() == null ? "" : file.getContentType().toLowerCase();

        if (!(lower.endsWith(".txt") || contentType.startsWith("text/"))) {
            throw new ValidationException("Only text dumps (.txt) are accepted.");
        }
        if (totalPages < 1) {
            throw new ValidationException("totalPages must be at least 1.");
        }

        List<Line> lines;
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            lines = TextDumpReader.read(reader);
        }
        log.info("Upload {}: {} lines, {} total pages", originalName, lines.size(), totalPages);

        OutlineResult result = outlineService.process(originalName, lines, totalPages);

        Path outDir = Path.of(storageProperties.getBasePath()).toAbsolutePath().normalize();
        Files.createDirectories(outDir);
        OutlineDocument document = OutlineDocumentMapper.toDocument(
                originalName, LocalDateTime.now(clock), totalPages, result.getForest());
        outlineWriter.write(outDir.resolve(storageProperties.getTreeFileName()).toFile(), document);

        return ResponseEntity.ok(ParseSummary.from(result));
    }

    @GetMapping("/results/tree")
    public ResponseEntity<FileSystemResource> getTreeJson() {
        return serveFile(storageProperties.getTreeFileName());
    }

    // ===== Helpers =====

    private ResponseEntity<FileSystemResource> serveFile(String name) {
        Path outDir = Path.of(storageProperties.getBasePath()).toAbsolutePath().normalize();
        File f = outDir.resolve(name).toFile();

        if (!f.exists()) return ResponseEntity.notFound().build();

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + name + "\"")
                .body(new FileSystemResource(f));
    }
}
