package com.example.ingest.interfaces.api;

import com.example.ingest.application.service.DocumentDispatcher;
import com.example.ingest.domain.exception.DocumentFileRequiredException;
import com.example.ingest.domain.model.ProcessedDocument;
import com.example.ingest.infrastructure.exception.DocumentProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Manual upload channel: materialises the uploaded document in a temporary directory, runs it
 * through the dispatcher and returns the processed document as JSON.
 */
@RestController
public class DocumentUploadController {

    private static final Logger log = LoggerFactory.getLogger(DocumentUploadController.class);
    private static final String DEFAULT_FILE_NAME = "upload.bin";

    private final DocumentDispatcher dispatcher;

    /**
     * @param dispatcher service running detection and extraction
     */
    public DocumentUploadController(DocumentDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Extracts an uploaded document.
     *
     * @param file   uploaded document
     * @param format optional format tag that bypasses signature detection
     * @return processed document; extraction failures are reported inside the body, not as errors
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProcessedDocument> extract(@RequestParam("file") MultipartFile file,
                                                     @RequestParam(value = "format", required = false) String format) {
        if (file == null || file.isEmpty()) {
            throw new DocumentFileRequiredException();
        }
        Path directory = null;
        Path stored = null;
        try {
            directory = Files.createTempDirectory("ingest-");
            stored = directory.resolve(safeFileName(file.getOriginalFilename()));
            try (InputStream input = file.getInputStream()) {
                Files.copy(input, stored);
            }
            ProcessedDocument processed = format == null || format.isBlank()
                    ? dispatcher.process(stored)
                    : dispatcher.process(stored, format);
            return ResponseEntity.ok(processed);
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to store the uploaded document.", e);
        } finally {
            deleteQuietly(stored);
            deleteQuietly(directory);
        }
    }

    /**
     * Keeps only the last path segment so the stored file cannot escape the temporary directory.
     *
     * @param originalName client supplied file name
     * @return sanitized file name
     */
    static String safeFileName(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            return DEFAULT_FILE_NAME;
        }
        String name = originalName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return DEFAULT_FILE_NAME;
        }
        return name;
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.debug("Failed to delete temporary path {}", path, ex);
        }
    }
}
