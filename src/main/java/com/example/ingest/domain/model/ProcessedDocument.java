package com.example.ingest.domain.model;

/**
 * Dispatcher output handed to classification and storage: file identity, resolved format,
 * processing status and the extraction result (including any {@code error} annotation).
 */
public record ProcessedDocument(
        String fileName,
        String format,
        String mimeType,
        ProcessingStatus status,
        ExtractionResult extraction
) {
}
