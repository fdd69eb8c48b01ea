package com.example.ingest.domain.model;

/**
 * Format tag and MIME type reported by signature based detection.
 */
public record DetectedFormat(
        String tag,
        String mimeType
) {
}
