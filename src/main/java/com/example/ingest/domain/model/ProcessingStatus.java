package com.example.ingest.domain.model;

/**
 * Processing outcome derived from an {@link ExtractionResult}.
 */
public enum ProcessingStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
