package com.example.ingest.domain.model;

/**
 * Canonical format tags produced by format detection and consumed by the strategy factory.
 */
public enum DocumentFormat {
    PDF,
    IMAGE,
    DOCX,
    DOC,
    DXF,
    DWG,
    CSV,
    TXT,
    XLSX,
    UNKNOWN;

    /**
     * @return the tag string used as the factory lookup key
     */
    public String tag() {
        return name();
    }

}
