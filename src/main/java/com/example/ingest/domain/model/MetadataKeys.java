package com.example.ingest.domain.model;

/**
 * Metadata key names shared by strategies and their consumers.
 * Each format tag always populates the keys listed for it so callers can rely on them.
 */
public final class MetadataKeys {

    /** Present only when extraction failed fully or partially. */
    public static final String ERROR = "error";

    // PDF
    public static final String PAGES = "pages";
    public static final String EXTRACTION_METHOD = "extraction_method";
    public static final String TABLES_FOUND = "tables_found";
    public static final String PAGE_ERRORS = "page_errors";
    public static final String DOCUMENT_INFO = "document_info";

    // IMAGE
    public static final String OCR_METHOD = "ocr_method";
    public static final String IMAGE_SIZE = "image_size";

    // DOCX
    public static final String PARAGRAPHS = "paragraphs";
    public static final String TABLES = "tables";

    // DXF
    public static final String ENTITIES = "entities";
    public static final String TEXT_ENTITIES = "text_entities";
    public static final String LAYERS = "layers";

    // CSV / TXT
    public static final String ROWS = "rows";
    public static final String COLUMNS = "columns";
    public static final String ENCODING = "encoding";
    public static final String LINES = "lines";

    private MetadataKeys() {
    }
}
