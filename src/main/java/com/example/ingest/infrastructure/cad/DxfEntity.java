package com.example.ingest.infrastructure.cad;

import java.util.List;

/**
 * One model-space entity with the group values relevant to text extraction.
 *
 * @param type          entity type as written after group code 0, e.g. {@code TEXT}
 * @param layer         layer name (group 8), empty when absent
 * @param primaryText   group 1 value, {@code null} when absent
 * @param textChunks    group 3 values preceding the final MTEXT chunk
 */
public record DxfEntity(
        String type,
        String layer,
        String primaryText,
        List<String> textChunks
) {

    public DxfEntity {
        textChunks = textChunks == null ? List.of() : List.copyOf(textChunks);
    }

    public boolean isTextAnnotation() {
        return "TEXT".equals(type) || "MTEXT".equals(type);
    }

    public boolean isDimension() {
        return "DIMENSION".equals(type);
    }

    /**
     * @return full annotation text; MTEXT stores long strings as group 3 chunks followed by group 1
     */
    public String text() {
        if (textChunks.isEmpty()) {
            return primaryText == null ? "" : primaryText;
        }
        return String.join("", textChunks) + (primaryText == null ? "" : primaryText);
    }

    /**
     * A dimension override is any group 1 value other than the bare {@code <>} measurement marker.
     *
     * @return {@code true} when a dimension carries user supplied text
     */
    public boolean hasTextOverride() {
        return primaryText != null && !primaryText.isBlank() && !"<>".equals(primaryText.trim());
    }
}
