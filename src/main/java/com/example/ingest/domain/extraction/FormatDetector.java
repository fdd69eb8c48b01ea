package com.example.ingest.domain.extraction;

import com.example.ingest.domain.model.DetectedFormat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Resolves a file's canonical format tag from its content signature.
 */
public interface FormatDetector {

    /**
     * @param file file to inspect
     * @return tag and MIME type; the tag is {@code UNKNOWN} when no format matched
     * @throws IOException when the file cannot be read
     */
    DetectedFormat detect(Path file) throws IOException;
}
