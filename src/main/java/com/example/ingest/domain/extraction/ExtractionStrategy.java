package com.example.ingest.domain.extraction;

import com.example.ingest.domain.model.ExtractionResult;

import java.nio.file.Path;

/**
 * Converts one document format into the uniform {@link ExtractionResult}.
 *
 * <p>Implementations are stateless and safe to call concurrently for different files. They read
 * the file only, release every handle they open before returning, and never throw: open, parse,
 * decode and per-unit failures are all recorded under the {@code error} metadata key (or a
 * format-specific error list) while already collected output is kept.</p>
 */
public interface ExtractionStrategy {

    /**
     * Extracts text and metadata from an existing, readable file whose format was already resolved.
     *
     * @param file path to the document
     * @return extraction result, never {@code null}
     */
    ExtractionResult extract(Path file);
}
