package com.example.ingest.infrastructure.ocr;

import com.example.ingest.infrastructure.exception.OcrException;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over an in-memory raster.
 * Calls are blocking and may be CPU bound; callers decide which thread runs them.
 */
public interface OcrEngine {

    /**
     * Recognises the text in the image.
     *
     * @param image raster to read
     * @return recognised text, never {@code null}
     * @throws OcrException when the engine or its native library fails
     */
    String recognize(BufferedImage image);

    /**
     * @return identifier recorded in metadata, e.g. {@code tesseract}
     */
    String engineName();
}
