package com.example.ingest.infrastructure.exception;

/**
 * Raised by {@link com.example.ingest.infrastructure.ocr.OcrEngine} implementations when the
 * OCR engine or its native library fails. Strategies catch it and record a per-unit failure.
 */
public class OcrException extends InfrastructureException {

	/**
	 * @param message description of the failed OCR call
	 * @param cause   engine or linkage error
	 */
    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
