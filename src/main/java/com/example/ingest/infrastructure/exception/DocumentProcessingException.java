package com.example.ingest.infrastructure.exception;

/**
 * Signals that an uploaded document could not be materialised on disk before extraction.
 */
public class DocumentProcessingException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause.
	 *
	 * @param message description shared with the interfaces layer
	 * @param cause   low-level IO exception
	 */
    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
