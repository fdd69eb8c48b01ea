package com.example.ingest.domain.exception;

/**
 * Raised when a caller asks for extraction of a null {@link java.nio.file.Path}.
 */
public class DocumentPathRequiredException extends DomainException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public DocumentPathRequiredException() {
        super("Document path is required.");
    }
}
