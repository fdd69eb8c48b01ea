package com.example.ingest.domain.exception;

/**
 * Raised when the upload endpoint is called without a file or with an empty one.
 */
public class DocumentFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public DocumentFileRequiredException() {
        super("Please choose a document to upload.");
    }
}
