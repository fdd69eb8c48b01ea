package com.example.ingest.domain.exception;

/**
 * Raised when a referenced document path does not exist on disk.
 * Prevents the dispatcher from handing moved or deleted files to a strategy.
 */
public class DocumentNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public DocumentNotFoundException(String path) {
        super("Document not found: " + path);
    }
}
