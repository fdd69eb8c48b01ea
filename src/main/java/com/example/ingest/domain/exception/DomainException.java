package com.example.ingest.domain.exception;

/**
 * Base type for all domain-level exceptions in the extraction core.
 * Subclasses signal caller contract violations, never malformed documents: a malformed document
 * is reported through the {@code error} metadata of its extraction result instead.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which contract broke
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which contract broke
	 * @param cause   original exception that triggered the domain failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
