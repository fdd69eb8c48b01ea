package com.example.ingest.domain.exception;

/**
 * Raised by the strategy factory when it receives a format tag it has no strategy for.
 * An unknown tag means format detection and the factory are out of sync.
 */
public class UnsupportedFormatException extends DomainException {

    private final String formatTag;

	/**
	 * Creates the exception and names the offending tag.
	 *
	 * @param formatTag tag supplied by the caller, may be {@code null}
	 */
    public UnsupportedFormatException(String formatTag) {
        super("No extraction strategy available for file type: " + formatTag);
        this.formatTag = formatTag;
    }

    /**
     * @return the tag that could not be resolved
     */
    public String getFormatTag() {
        return formatTag;
    }
}
