package com.example.ingest.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator used by a single strategy invocation to collect text sections and metadata.
 * Never shared between invocations; the strategy builds one per {@code extract} call.
 */
public final class ExtractionResultBuilder {

    /** Separator placed between text sections (pages, paragraphs, tables). */
    public static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final List<String> sections = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final String separator;
    private String textOverride;

    public ExtractionResultBuilder() {
        this(PARAGRAPH_SEPARATOR);
    }

    /**
     * @param separator separator used to join the collected sections
     */
    public ExtractionResultBuilder(String separator) {
        this.separator = separator;
    }

    /**
     * Seeds a metadata key with its default value so the key exists even on failure.
     *
     * @param key   metadata key
     * @param value default value
     * @return this builder
     */
    public ExtractionResultBuilder put(String key, Object value) {
        metadata.put(key, value);
        return this;
    }

    /**
     * Increments an integer counter stored under {@code key}.
     *
     * @param key metadata key holding an {@link Integer}
     * @return this builder
     */
    public ExtractionResultBuilder increment(String key) {
        metadata.merge(key, 1, (left, right) -> ((Integer) left) + ((Integer) right));
        return this;
    }

    /**
     * Appends a value to a list stored under {@code key}, creating the list on first use.
     *
     * @param key   metadata key holding a list
     * @param value value to append
     * @return this builder
     */
    @SuppressWarnings("unchecked")
    public ExtractionResultBuilder append(String key, Object value) {
        List<Object> values = (List<Object>) metadata.computeIfAbsent(key, ignored -> new ArrayList<>());
        values.add(value);
        return this;
    }

    /**
     * Adds a text section; {@code null} sections are ignored.
     *
     * @param section text to append
     * @return this builder
     */
    public ExtractionResultBuilder appendText(String section) {
        if (section != null) {
            sections.add(section);
        }
        return this;
    }

    /**
     * Replaces the joined sections with a fixed text, used for placeholder output.
     *
     * @param text text to emit instead of the collected sections
     * @return this builder
     */
    public ExtractionResultBuilder replaceText(String text) {
        this.textOverride = text;
        return this;
    }

    /**
     * Discards collected sections so a failed document yields empty text.
     *
     * @return this builder
     */
    public ExtractionResultBuilder clearText() {
        sections.clear();
        textOverride = null;
        return this;
    }

    /**
     * Records the failure reason without removing already collected metadata.
     *
     * @param message failure description
     * @return this builder
     */
    public ExtractionResultBuilder recordError(String message) {
        metadata.put(MetadataKeys.ERROR, message);
        return this;
    }

    public Object get(String key) {
        return metadata.get(key);
    }

    /**
     * @return immutable result snapshot
     */
    public ExtractionResult build() {
        String text = textOverride != null ? textOverride : String.join(separator, sections);
        return new ExtractionResult(text, metadata);
    }
}
