package com.example.ingest.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniform output of every extraction strategy: the concatenated document text and a
 * format-specific metadata map.
 * The text is never null and the metadata map is never null, even when extraction failed;
 * a failure is signalled through the {@link MetadataKeys#ERROR} key only.
 */
public record ExtractionResult(
        String text,
        Map<String, Object> metadata
) {

    public ExtractionResult {
        text = text == null ? "" : text;
        // LinkedHashMap keeps key order stable and tolerates null values such as image_size
        metadata = metadata == null ? Collections.emptyMap() : freezeMap(metadata);
    }

    /**
     * @return {@code true} when the strategy recorded a partial or total failure
     */
    public boolean hasError() {
        return metadata.containsKey(MetadataKeys.ERROR);
    }

    /**
     * @return the recorded failure description, if any
     */
    public Optional<String> error() {
        Object value = metadata.get(MetadataKeys.ERROR);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    /**
     * Copies nested lists and maps too, so values such as {@code page_errors} or
     * {@code document_info} cannot change after the result is built. Null entries are kept.
     */
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static <K> Map<K, Object> freezeMap(Map<K, ?> map) {
        Map<K, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a result that only carries an error annotation.
     *
     * @param message human readable failure description
     * @return result with empty text and a single {@code error} key
     */
    public static ExtractionResult failure(String message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.ERROR, message);
        return new ExtractionResult("", metadata);
    }
}
