package com.example.ingest.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the extraction result and its builder.
 */
class ExtractionResultTest {

    @Test
    void nullTextAndMetadataAreNormalised() {
        ExtractionResult result = new ExtractionResult(null, null);

        assertThat(result.text()).isEmpty();
        assertThat(result.metadata()).isEmpty();
        assertThat(result.hasError()).isFalse();
        assertThat(result.error()).isEmpty();
    }

    @Test
    void metadataIsCopiedAndUnmodifiable() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(MetadataKeys.PAGES, 2);
        ExtractionResult result = new ExtractionResult("text", metadata);
        metadata.put(MetadataKeys.PAGES, 5);

        assertThat(result.metadata()).containsEntry(MetadataKeys.PAGES, 2);
        assertThrows(UnsupportedOperationException.class, () -> result.metadata().put("x", 1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void nestedMetadataValuesAreFrozen() {
        ExtractionResultBuilder builder = new ExtractionResultBuilder()
                .append(MetadataKeys.EXTRACTION_METHOD, "page_1_direct")
                .put(MetadataKeys.DOCUMENT_INFO, new HashMap<>(Map.of("title", "Report")));
        ExtractionResult result = builder.build();

        builder.append(MetadataKeys.EXTRACTION_METHOD, "page_2_ocr");
        List<Object> methods = (List<Object>) result.metadata().get(MetadataKeys.EXTRACTION_METHOD);
        Map<String, Object> info = (Map<String, Object>) result.metadata().get(MetadataKeys.DOCUMENT_INFO);

        assertThat(methods).containsExactly("page_1_direct");
        assertThrows(UnsupportedOperationException.class, () -> methods.add("page_9_direct"));
        assertThrows(UnsupportedOperationException.class, () -> info.put("author", "someone"));
    }

    @Test
    void nullEntriesInsideListsAreKept() {
        List<Object> sizes = new ArrayList<>();
        sizes.add(null);
        ExtractionResult result = new ExtractionResult("", Map.of(MetadataKeys.IMAGE_SIZE, sizes));

        assertThat(result.metadata().get(MetadataKeys.IMAGE_SIZE)).isEqualTo(sizes);
    }

    @Test
    void failureCarriesErrorAndEmptyText() {
        ExtractionResult result = ExtractionResult.failure("broken");

        assertThat(result.text()).isEmpty();
        assertThat(result.hasError()).isTrue();
        assertThat(result.error()).contains("broken");
    }

    @Test
    void builderJoinsSectionsAndKeepsSeededKeys() {
        ExtractionResult result = new ExtractionResultBuilder()
                .put(MetadataKeys.PAGES, 0)
                .put(MetadataKeys.IMAGE_SIZE, null)
                .appendText("first")
                .appendText(null)
                .appendText("second")
                .increment(MetadataKeys.PAGES)
                .increment(MetadataKeys.PAGES)
                .append(MetadataKeys.EXTRACTION_METHOD, "page_1_direct")
                .build();

        assertThat(result.text()).isEqualTo("first\n\nsecond");
        assertThat(result.metadata())
                .containsEntry(MetadataKeys.PAGES, 2)
                .containsEntry(MetadataKeys.EXTRACTION_METHOD, List.of("page_1_direct"))
                .containsKey(MetadataKeys.IMAGE_SIZE);
        assertThat(result.metadata().get(MetadataKeys.IMAGE_SIZE)).isNull();
    }

    @Test
    void replaceTextWinsOverSectionsUntilCleared() {
        ExtractionResultBuilder builder = new ExtractionResultBuilder("\n")
                .appendText("a")
                .appendText("b");
        assertThat(builder.build().text()).isEqualTo("a\nb");

        builder.replaceText("placeholder").recordError("bad");
        assertThat(builder.build().text()).isEqualTo("placeholder");
        assertThat(builder.build().error()).contains("bad");

        builder.clearText();
        assertThat(builder.build().text()).isEmpty();
    }

    @Test
    void stepOutcomeDescribesExceptionsWithoutMessage() {
        StepOutcome<String> outcome = StepOutcome.failure(new IllegalStateException());

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.failure()).isEqualTo("IllegalStateException");
        assertThat(StepOutcome.success("ok").value()).isEqualTo("ok");
    }
}
