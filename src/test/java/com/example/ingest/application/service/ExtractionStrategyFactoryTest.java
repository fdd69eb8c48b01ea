package com.example.ingest.application.service;

import com.example.ingest.domain.exception.UnsupportedFormatException;
import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.ExtractionResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering tag resolution, aliases and registration.
 */
class ExtractionStrategyFactoryTest {

    private final ExtractionStrategy docx = file -> new ExtractionResult("docx", Map.of());
    private final ExtractionStrategy cad = file -> new ExtractionResult("cad", Map.of());
    private final ExtractionStrategy tabular = file -> new ExtractionResult("csv", Map.of());

    private ExtractionStrategyFactory newFactory() {
        Map<String, ExtractionStrategy> bindings = new LinkedHashMap<>();
        bindings.put("DOCX", docx);
        bindings.put("DXF", cad);
        bindings.put("CSV", tabular);
        return new ExtractionStrategyFactory(bindings, ExtractionStrategyFactory.DEFAULT_ALIASES);
    }

    @Test
    void aliasesResolveToTheirTargetStrategy() {
        ExtractionStrategyFactory factory = newFactory();

        assertThat(factory.getStrategy("DOC")).isSameAs(docx);
        assertThat(factory.getStrategy("DWG")).isSameAs(cad);
        assertThat(factory.getStrategy("XLSX")).isSameAs(tabular);
        assertThat(factory.aliases()).containsExactly(
                Map.entry("DOC", "DOCX"), Map.entry("DWG", "DXF"), Map.entry("XLSX", "CSV"));
    }

    @Test
    void tagsAreCaseInsensitive() {
        assertThat(newFactory().getStrategy(" docx ")).isSameAs(docx);
    }

    @Test
    void unknownTagRaisesUnsupportedFormat() {
        UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                () -> newFactory().getStrategy("PPTX"));

        assertThat(ex.getFormatTag()).isEqualTo("PPTX");
        assertThat(ex.getMessage()).contains("PPTX");
    }

    @Test
    void nullTagRaisesUnsupportedFormat() {
        assertThrows(UnsupportedFormatException.class, () -> newFactory().getStrategy(null));
    }

    @Test
    void aliasToUnboundTagIsRejected() {
        Map<String, ExtractionStrategy> bindings = Map.of("DOCX", docx);

        assertThrows(IllegalArgumentException.class,
                () -> new ExtractionStrategyFactory(bindings, ExtractionStrategyFactory.DEFAULT_ALIASES));
    }

    @Test
    void registerAddsTagWithoutAffectingOthers() {
        ExtractionStrategyFactory factory = newFactory();
        ExtractionStrategy text = file -> new ExtractionResult("txt", Map.of());

        factory.register("TXT", text);

        assertThat(factory.getStrategy("TXT")).isSameAs(text);
        assertThat(factory.getStrategy("DOCX")).isSameAs(docx);
        assertThat(factory.supportedTags()).contains("TXT", "DOC", "DWG", "XLSX");
    }
}
