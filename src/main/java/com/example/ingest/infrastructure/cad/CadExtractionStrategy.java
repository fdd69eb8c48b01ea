package com.example.ingest.infrastructure.cad;

import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.ExtractionResultBuilder;
import com.example.ingest.domain.model.MetadataKeys;
import com.example.ingest.domain.model.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * CAD strategy for ASCII DXF drawings.
 *
 * <p>Every model-space entity is counted; TEXT and MTEXT payloads and dimension text overrides
 * are emitted one per line. A drawing that cannot be parsed, including DWG files, yields the
 * placeholder {@code CAD file detected: <name>} together with the failure reason.</p>
 */
@Component
public class CadExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(CadExtractionStrategy.class);
    static final String PLACEHOLDER_PREFIX = "CAD file detected: ";

    private final DxfReader reader;

    /**
     * @param reader DXF group-code reader
     */
    public CadExtractionStrategy(DxfReader reader) {
        this.reader = reader;
    }

    @Override
    public ExtractionResult extract(Path file) {
        ExtractionResultBuilder result = new ExtractionResultBuilder("\n")
                .put(MetadataKeys.ENTITIES, 0)
                .put(MetadataKeys.TEXT_ENTITIES, 0)
                .put(MetadataKeys.LAYERS, new ArrayList<String>());

        try {
            DxfDrawing drawing = reader.read(file);
            result.put(MetadataKeys.LAYERS, new ArrayList<>(drawing.layers()));
            for (DxfEntity entity : drawing.entities()) {
                result.increment(MetadataKeys.ENTITIES);
                if (entity.isTextAnnotation()) {
                    result.appendText(entity.text());
                    result.increment(MetadataKeys.TEXT_ENTITIES);
                } else if (entity.isDimension() && entity.hasTextOverride()) {
                    result.appendText(entity.primaryText());
                    result.increment(MetadataKeys.TEXT_ENTITIES);
                }
            }
            log.debug("Read {} entities on {} layers from {}", drawing.entities().size(), drawing.layers().size(), file);
        } catch (IOException | DxfParseException | RuntimeException e) {
            log.warn("CAD extraction failed for {}: {}", file, e.getMessage());
            result.recordError(StepOutcome.describe(e))
                    .replaceText(placeholderFor(file));
        }
        return result.build();
    }

    /**
     * @param file drawing that could not be parsed
     * @return fixed placeholder naming the file
     */
    public static String placeholderFor(Path file) {
        Path name = file.getFileName();
        return PLACEHOLDER_PREFIX + (name == null ? file.toString() : name.toString());
    }
}
