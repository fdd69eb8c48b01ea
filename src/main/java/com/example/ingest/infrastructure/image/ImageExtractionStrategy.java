package com.example.ingest.infrastructure.image;

import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.ExtractionResultBuilder;
import com.example.ingest.domain.model.MetadataKeys;
import com.example.ingest.domain.model.StepOutcome;
import com.example.ingest.infrastructure.ocr.OcrEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Single-shot OCR over a raster image.
 * Metadata carries the engine name and the {@code [width, height]} read from the image header.
 */
@Component
public class ImageExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ImageExtractionStrategy.class);

    private final OcrEngine ocrEngine;

    /**
     * @param ocrEngine engine shared with the PDF fallback path
     */
    public ImageExtractionStrategy(OcrEngine ocrEngine) {
        this.ocrEngine = ocrEngine;
    }

    @Override
    public ExtractionResult extract(Path file) {
        ExtractionResultBuilder result = new ExtractionResultBuilder()
                .put(MetadataKeys.OCR_METHOD, ocrEngine.engineName())
                .put(MetadataKeys.IMAGE_SIZE, null);

        StepOutcome<BufferedImage> decoded = decode(file);
        if (!decoded.succeeded()) {
            log.warn("Image decoding failed for {}: {}", file, decoded.failure());
            return result.recordError(decoded.failure()).build();
        }

        BufferedImage image = decoded.value();
        result.put(MetadataKeys.IMAGE_SIZE, List.of(image.getWidth(), image.getHeight()));
        try {
            result.appendText(ocrEngine.recognize(image));
        } catch (RuntimeException e) {
            log.warn("OCR failed for {}: {}", file, e.getMessage());
            result.put(MetadataKeys.IMAGE_SIZE, null)
                    .recordError(StepOutcome.describe(e));
        }
        return result.build();
    }

    /**
     * Decodes the first frame with the first ImageIO reader that accepts the stream.
     *
     * @param file image file
     * @return decoded raster or the reason no reader could decode it
     */
    private StepOutcome<BufferedImage> decode(Path file) {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                return StepOutcome.failure("Cannot open image stream: " + file.getFileName());
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return StepOutcome.failure("Unsupported image format: " + file.getFileName());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return StepOutcome.success(reader.read(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            return StepOutcome.failure(e);
        }
    }
}
