package com.example.ingest.infrastructure.text;

import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.ExtractionResultBuilder;
import com.example.ingest.domain.model.MetadataKeys;
import com.example.ingest.domain.model.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Plain-text strategy: the decoded content is returned verbatim.
 * {@code lines} counts the segments between line breaks ({@code \r\n}, {@code \r} or {@code \n}),
 * so a trailing line break adds one empty segment.
 */
@Component
public class PlainTextExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(PlainTextExtractionStrategy.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final CharsetResolver charsetResolver;

    /**
     * @param charsetResolver encoding priority resolution
     */
    public PlainTextExtractionStrategy(CharsetResolver charsetResolver) {
        this.charsetResolver = charsetResolver;
    }

    @Override
    public ExtractionResult extract(Path file) {
        ExtractionResultBuilder result = new ExtractionResultBuilder()
                .put(MetadataKeys.ENCODING, charsetResolver.primaryEncoding())
                .put(MetadataKeys.LINES, 0);

        StepOutcome<CharsetResolver.DecodedText> decoded = charsetResolver.decode(file);
        if (!decoded.succeeded()) {
            log.warn("Text decoding failed for {}: {}", file, decoded.failure());
            return result.recordError(decoded.failure()).build();
        }

        String text = decoded.value().text();
        return result.put(MetadataKeys.ENCODING, decoded.value().encoding())
                .put(MetadataKeys.LINES, LINE_BREAK.split(text, -1).length)
                .appendText(text)
                .build();
    }
}
