package com.example.ingest.infrastructure.text;

import com.example.ingest.config.ExtractionProperties;
import com.example.ingest.domain.model.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Decodes a file with the first charset of a fixed priority list that accepts every byte.
 * Decoders run in strict mode, so a charset "succeeds" only if no byte sequence is malformed or
 * unmappable.
 */
@Component
public class CharsetResolver {

    private static final Logger log = LoggerFactory.getLogger(CharsetResolver.class);

    private final List<Charset> candidates;

    /**
     * @param properties configured encoding priority list
     */
    @Autowired
    public CharsetResolver(ExtractionProperties properties) {
        this(properties.getText().getEncodings());
    }

    /**
     * @param encodings charset names in priority order
     */
    public CharsetResolver(List<String> encodings) {
        this.candidates = encodings.stream().map(Charset::forName).toList();
    }

    /**
     * @return name of the highest priority charset, reported before resolution has happened
     */
    public String primaryEncoding() {
        return candidates.isEmpty() ? "" : candidates.get(0).name();
    }

    /**
     * Reads the file and decodes it with the first matching candidate.
     *
     * @param file file to decode
     * @return decoded text and the charset used, or the reason every candidate failed
     */
    public StepOutcome<DecodedText> decode(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            return StepOutcome.failure(e);
        }
        return decode(bytes);
    }

    /**
     * @param bytes raw content
     * @return decoded text and the charset used, or the reason every candidate failed
     */
    public StepOutcome<DecodedText> decode(byte[] bytes) {
        for (Charset charset : candidates) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                return StepOutcome.success(new DecodedText(text, charset.name()));
            } catch (CharacterCodingException e) {
                log.debug("Content is not valid {}: {}", charset.name(), e.getMessage());
            }
        }
        return StepOutcome.failure("Could not decode content with any of the encodings "
                + candidates.stream().map(Charset::name).toList());
    }

    /**
     * Text decoded with a resolved charset.
     *
     * @param text     decoded content
     * @param encoding canonical charset name
     */
    public record DecodedText(String text, String encoding) {
    }
}
