package com.example.ingest.infrastructure.detect;

import com.example.ingest.domain.extraction.FormatDetector;
import com.example.ingest.domain.model.DetectedFormat;
import com.example.ingest.domain.model.DocumentFormat;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Signature based format detection backed by Apache Tika.
 *
 * <p>Tika's magic bytes decide the media type; the file name may only narrow it to a subtype
 * (zip to DOCX, text to CSV), so a PDF renamed to {@code .txt} is still reported as PDF.</p>
 */
@Component
public class TikaFormatDetector implements FormatDetector {

    private static final Logger log = LoggerFactory.getLogger(TikaFormatDetector.class);

    private static final Map<String, DocumentFormat> EXACT_TYPES = Map.ofEntries(
            Map.entry("application/pdf", DocumentFormat.PDF),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", DocumentFormat.DOCX),
            Map.entry("application/msword", DocumentFormat.DOC),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", DocumentFormat.XLSX),
            Map.entry("application/vnd.ms-excel", DocumentFormat.XLSX),
            Map.entry("image/vnd.dxf", DocumentFormat.DXF),
            Map.entry("application/dxf", DocumentFormat.DXF),
            Map.entry("image/vnd.dwg", DocumentFormat.DWG),
            Map.entry("text/csv", DocumentFormat.CSV)
    );

    private final Tika tika = new Tika();

    @Override
    public DetectedFormat detect(Path file) throws IOException {
        String mimeType;
        try (InputStream input = Files.newInputStream(file)) {
            Path name = file.getFileName();
            mimeType = tika.detect(input, name == null ? null : name.toString());
        }
        DocumentFormat format = toFormat(mimeType);
        if (format == DocumentFormat.TXT && looksLikeDxf(file)) {
            format = DocumentFormat.DXF;
            mimeType = "image/vnd.dxf";
        }
        log.debug("Detected {} ({}) for {}", format, mimeType, file);
        return new DetectedFormat(format.tag(), mimeType);
    }

    /**
     * Maps a Tika media type onto a format tag.
     *
     * @param mimeType detected media type
     * @return matching format or {@link DocumentFormat#UNKNOWN}
     */
    DocumentFormat toFormat(String mimeType) {
        if (mimeType == null) {
            return DocumentFormat.UNKNOWN;
        }
        MediaType mediaType = MediaType.parse(mimeType);
        if (mediaType == null) {
            return DocumentFormat.UNKNOWN;
        }
        String baseType = mediaType.getBaseType().toString();
        DocumentFormat exact = EXACT_TYPES.get(baseType);
        if (exact != null) {
            return exact;
        }
        if ("image".equals(mediaType.getType())) {
            return DocumentFormat.IMAGE;
        }
        if ("text".equals(mediaType.getType())) {
            return DocumentFormat.TXT;
        }
        return DocumentFormat.UNKNOWN;
    }

    /**
     * ASCII DXF files open with the group pair {@code 0 / SECTION}.
     */
    private boolean looksLikeDxf(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            String code = reader.readLine();
            String value = reader.readLine();
            return code != null && value != null
                    && "0".equals(code.trim())
                    && "SECTION".equals(value.trim());
        }
    }
}
