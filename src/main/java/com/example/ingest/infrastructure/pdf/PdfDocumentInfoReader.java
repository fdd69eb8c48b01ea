package com.example.ingest.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the info dictionary and XMP packet of an open PDF into a flat metadata map.
 * Missing values are omitted rather than stored as {@code null}.
 */
@Component
public class PdfDocumentInfoReader {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentInfoReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    /**
     * Reads the document-level metadata.
     *
     * @param document already opened PDF document
     * @return ordered map of the available values, empty when the document carries none
     */
    public Map<String, Object> read(PDDocument document) {
        Map<String, Object> info = new LinkedHashMap<>();
        if (document == null) {
            return info;
        }
        info.put("pdf_version", String.valueOf(document.getVersion()));
        info.put("encrypted", document.isEncrypted());
        readInfoDictionary(document.getDocumentInformation(), info);
        readXmp(document.getDocumentCatalog(), info);
        return info;
    }

    private void readInfoDictionary(PDDocumentInformation source, Map<String, Object> target) {
        if (source == null) {
            return;
        }
        putIfPresent(target, "title", source.getTitle());
        putIfPresent(target, "author", source.getAuthor());
        putIfPresent(target, "subject", source.getSubject());
        putIfPresent(target, "keywords", source.getKeywords());
        putIfPresent(target, "creator", source.getCreator());
        putIfPresent(target, "producer", source.getProducer());
        putIfPresent(target, "creation_date", formatCalendar(source.getCreationDate()));
        putIfPresent(target, "modification_date", formatCalendar(source.getModificationDate()));
    }

    /**
     * Adds Dublin Core creators and the XMP creator tool; an unreadable packet is logged and skipped.
     */
    private void readXmp(PDDocumentCatalog catalog, Map<String, Object> target) {
        if (catalog == null) {
            return;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            XMPBasicSchema basic = xmp.getXMPBasicSchema();
            if (dc != null && dc.getCreators() != null && !dc.getCreators().isEmpty()) {
                target.put("xmp_creators", List.copyOf(dc.getCreators()));
            }
            if (basic != null) {
                putIfPresent(target, "xmp_creator_tool", basic.getCreatorTool());
            }
        } catch (IOException | XmpParsingException ex) {
            log.warn("Failed to parse XMP metadata", ex);
        }
    }

    private void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atOffset(ZoneOffset.UTC));
    }
}
