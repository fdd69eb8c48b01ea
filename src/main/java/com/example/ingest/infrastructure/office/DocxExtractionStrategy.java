package com.example.ingest.infrastructure.office;

import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.ExtractionResultBuilder;
import com.example.ingest.domain.model.MetadataKeys;
import com.example.ingest.domain.model.StepOutcome;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Word (OOXML) strategy: non-blank body paragraphs first, then every table as a {@code TABLE:}
 * block of pipe-delimited rows.
 */
@Component
public class DocxExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(DocxExtractionStrategy.class);
    static final String TABLE_MARKER = "TABLE:";
    static final String CELL_SEPARATOR = " | ";

    @Override
    public ExtractionResult extract(Path file) {
        ExtractionResultBuilder result = new ExtractionResultBuilder()
                .put(MetadataKeys.PARAGRAPHS, 0)
                .put(MetadataKeys.TABLES, 0);

        try (InputStream input = Files.newInputStream(file);
             XWPFDocument document = new XWPFDocument(input)) {
            List<String> paragraphs = new ArrayList<>();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                String text = paragraph.getText();
                if (text != null && !text.isBlank()) {
                    paragraphs.add(text);
                }
            }
            List<String> tables = new ArrayList<>();
            for (XWPFTable table : document.getTables()) {
                tables.add(formatTable(table));
            }

            paragraphs.forEach(result::appendText);
            tables.forEach(result::appendText);
            result.put(MetadataKeys.PARAGRAPHS, paragraphs.size())
                    .put(MetadataKeys.TABLES, tables.size());
        } catch (IOException | RuntimeException e) {
            // POI reports broken archives as NotOfficeXmlFileException / POIXMLException
            log.warn("DOCX extraction failed for {}: {}", file, e.getMessage());
            result.clearText()
                    .put(MetadataKeys.PARAGRAPHS, 0)
                    .put(MetadataKeys.TABLES, 0)
                    .recordError(StepOutcome.describe(e));
        }
        return result.build();
    }

    private String formatTable(XWPFTable table) {
        List<String> rows = new ArrayList<>();
        for (XWPFTableRow row : table.getRows()) {
            rows.add(row.getTableCells().stream()
                    .map(XWPFTableCell::getText)
                    .collect(Collectors.joining(CELL_SEPARATOR)));
        }
        return TABLE_MARKER + "\n" + String.join("\n", rows);
    }
}
