package com.example.ingest.infrastructure.text;

import com.example.ingest.config.ExtractionProperties;
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

/**
 * CSV strategy that renders a bounded summary instead of the full table:
 * row and column counts, the column names and an aligned preview of the first rows.
 *
 * <p>Spreadsheets routed here are read from their first sheet only; the encoding is then
 * reported as {@value #WORKBOOK_ENCODING}.</p>
 */
@Component
public class TabularExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(TabularExtractionStrategy.class);
    static final String WORKBOOK_ENCODING = "binary";

    private final CharsetResolver charsetResolver;
    private final SpreadsheetReader spreadsheetReader;
    private final DelimitedTextParser parser = new DelimitedTextParser(',');
    private final int previewRows;

    /**
     * @param charsetResolver   encoding priority resolution
     * @param spreadsheetReader first-sheet reader for workbooks
     * @param properties        preview size
     */
    public TabularExtractionStrategy(CharsetResolver charsetResolver,
                                     SpreadsheetReader spreadsheetReader,
                                     ExtractionProperties properties) {
        this.charsetResolver = charsetResolver;
        this.spreadsheetReader = spreadsheetReader;
        this.previewRows = properties.getText().getPreviewRows();
    }

    @Override
    public ExtractionResult extract(Path file) {
        ExtractionResultBuilder result = new ExtractionResultBuilder()
                .put(MetadataKeys.ROWS, 0)
                .put(MetadataKeys.COLUMNS, 0)
                .put(MetadataKeys.ENCODING, charsetResolver.primaryEncoding());

        StepOutcome<TabularData> table = read(file, result);
        if (!table.succeeded()) {
            log.warn("Tabular extraction failed for {}: {}", file, table.failure());
            return result.recordError(table.failure()).build();
        }

        TabularData data = table.value();
        int rows = data.rows().size();
        int columns = data.columns().size();
        result.put(MetadataKeys.ROWS, rows)
                .put(MetadataKeys.COLUMNS, columns)
                .appendText("CSV Table with " + rows + " rows and " + columns + " columns:")
                .appendText("Columns: " + String.join(", ", data.columns()))
                .appendText("Data preview:")
                .appendText(TablePreviewRenderer.render(data, previewRows));
        return result.build();
    }

    private StepOutcome<TabularData> read(Path file, ExtractionResultBuilder result) {
        try {
            if (spreadsheetReader.isWorkbook(file)) {
                result.put(MetadataKeys.ENCODING, WORKBOOK_ENCODING);
                return StepOutcome.success(spreadsheetReader.readFirstSheet(file));
            }
        } catch (IOException | TabularFormatException | RuntimeException e) {
            return StepOutcome.failure(e);
        }

        StepOutcome<CharsetResolver.DecodedText> decoded = charsetResolver.decode(file);
        if (!decoded.succeeded()) {
            return StepOutcome.failure(decoded.failure());
        }
        try {
            TabularData data = parser.parse(decoded.value().text());
            result.put(MetadataKeys.ENCODING, decoded.value().encoding());
            return StepOutcome.success(data);
        } catch (TabularFormatException e) {
            return StepOutcome.failure(e);
        }
    }
}
