package com.example.ingest.infrastructure.pdf;

import com.example.ingest.config.ExtractionProperties;
import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.ExtractionResultBuilder;
import com.example.ingest.domain.model.MetadataKeys;
import com.example.ingest.domain.model.StepOutcome;
import com.example.ingest.infrastructure.exception.OcrException;
import com.example.ingest.infrastructure.ocr.OcrEngine;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * PDF strategy with a per-page OCR fallback.
 *
 * <p>Each page's text layer is read first; when its trimmed length does not exceed the
 * significance threshold the page alone is rendered and passed to OCR. Tables are recovered on
 * every page independently of the text path. A failed OCR call or table pass only affects its
 * page and is listed under {@code page_errors}.</p>
 */
@Component
public class PdfExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(PdfExtractionStrategy.class);
    static final String TABLE_MARKER = "TABLE:";
    static final String CELL_SEPARATOR = " | ";

    private final OcrEngine ocrEngine;
    private final PdfTableExtractor tableExtractor;
    private final PdfDocumentInfoReader documentInfoReader;
    private final int significanceThreshold;
    private final float renderDpi;

    /**
     * @param ocrEngine          engine used for pages without a usable text layer
     * @param tableExtractor     positional table recovery
     * @param documentInfoReader info dictionary / XMP reader
     * @param properties         threshold and rendering resolution
     */
    public PdfExtractionStrategy(OcrEngine ocrEngine,
                                 PdfTableExtractor tableExtractor,
                                 PdfDocumentInfoReader documentInfoReader,
                                 ExtractionProperties properties) {
        this.ocrEngine = ocrEngine;
        this.tableExtractor = tableExtractor;
        this.documentInfoReader = documentInfoReader;
        this.significanceThreshold = properties.getPdf().getSignificanceThreshold();
        this.renderDpi = properties.getPdf().getRenderDpi();
    }

    @Override
    public ExtractionResult extract(Path file) {
        ExtractionResultBuilder result = new ExtractionResultBuilder()
                .put(MetadataKeys.PAGES, 0)
                .put(MetadataKeys.EXTRACTION_METHOD, new ArrayList<String>())
                .put(MetadataKeys.TABLES_FOUND, 0)
                .put(MetadataKeys.PAGE_ERRORS, new ArrayList<String>())
                .put(MetadataKeys.DOCUMENT_INFO, new LinkedHashMap<String, Object>());

        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            int pageCount = document.getNumberOfPages();
            result.put(MetadataKeys.PAGES, pageCount);
            result.put(MetadataKeys.DOCUMENT_INFO, documentInfoReader.read(document));

            PDFRenderer renderer = new PDFRenderer(document);
            int tablesFound = 0;
            for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
                extractPageText(document, renderer, pageIndex, result);
                tablesFound += extractPageTables(document, pageIndex + 1, result);
            }
            result.put(MetadataKeys.TABLES_FOUND, tablesFound);
            log.debug("Extracted {} pages and {} tables from {}", pageCount, tablesFound, file);
        } catch (IOException | RuntimeException e) {
            log.warn("PDF extraction failed for {}: {}", file, e.getMessage());
            result.clearText()
                    .put(MetadataKeys.TABLES_FOUND, 0)
                    .recordError(StepOutcome.describe(e));
        }
        return result.build();
    }

    /**
     * Accepts the page's direct text when significant, otherwise falls back to OCR of that page only.
     */
    private void extractPageText(PDDocument document, PDFRenderer renderer, int pageIndex, ExtractionResultBuilder result) {
        int pageNumber = pageIndex + 1;
        StepOutcome<String> direct = readDirectText(document, pageNumber);
        direct.ifFailed(reason -> result.append(MetadataKeys.PAGE_ERRORS,
                "page_" + pageNumber + " text layer: " + reason));

        if (direct.succeeded() && isSignificant(direct.value())) {
            result.appendText(direct.value());
            result.append(MetadataKeys.EXTRACTION_METHOD, "page_" + pageNumber + "_direct");
            return;
        }

        recognizePage(renderer, pageIndex)
                .ifSucceeded(text -> {
                    result.appendText(text);
                    result.append(MetadataKeys.EXTRACTION_METHOD, "page_" + pageNumber + "_ocr");
                })
                .ifFailed(reason -> {
                    log.warn("OCR failed for page {}: {}", pageNumber, reason);
                    result.append(MetadataKeys.PAGE_ERRORS, "page_" + pageNumber + " ocr: " + reason);
                });
    }

    /**
     * @return number of tables appended for the page
     */
    private int extractPageTables(PDDocument document, int pageNumber, ExtractionResultBuilder result) {
        StepOutcome<List<List<List<String>>>> tables = readTables(document, pageNumber);
        tables.ifFailed(reason -> {
            log.debug("Table extraction failed for page {}: {}", pageNumber, reason);
            result.append(MetadataKeys.PAGE_ERRORS, "page_" + pageNumber + " tables: " + reason);
        });
        if (!tables.succeeded()) {
            return 0;
        }
        for (List<List<String>> table : tables.value()) {
            result.appendText(formatTable(table));
        }
        return tables.value().size();
    }

    /**
     * Trimmed length strictly greater than the threshold counts as a usable text layer.
     * Unicode spaces such as no-break spaces are trimmed as well.
     *
     * @param text direct text of one page
     * @return {@code true} when OCR can be skipped
     */
    boolean isSignificant(String text) {
        return text != null && strippedLength(text) > significanceThreshold;
    }

    static int strippedLength(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isBlank(text.charAt(start))) {
            start++;
        }
        while (end > start && isBlank(text.charAt(end - 1))) {
            end--;
        }
        return end - start;
    }

    private static boolean isBlank(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private StepOutcome<String> readDirectText(PDDocument document, int pageNumber) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            return StepOutcome.success(stripper.getText(document));
        } catch (IOException | RuntimeException e) {
            return StepOutcome.failure(e);
        }
    }

    private StepOutcome<String> recognizePage(PDFRenderer renderer, int pageIndex) {
        try {
            BufferedImage image = renderer.renderImageWithDPI(pageIndex, renderDpi, ImageType.RGB);
            return StepOutcome.success(ocrEngine.recognize(image));
        } catch (OcrException e) {
            return StepOutcome.failure(e);
        } catch (IOException | RuntimeException e) {
            log.debug("Rendering failed for page {}", pageIndex + 1, e);
            return StepOutcome.failure("render failed: " + StepOutcome.describe(e));
        }
    }

    private StepOutcome<List<List<List<String>>>> readTables(PDDocument document, int pageNumber) {
        try {
            return StepOutcome.success(tableExtractor.extractTables(document, pageNumber));
        } catch (IOException | RuntimeException e) {
            return StepOutcome.failure(e);
        }
    }

    /**
     * Serialises one table as {@code TABLE:} followed by pipe-delimited rows, skipping empty cells.
     *
     * @param table rows of cell values
     * @return text block appended to the document text
     */
    static String formatTable(List<List<String>> table) {
        String rows = table.stream()
                .map(row -> row.stream()
                        .filter(cell -> cell != null && !cell.isEmpty())
                        .collect(Collectors.joining(CELL_SEPARATOR)))
                .collect(Collectors.joining("\n"));
        return TABLE_MARKER + "\n" + rows;
    }
}
