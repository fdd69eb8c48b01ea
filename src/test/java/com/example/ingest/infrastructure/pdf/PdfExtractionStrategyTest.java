package com.example.ingest.infrastructure.pdf;

import com.example.ingest.config.ExtractionProperties;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.MetadataKeys;
import com.example.ingest.infrastructure.exception.OcrException;
import com.example.ingest.infrastructure.ocr.OcrEngine;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the PDF strategy using generated documents and a mocked OCR engine.
 */
class PdfExtractionStrategyTest {

    private static final String LONG_LINE = "This page carries a proper text layer with plenty of characters.";

    @TempDir
    Path tempDir;

    private OcrEngine ocrEngine;
    private PdfExtractionStrategy strategy;

    @BeforeEach
    void setUp() {
        ocrEngine = mock(OcrEngine.class);
        ExtractionProperties properties = new ExtractionProperties();
        // low resolution keeps rendered test pages small
        properties.getPdf().setRenderDpi(36f);
        strategy = new PdfExtractionStrategy(ocrEngine, new PdfTableExtractor(), new PdfDocumentInfoReader(), properties);
    }

    /**
     * Verifies that a page with a significant text layer is taken directly and OCR is skipped.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void significantPageUsesDirectText() throws Exception {
        Path pdf = writePdf("direct.pdf", LONG_LINE);

        ExtractionResult result = strategy.extract(pdf);

        assertThat(result.hasError()).isFalse();
        assertThat(result.text()).contains(LONG_LINE);
        assertThat(result.metadata())
                .containsEntry(MetadataKeys.PAGES, 1)
                .containsEntry(MetadataKeys.EXTRACTION_METHOD, List.of("page_1_direct"))
                .containsEntry(MetadataKeys.TABLES_FOUND, 0)
                .containsEntry(MetadataKeys.PAGE_ERRORS, List.of());
        verify(ocrEngine, never()).recognize(any(BufferedImage.class));
    }

    /**
     * Verifies that a page at or below the threshold falls back to OCR for that page only.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void shortPageFallsBackToOcr() throws Exception {
        given(ocrEngine.recognize(any(BufferedImage.class))).willReturn("scanned page text");
        Path pdf = writePdf("mixed.pdf", LONG_LINE, "Short");

        ExtractionResult result = strategy.extract(pdf);

        assertThat(result.text()).contains(LONG_LINE).contains("scanned page text").doesNotContain("Short");
        assertThat(result.metadata())
                .containsEntry(MetadataKeys.PAGES, 2)
                .containsEntry(MetadataKeys.EXTRACTION_METHOD, List.of("page_1_direct", "page_2_ocr"));
        verify(ocrEngine, times(1)).recognize(any(BufferedImage.class));
    }

    /**
     * Verifies that an OCR failure is recorded per page and leaves no provenance tag.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void ocrFailureIsRecordedAsPageError() throws Exception {
        given(ocrEngine.recognize(any(BufferedImage.class)))
                .willThrow(new OcrException("engine missing", new IllegalStateException()));
        Path pdf = writePdf("scan.pdf", LONG_LINE, "");

        ExtractionResult result = strategy.extract(pdf);

        assertThat(result.hasError()).isFalse();
        assertThat(result.text()).contains(LONG_LINE);
        assertThat(result.metadata())
                .containsEntry(MetadataKeys.EXTRACTION_METHOD, List.of("page_1_direct"))
                .containsEntry(MetadataKeys.PAGE_ERRORS, List.of("page_2 ocr: engine missing"));
    }

    /**
     * Verifies that column aligned text is serialised as a table block.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void alignedColumnsAreReportedAsTable() throws Exception {
        Path pdf = tempDir.resolve("table.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            String[][] rows = {{"Item", "Qty", "Price"}, {"Apple", "3", "1.50"}, {"Pear", "5", "2.00"}};
            float[] columns = {72f, 250f, 400f};
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                for (int row = 0; row < rows.length; row++) {
                    for (int column = 0; column < columns.length; column++) {
                        content.beginText();
                        content.newLineAtOffset(columns[column], 700 - row * 20);
                        content.showText(rows[row][column]);
                        content.endText();
                    }
                }
            }
            document.save(pdf.toFile());
        }

        ExtractionResult result = strategy.extract(pdf);

        assertThat(result.metadata()).containsEntry(MetadataKeys.TABLES_FOUND, 1);
        assertThat(result.text()).contains("TABLE:\nItem | Qty | Price\nApple | 3 | 1.50\nPear | 5 | 2.00");
    }

    /**
     * Verifies that the info dictionary is exposed under document_info.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void documentInfoIsReported() throws Exception {
        Path pdf = tempDir.resolve("info.pdf");
        try (PDDocument document = new PDDocument()) {
            PDDocumentInformation info = new PDDocumentInformation();
            info.setTitle("Quarterly Report");
            info.setAuthor("Finance");
            document.setDocumentInformation(info);
            addTextPage(document, LONG_LINE);
            document.save(pdf.toFile());
        }

        ExtractionResult result = strategy.extract(pdf);

        assertThat(result.metadata().get(MetadataKeys.DOCUMENT_INFO))
                .isInstanceOfSatisfying(Map.class, info -> assertThat(info)
                        .containsEntry("title", "Quarterly Report")
                        .containsEntry("author", "Finance"));
    }

    /**
     * Verifies that an unreadable file yields an error result instead of an exception.
     *
     * @throws Exception when the temp file cannot be written
     */
    @Test
    void corruptFileYieldsErrorResult() throws Exception {
        Path pdf = tempDir.resolve("broken.pdf");
        Files.write(pdf, "this is not a pdf".getBytes(StandardCharsets.US_ASCII));

        ExtractionResult result = strategy.extract(pdf);

        assertThat(result.text()).isEmpty();
        assertThat(result.hasError()).isTrue();
        assertThat(result.metadata())
                .containsEntry(MetadataKeys.PAGES, 0)
                .containsEntry(MetadataKeys.TABLES_FOUND, 0)
                .containsEntry(MetadataKeys.EXTRACTION_METHOD, List.of());
    }

    /**
     * Verifies that repeated extraction of the same file gives the same result.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void extractionIsRepeatable() throws Exception {
        Path pdf = writePdf("repeat.pdf", LONG_LINE, LONG_LINE + " Again.");

        assertThat(strategy.extract(pdf)).isEqualTo(strategy.extract(pdf));
    }

    @Test
    void significanceRequiresMoreThanThresholdCharacters() {
        assertThat(strategy.isSignificant("  " + "x".repeat(30) + "  ")).isFalse();
        assertThat(strategy.isSignificant("x".repeat(31))).isTrue();
        assertThat(strategy.isSignificant(null)).isFalse();
    }

    @Test
    void unicodeSpacesDoNotCountAsText() {
        assertThat(strategy.isSignificant("\u00A0".repeat(40))).isFalse();
        assertThat(strategy.isSignificant("\u2003\u00A0" + "x".repeat(30) + "\u3000\n")).isFalse();
        assertThat(strategy.isSignificant("\u00A0" + "x".repeat(31) + "\u00A0")).isTrue();
        assertThat(PdfExtractionStrategy.strippedLength("\u00A0 a b \u2003")).isEqualTo(3);
    }

    @Test
    void formatTableSkipsEmptyCells() {
        String block = PdfExtractionStrategy.formatTable(List.of(List.of("a", "", "b"), List.of("c", "d")));

        assertThat(block).isEqualTo("TABLE:\na | b\nc | d");
    }

    private Path writePdf(String name, String... pages) throws IOException {
        Path target = tempDir.resolve(name);
        try (PDDocument document = new PDDocument()) {
            for (String text : pages) {
                addTextPage(document, text);
            }
            document.save(target.toFile());
        }
        return target;
    }

    private void addTextPage(PDDocument document, String text) throws IOException {
        PDPage page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        if (text.isEmpty()) {
            return;
        }
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD), 12);
            content.newLineAtOffset(72, 700);
            content.showText(text);
            content.endText();
        }
    }
}
