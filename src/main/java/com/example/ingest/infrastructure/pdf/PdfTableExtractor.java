package com.example.ingest.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recovers ruled-less tables from a PDF page by looking at glyph positions.
 *
 * <p>Words are grouped into lines by their baseline, a line is split into cells wherever the
 * horizontal gap between two words is wider than {@link #CELL_GAP_FACTOR} times the average glyph
 * width, and at least {@link #MIN_TABLE_ROWS} consecutive lines with the same number of cells
 * (two or more) form one table.</p>
 */
@Component
public class PdfTableExtractor {

    static final float CELL_GAP_FACTOR = 2.5f;
    static final int MIN_TABLE_ROWS = 2;
    static final int MIN_TABLE_COLUMNS = 2;

    /**
     * Extracts every table found on one page.
     *
     * @param document   open PDF document
     * @param pageNumber one-based page number
     * @return tables as rows of cell strings, in reading order
     * @throws IOException when PDFBox cannot read the page content
     */
    public List<List<List<String>>> extractTables(PDDocument document, int pageNumber) throws IOException {
        PositionCollectingStripper stripper = new PositionCollectingStripper();
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        stripper.getText(document);
        return groupTables(stripper.getLines());
    }

    /**
     * Splits lines into cells and groups consecutive lines with matching cell counts.
     *
     * @param lines page lines sorted top to bottom
     * @return detected tables
     */
    List<List<List<String>>> groupTables(List<TableLine> lines) {
        List<List<List<String>>> tables = new ArrayList<>();
        List<List<String>> current = new ArrayList<>();
        for (TableLine line : lines) {
            List<String> cells = line.cells(CELL_GAP_FACTOR);
            boolean candidate = cells.size() >= MIN_TABLE_COLUMNS;
            boolean continues = candidate && (current.isEmpty() || current.get(0).size() == cells.size());
            if (!continues) {
                flush(current, tables);
                current = new ArrayList<>();
            }
            if (candidate) {
                current.add(cells);
            }
        }
        flush(current, tables);
        return tables;
    }

    private void flush(List<List<String>> rows, List<List<List<String>>> tables) {
        if (rows.size() >= MIN_TABLE_ROWS) {
            tables.add(rows);
        }
    }

    /**
     * One visual line of the page with its positioned words.
     */
    static final class TableLine {
        private final float y;
        private final List<PositionedToken> tokens = new ArrayList<>();
        private boolean sorted = false;

        TableLine(float y) {
            this.y = y;
        }

        void addToken(PositionedToken token) {
            if (token == null) {
                return;
            }
            tokens.add(token);
            sorted = false;
        }

        List<PositionedToken> tokens() {
            if (!sorted) {
                tokens.sort(Comparator.comparing(PositionedToken::x));
                sorted = true;
            }
            return tokens;
        }

        float y() {
            return y;
        }

        /**
         * Merges neighbouring words into cells; a gap wider than {@code gapFactor} average glyph
         * widths starts a new cell.
         *
         * @param gapFactor multiple of the average glyph width that separates two cells
         * @return non-empty cell texts from left to right
         */
        List<String> cells(float gapFactor) {
            List<PositionedToken> ordered = tokens();
            List<String> cells = new ArrayList<>();
            if (ordered.isEmpty()) {
                return cells;
            }
            float threshold = averageGlyphWidth() * gapFactor;
            List<PositionedToken> cell = new ArrayList<>();
            PositionedToken previous = null;
            for (PositionedToken token : ordered) {
                if (previous != null && token.x() - previous.endX() > threshold) {
                    addCell(cell, cells);
                    cell = new ArrayList<>();
                }
                cell.add(token);
                previous = token;
            }
            addCell(cell, cells);
            return cells;
        }

        private void addCell(List<PositionedToken> cell, List<String> cells) {
            String text = cell.stream()
                    .map(PositionedToken::text)
                    .map(String::trim)
                    .filter(value -> !value.isEmpty())
                    .collect(Collectors.joining(" "));
            if (!text.isEmpty()) {
                cells.add(text);
            }
        }

        private float averageGlyphWidth() {
            float width = 0f;
            int glyphs = 0;
            for (PositionedToken token : tokens) {
                width += token.endX() - token.x();
                glyphs += Math.max(token.text().length(), 1);
            }
            return glyphs == 0 ? 1f : Math.max(width / glyphs, 0.5f);
        }
    }

    /**
     * Word extracted from the PDF with its horizontal extent.
     */
    static final class PositionedToken {
        private final float x;
        private final float endX;
        private final String text;

        PositionedToken(float x, float endX, String text) {
            this.x = x;
            this.endX = Math.max(endX, x);
            this.text = text == null ? "" : text;
        }

        float x() {
            return x;
        }

        float endX() {
            return endX;
        }

        String text() {
            return text;
        }
    }

    /**
     * Records every word PDFBox writes together with its glyph positions.
     */
    private static final class PositionCollectingStripper extends PDFTextStripper {
        private static final float Y_TOLERANCE = 1.5f;
        private final List<TableLine> lines = new ArrayList<>();

        PositionCollectingStripper() throws IOException {
            super();
        }

        List<TableLine> getLines() {
            lines.sort(Comparator.comparing(TableLine::y));
            return new ArrayList<>(lines);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            if (text != null && !text.isBlank() && !textPositions.isEmpty()) {
                float tokenX = Float.MAX_VALUE;
                float tokenEnd = 0f;
                float tokenY = Float.MAX_VALUE;
                for (TextPosition position : textPositions) {
                    tokenX = Math.min(tokenX, position.getXDirAdj());
                    tokenEnd = Math.max(tokenEnd, position.getXDirAdj() + position.getWidthDirAdj());
                    tokenY = Math.min(tokenY, position.getYDirAdj());
                }
                resolveLine(tokenY).addToken(new PositionedToken(tokenX, tokenEnd, text));
            }
            super.writeString(text, textPositions);
        }

        private TableLine resolveLine(float y) {
            for (TableLine line : lines) {
                if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                    return line;
                }
            }
            TableLine line = new TableLine(y);
            lines.add(line);
            return line;
        }
    }
}
