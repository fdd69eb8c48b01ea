package com.example.ingest.infrastructure.pdf;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for grouping positioned lines into tables.
 */
class PdfTableExtractorTest {

    private final PdfTableExtractor extractor = new PdfTableExtractor();

    @Test
    void consecutiveLinesWithEqualCellCountsFormOneTable() {
        List<PdfTableExtractor.TableLine> lines = List.of(
                line(10f, "Name", "Qty"),
                line(30f, "Apple", "3"),
                line(50f, "Pear", "5"));

        List<List<List<String>>> tables = extractor.groupTables(lines);

        assertThat(tables).hasSize(1);
        assertThat(tables.get(0)).containsExactly(
                List.of("Name", "Qty"), List.of("Apple", "3"), List.of("Pear", "5"));
    }

    @Test
    void singleCellLineBreaksTables() {
        List<PdfTableExtractor.TableLine> lines = List.of(
                line(10f, "A", "B"),
                line(30f, "1", "2"),
                line(50f, "Paragraph"),
                line(70f, "C", "D", "E"),
                line(90f, "3", "4", "5"));

        List<List<List<String>>> tables = extractor.groupTables(lines);

        assertThat(tables).hasSize(2);
        assertThat(tables.get(1).get(0)).containsExactly("C", "D", "E");
    }

    @Test
    void lonelyRowIsNotATable() {
        assertThat(extractor.groupTables(List.of(line(10f, "A", "B"), line(30f, "text")))).isEmpty();
    }

    @Test
    void closeWordsStayInOneCell() {
        PdfTableExtractor.TableLine line = new PdfTableExtractor.TableLine(10f);
        line.addToken(new PdfTableExtractor.PositionedToken(0f, 30f, "Green"));
        line.addToken(new PdfTableExtractor.PositionedToken(33f, 63f, "apple"));
        line.addToken(new PdfTableExtractor.PositionedToken(200f, 206f, "7"));

        assertThat(line.cells(PdfTableExtractor.CELL_GAP_FACTOR)).containsExactly("Green apple", "7");
    }

    /**
     * Places each cell 150 points apart with glyphs 6 points wide.
     */
    private PdfTableExtractor.TableLine line(float y, String... cells) {
        PdfTableExtractor.TableLine line = new PdfTableExtractor.TableLine(y);
        for (int i = 0; i < cells.length; i++) {
            float x = i * 150f;
            line.addToken(new PdfTableExtractor.PositionedToken(x, x + cells[i].length() * 6f, cells[i]));
        }
        return line;
    }
}
