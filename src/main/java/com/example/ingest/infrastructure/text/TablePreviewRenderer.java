package com.example.ingest.infrastructure.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the first rows of a table as right-aligned fixed-width text with a header line.
 */
final class TablePreviewRenderer {

    private static final String GUTTER = "  ";

    private TablePreviewRenderer() {
    }

    /**
     * @param data    table to render
     * @param maxRows maximum number of data rows in the preview
     * @return aligned preview, header first
     */
    static String render(TabularData data, int maxRows) {
        List<List<String>> lines = new ArrayList<>();
        lines.add(data.columns());
        lines.addAll(data.rows().subList(0, Math.min(maxRows, data.rows().size())));

        int[] widths = new int[data.columns().size()];
        for (List<String> line : lines) {
            for (int column = 0; column < widths.length; column++) {
                widths[column] = Math.max(widths[column], line.get(column).length());
            }
        }

        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < lines.size(); row++) {
            if (row > 0) {
                builder.append('\n');
            }
            List<String> line = lines.get(row);
            for (int column = 0; column < widths.length; column++) {
                if (column > 0) {
                    builder.append(GUTTER);
                }
                builder.append(" ".repeat(widths[column] - line.get(column).length()))
                        .append(line.get(column));
            }
        }
        return builder.toString();
    }
}
