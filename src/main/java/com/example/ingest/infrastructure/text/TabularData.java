package com.example.ingest.infrastructure.text;

import java.util.List;

/**
 * Header plus data rows; every row has exactly {@code columns().size()} cells.
 */
public record TabularData(
        List<String> columns,
        List<List<String>> rows
) {

    public TabularData {
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
    }
}
