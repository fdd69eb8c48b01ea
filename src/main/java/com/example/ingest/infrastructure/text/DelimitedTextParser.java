package com.example.ingest.infrastructure.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Comma separated values reader: quoted fields, doubled quotes and line breaks inside quotes are
 * supported. The first record is the header; blank lines are skipped; records shorter than the
 * header are padded with empty cells while longer ones are rejected.
 */
final class DelimitedTextParser {

    private static final char QUOTE = '"';
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final char delimiter;

    DelimitedTextParser(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * @param text decoded file content
     * @return header and rows
     * @throws TabularFormatException on an empty input, an unterminated quote or an oversized record
     */
    TabularData parse(String text) throws TabularFormatException {
        List<List<String>> records = readRecords(text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text);
        if (records.isEmpty()) {
            throw new TabularFormatException("No columns to parse from file");
        }
        List<String> header = records.get(0);
        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            if (record.size() > header.size()) {
                throw new TabularFormatException("Expected " + header.size() + " fields in record "
                        + (i + 1) + ", saw " + record.size());
            }
            List<String> row = new ArrayList<>(record);
            while (row.size() < header.size()) {
                row.add("");
            }
            rows.add(row);
        }
        return new TabularData(header, rows);
    }

    private List<List<String>> readRecords(String text) throws TabularFormatException {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStarted = false;
        int length = text.length();

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < length && text.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }
            if (c == QUOTE && field.length() == 0) {
                quoted = true;
                fieldStarted = true;
            } else if (c == delimiter) {
                record.add(field.toString());
                field.setLength(0);
                fieldStarted = true;
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                endRecord(records, record, field, fieldStarted);
                record = new ArrayList<>();
                fieldStarted = false;
            } else {
                field.append(c);
                fieldStarted = true;
            }
        }
        if (quoted) {
            throw new TabularFormatException("Unterminated quoted field at end of file");
        }
        endRecord(records, record, field, fieldStarted);
        return records;
    }

    private void endRecord(List<List<String>> records, List<String> record, StringBuilder field, boolean fieldStarted) {
        if (!fieldStarted && record.isEmpty()) {
            field.setLength(0);
            return;
        }
        record.add(field.toString());
        field.setLength(0);
        records.add(record);
    }
}
