package com.example.ingest.infrastructure.text;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the first sheet of an Excel workbook (OOXML or legacy BIFF) into {@link TabularData}.
 * Cells are rendered with {@link DataFormatter} so numbers and dates look as they do in Excel.
 */
@Component
public class SpreadsheetReader {

    private static final byte[] ZIP_SIGNATURE = {0x50, 0x4B, 0x03, 0x04};
    private static final byte[] OLE2_SIGNATURE = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0};

    /**
     * @param file candidate file
     * @return {@code true} when the file starts with a ZIP or OLE2 container signature
     * @throws IOException when the file cannot be read
     */
    public boolean isWorkbook(Path file) throws IOException {
        byte[] head = new byte[4];
        try (InputStream input = Files.newInputStream(file)) {
            if (input.readNBytes(head, 0, head.length) < head.length) {
                return false;
            }
        }
        return Arrays.equals(head, ZIP_SIGNATURE) || Arrays.equals(head, OLE2_SIGNATURE);
    }

    /**
     * Reads the first sheet; the first physical row is the header.
     *
     * @param file workbook file
     * @return header and data rows
     * @throws IOException            when POI cannot open the workbook
     * @throws TabularFormatException when the first sheet is empty
     */
    public TabularData readFirstSheet(Path file) throws IOException, TabularFormatException {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new TabularFormatException("Workbook contains no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            List<List<String>> records = new ArrayList<>();
            for (Row row : sheet) {
                List<String> values = new ArrayList<>();
                for (int column = 0; column < Math.max(row.getLastCellNum(), 0); column++) {
                    Cell cell = row.getCell(column, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                    values.add(cell == null ? "" : formatter.formatCellValue(cell));
                }
                if (values.stream().anyMatch(value -> !value.isBlank())) {
                    records.add(values);
                }
            }
            if (records.isEmpty()) {
                throw new TabularFormatException("No columns to parse from file");
            }
            List<String> header = records.get(0);
            List<List<String>> rows = new ArrayList<>();
            for (List<String> record : records.subList(1, records.size())) {
                List<String> row = new ArrayList<>(record.subList(0, Math.min(record.size(), header.size())));
                while (row.size() < header.size()) {
                    row.add("");
                }
                rows.add(row);
            }
            return new TabularData(header, rows);
        }
    }
}
