package com.example.CommonSupplier.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One sheet of the pre-file held as text: the preamble row (row 1), the header row (row 2)
 * and the data rows below it. Every cell is a string, a missing cell is "".
 */
public class SheetTable {

    private final String sheetName;
    private final List<String> preamble;
    private final List<String> headers;
    private final List<List<String>> rows = new ArrayList<>();

    public SheetTable(String sheetName, List<String> preamble, List<String> headers) {
        this.sheetName = sheetName;
        this.preamble = new ArrayList<>(preamble);
        this.headers = new ArrayList<>();
        for (String header : headers) {
            this.headers.add(header == null ? "" : header);
        }
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<String> getPreamble() {
        return Collections.unmodifiableList(preamble);
    }

    public List<String> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    void setHeader(int index, String header) {
        headers.set(index, header);
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Appends a data row. Short rows are padded with "", cells beyond the header width
     * widen the table with unnamed columns.
     */
    public void addRow(List<String> values) {
        while (headers.size() < values.size()) {
            headers.add("");
            for (List<String> row : rows) {
                row.add("");
            }
        }
        List<String> row = new ArrayList<>(headers.size());
        for (String value : values) {
            row.add(value == null ? "" : value);
        }
        while (row.size() < headers.size()) {
            row.add("");
        }
        rows.add(row);
    }

    public List<String> getRow(int rowIndex) {
        return Collections.unmodifiableList(rows.get(rowIndex));
    }

    public boolean hasColumn(String column) {
        return columnIndex(column) >= 0;
    }

    /** Exact header match, -1 when absent. */
    public int columnIndex(String column) {
        return headers.indexOf(column);
    }

    public String get(int rowIndex, String column) {
        int col = columnIndex(column);
        if (col < 0) {
            throw new ColumnNotFoundException(sheetName, column);
        }
        return rows.get(rowIndex).get(col);
    }

    public void set(int rowIndex, String column, String value) {
        int col = columnIndex(column);
        if (col < 0) {
            throw new ColumnNotFoundException(sheetName, column);
        }
        rows.get(rowIndex).set(col, value == null ? "" : value);
    }

    /**
     * Appends an empty column unless one with this exact name already exists.
     */
    public String ensureColumn(String column) {
        if (!hasColumn(column)) {
            headers.add(column);
            for (List<String> row : rows) {
                row.add("");
            }
        }
        return column;
    }

    @Override
    public String toString() {
        return "SheetTable{" + sheetName + ", " + headers.size() + " columns, " + rows.size() + " rows}";
    }
}
