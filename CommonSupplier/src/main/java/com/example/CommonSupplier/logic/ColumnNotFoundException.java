package com.example.CommonSupplier.logic;

public class ColumnNotFoundException extends CommonSupplierException {

    private final String sheetName;
    private final String columnName;

    public ColumnNotFoundException(String sheetName, String columnName) {
        super("Column '" + columnName + "' not found in sheet '" + sheetName + "'.");
        this.sheetName = sheetName;
        this.columnName = columnName;
    }

    public String getSheetName() {
        return sheetName;
    }

    public String getColumnName() {
        return columnName;
    }
}
