package com.example.CommonSupplier.logic;

import java.util.Objects;

/**
 * Location of a changed cell: sheet, 0-based data row, header name. Carries no value.
 */
public final class CellMutation {

    private final String sheetName;
    private final int rowIndex;
    private final String column;

    public CellMutation(String sheetName, int rowIndex, String column) {
        this.sheetName = sheetName;
        this.rowIndex = rowIndex;
        this.column = column;
    }

    public String getSheetName() {
        return sheetName;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellMutation)) return false;
        CellMutation other = (CellMutation) o;
        return rowIndex == other.rowIndex
                && sheetName.equals(other.sheetName)
                && column.equals(other.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetName, rowIndex, column);
    }

    @Override
    public String toString() {
        return sheetName + "!" + column + "[" + rowIndex + "]";
    }
}
