package com.example.CommonSupplier.logic;

public class MissingSheetException extends CommonSupplierException {

    private final String sheetName;

    public MissingSheetException(String sheetName) {
        super("Missing required sheet: " + sheetName);
        this.sheetName = sheetName;
    }

    public String getSheetName() {
        return sheetName;
    }
}
