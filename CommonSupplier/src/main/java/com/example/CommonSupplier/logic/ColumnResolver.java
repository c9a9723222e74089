package com.example.CommonSupplier.logic;

import java.util.Locale;

public final class ColumnResolver {

    private ColumnResolver() {
    }

    /**
     * Finds the header matching {@code targetName} ignoring case and spaces.
     *
     * @return the actual header string as it appears in the table
     * @throws ColumnNotFoundException when no header matches
     */
    public static String findColumn(SheetTable table, String targetName) {
        String wanted = fold(targetName);
        for (String header : table.getHeaders()) {
            if (fold(header).equals(wanted)) {
                return header;
            }
        }
        throw new ColumnNotFoundException(table.getSheetName(), targetName);
    }

    static String fold(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replace(" ", "");
    }
}
