package com.example.CommonSupplier.logic;

import java.util.List;

public final class HeaderNormalizer {

    private static final char NO_BREAK_SPACE = '\u00A0';

    private HeaderNormalizer() {
    }

    public static String normalize(String header) {
        if (header == null) return "";
        return header.replace(NO_BREAK_SPACE, ' ').trim();
    }

    /**
     * Rewrites the table's headers in place: non-breaking spaces become plain spaces and
     * surrounding whitespace is dropped.
     */
    public static SheetTable cleanHeaders(SheetTable table) {
        List<String> headers = table.getHeaders();
        for (int i = 0; i < headers.size(); i++) {
            table.setHeader(i, normalize(headers.get(i)));
        }
        return table;
    }
}
