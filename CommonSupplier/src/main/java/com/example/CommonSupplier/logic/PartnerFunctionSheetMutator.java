package com.example.CommonSupplier.logic;

import java.util.Locale;

/**
 * WYT3: purchasing-org reconciliation, plus every vendor partner function (PARVW = LF)
 * becomes the default partner.
 */
public class PartnerFunctionSheetMutator extends AssociationSheetMutator {

    public static final String PARTNER_FUNCTION_COLUMN = "PARVW";
    public static final String DEFAULT_PARTNER_COLUMN = "DEFPA";
    static final String VENDOR_FUNCTION = "LF";

    public PartnerFunctionSheetMutator() {
        super(SheetNames.PARTNER_FUNCTION, "EKORG", false);
    }

    @Override
    protected RowRule extraRowRule(SheetTable table) {
        String partnerFunctionCol = null;
        for (String header : table.getHeaders()) {
            if (header.trim().toLowerCase(Locale.ROOT).equals(PARTNER_FUNCTION_COLUMN.toLowerCase(Locale.ROOT))) {
                partnerFunctionCol = header;
                break;
            }
        }
        String defaultPartnerCol = table.ensureColumn(DEFAULT_PARTNER_COLUMN);
        if (partnerFunctionCol == null) {
            return (rowIndex, ledger) -> { };
        }

        String functionCol = partnerFunctionCol;
        return (rowIndex, ledger) -> {
            String function = table.get(rowIndex, functionCol).trim();
            if (function.equalsIgnoreCase(VENDOR_FUNCTION)) {
                ledger.update(table, rowIndex, defaultPartnerCol, ChildRowSheetMutator.FLAG);
            }
        };
    }
}
