package com.example.CommonSupplier.logic;

import java.util.List;

/** LFA1: secondary names cleared, deletion and posting/purchasing blocks set. */
public class SupplierGeneralSheetMutator extends ChildRowSheetMutator {

    static final List<String> CLEAR = List.of("NAME2", "NAME3", "NAME4");
    static final List<String> FILL = List.of("LOEVM", "SPERR", "SPERM");
    static final List<String> NAMES = List.of("NAME1");

    public SupplierGeneralSheetMutator() {
        super(SheetNames.SUPPLIER_GENERAL, CLEAR, FILL);
    }

    @Override
    protected List<String> nameColumns(SheetTable table) {
        return NAMES;
    }
}
