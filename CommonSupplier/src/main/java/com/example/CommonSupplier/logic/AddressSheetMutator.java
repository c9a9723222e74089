package com.example.CommonSupplier.logic;

import java.util.List;

/** ADRC: only the Name1 field is renamed. */
public class AddressSheetMutator extends ChildRowSheetMutator {

    public AddressSheetMutator() {
        super(SheetNames.ADDRESS, List.of(), List.of());
    }

    @Override
    protected List<String> nameColumns(SheetTable table) {
        return List.of(ColumnResolver.findColumn(table, "Name1"));
    }
}
