package com.example.CommonSupplier.logic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class MergeResult {

    private final Map<String, SheetTable> sheets;
    private final SupplierRegistry registry;
    private final MutationLedger ledger;

    MergeResult(Map<String, SheetTable> sheets, SupplierRegistry registry, MutationLedger ledger) {
        this.sheets = Collections.unmodifiableMap(new LinkedHashMap<>(sheets));
        this.registry = registry;
        this.ledger = ledger;
    }

    /** All sheets of the pre-file in their original order, merged ones included. */
    public Map<String, SheetTable> getSheets() {
        return sheets;
    }

    public SheetTable getSheet(String name) {
        return sheets.get(name);
    }

    public SupplierRegistry getRegistry() {
        return registry;
    }

    public MutationLedger getLedger() {
        return ledger;
    }
}
