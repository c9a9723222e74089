package com.example.CommonSupplier.logic;

/**
 * Applies the merge rules of one pre-file sheet.
 */
public interface SheetMutator {

    String getSheetName();

    /**
     * Required sheets abort the run when absent, optional ones are skipped.
     */
    boolean isRequired();

    void apply(SheetTable table, SupplierRegistry registry, MutationLedger ledger);
}
