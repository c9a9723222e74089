package com.example.CommonSupplier.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Clear / fill / rename rules for the master data sheets. Only rows of child IDs are touched,
 * and columns the sheet lacks are skipped.
 */
public abstract class ChildRowSheetMutator implements SheetMutator {

    private static final Logger log = LoggerFactory.getLogger(ChildRowSheetMutator.class);

    public static final String FLAG = "X";
    public static final String COMMON_SUPPLIER_PREFIX = "COMMON SUPPLIER ";

    private final String sheetName;
    private final List<String> columnsToClear;
    private final List<String> columnsToFill;

    protected ChildRowSheetMutator(String sheetName, List<String> columnsToClear, List<String> columnsToFill) {
        this.sheetName = sheetName;
        this.columnsToClear = List.copyOf(columnsToClear);
        this.columnsToFill = List.copyOf(columnsToFill);
    }

    @Override
    public String getSheetName() {
        return sheetName;
    }

    @Override
    public boolean isRequired() {
        return true;
    }

    public List<String> getColumnsToClear() {
        return columnsToClear;
    }

    public List<String> getColumnsToFill() {
        return columnsToFill;
    }

    /**
     * Name columns to overwrite with the common supplier name, resolved against this table.
     */
    protected abstract List<String> nameColumns(SheetTable table);

    /** Hook for rows that are not children. */
    protected void applyToOtherRow(SheetTable table, int rowIndex, SupplierRegistry registry, MutationLedger ledger) {
    }

    @Override
    public void apply(SheetTable table, SupplierRegistry registry, MutationLedger ledger) {
        log.info("Updating {}...", sheetName);
        String sourceCol = ColumnResolver.findColumn(table, SheetNames.SOURCE_ID);
        List<String> nameCols = nameColumns(table);

        int touched = 0;
        for (int r = 0; r < table.rowCount(); r++) {
            String sid = table.get(r, sourceCol).trim();
            if (sid.isEmpty()) continue;
            if (!registry.isChild(sid)) {
                applyToOtherRow(table, r, registry, ledger);
                continue;
            }

            String commonName = commonSupplierName(registry.parentOf(sid));
            for (String col : columnsToClear) {
                ledger.update(table, r, col, "");
            }
            for (String col : columnsToFill) {
                ledger.update(table, r, col, FLAG);
            }
            for (String col : nameCols) {
                ledger.update(table, r, col, commonName);
            }
            touched++;
        }
        log.debug("{}: {} child rows merged", sheetName, touched);
    }

    public static String commonSupplierName(String parentId) {
        return COMMON_SUPPLIER_PREFIX + parentId;
    }
}
