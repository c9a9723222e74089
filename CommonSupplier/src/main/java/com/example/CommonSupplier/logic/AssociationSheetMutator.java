package com.example.CommonSupplier.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Moves a child's organizational-unit rows (company code, purchasing org) over to its parent.
 * <p>
 * A child row whose code the parent does not have yet is redirected to the parent and flagged
 * {@code _ACTION_CODE = I}. Rows whose code the parent already has, or with no code at all,
 * stay as they are. The parent's codes are taken from the sheet before any row is redirected.
 */
public class AssociationSheetMutator implements SheetMutator {

    private static final Logger log = LoggerFactory.getLogger(AssociationSheetMutator.class);

    public static final String ACTION_CODE_COLUMN = "_ACTION_CODE";
    public static final String INSERT = "I";

    private final String sheetName;
    private final String codeColumn;
    private final boolean required;

    public AssociationSheetMutator(String sheetName, String codeColumn, boolean required) {
        this.sheetName = sheetName;
        this.codeColumn = codeColumn;
        this.required = required;
    }

    public static AssociationSheetMutator companyCode() {
        return new AssociationSheetMutator(SheetNames.COMPANY_CODE, "BUKRS", true);
    }

    public static AssociationSheetMutator purchasingOrg() {
        return new AssociationSheetMutator(SheetNames.PURCHASING_ORG, "EKORG", false);
    }

    @Override
    public String getSheetName() {
        return sheetName;
    }

    @Override
    public boolean isRequired() {
        return required;
    }

    public String getCodeColumn() {
        return codeColumn;
    }

    @Override
    public void apply(SheetTable table, SupplierRegistry registry, MutationLedger ledger) {
        log.info("Updating {}...", sheetName);
        String sourceCol;
        String codeCol;
        try {
            sourceCol = ColumnResolver.findColumn(table, SheetNames.SOURCE_ID);
            codeCol = ColumnResolver.findColumn(table, codeColumn);
        } catch (ColumnNotFoundException e) {
            if (required) throw e;
            log.warn("{} Skipping {}.", e.getMessage(), sheetName);
            return;
        }

        String actionCol = table.ensureColumn(ACTION_CODE_COLUMN);
        RowRule extraRule = extraRowRule(table);

        Map<String, Set<String>> codesById = codesBySourceId(table, sourceCol, codeCol);
        int inserted = 0;
        for (int r = 0; r < table.rowCount(); r++) {
            // read before this row is redirected
            String sid = table.get(r, sourceCol).trim();
            if (registry.isChild(sid)) {
                String parentId = registry.parentOf(sid);
                Set<String> parentCodes = codesById.getOrDefault(parentId, Collections.emptySet());
                String code = table.get(r, codeCol).trim();
                if (!code.isEmpty() && !parentCodes.contains(code)) {
                    ledger.update(table, r, actionCol, INSERT);
                    ledger.update(table, r, sourceCol, parentId);
                    inserted++;
                }
            }
            extraRule.apply(r, ledger);
        }
        log.debug("{}: {} rows flagged for insertion", sheetName, inserted);
    }

    /**
     * Rule run on every row after reconciliation, regardless of classification. Called once the
     * sheet is known to be processable, so it may add the columns it writes.
     */
    protected RowRule extraRowRule(SheetTable table) {
        return (rowIndex, ledger) -> { };
    }

    @FunctionalInterface
    protected interface RowRule {
        void apply(int rowIndex, MutationLedger ledger);
    }

    static Map<String, Set<String>> codesBySourceId(SheetTable table, String sourceCol, String codeCol) {
        Map<String, Set<String>> codes = new HashMap<>();
        for (int r = 0; r < table.rowCount(); r++) {
            String sid = table.get(r, sourceCol).trim();
            String code = table.get(r, codeCol).trim();
            if (code.isEmpty()) continue;
            codes.computeIfAbsent(sid, k -> new HashSet<>()).add(code);
        }
        return codes;
    }
}
