package com.example.CommonSupplier.logic;

import java.util.List;

/**
 * BUT000: child partners lose their secondary names and report flags and are marked for deletion.
 * With explicit pairs every other partner gets the CMT and ATL report flags.
 */
public class GeneralSheetMutator extends ChildRowSheetMutator {

    static final List<String> CLEAR = List.of(
            "NAME_ORG2", "NAME_ORG3", "NAME_ORG4",
            "MC_NAME2", "MC_NAME3", "MC_NAME4",
            "ZGSTS_SLP_REP_FLG", "ZGSTS_CMT_REP_FLG", "ZGSTS_ATL_REP_FLG"
    );
    static final List<String> FILL = List.of("ZGSTS_AVN_REP_FLG", "XDELE");
    static final List<String> NAMES = List.of("MC_NAME1", "NAME_ORG1");
    static final List<String> NON_CHILD_REPORT_FLAGS = List.of("ZGSTS_CMT_REP_FLG", "ZGSTS_ATL_REP_FLG");

    public GeneralSheetMutator() {
        super(SheetNames.GENERAL, CLEAR, FILL);
    }

    @Override
    protected List<String> nameColumns(SheetTable table) {
        return NAMES;
    }

    @Override
    protected void applyToOtherRow(SheetTable table, int rowIndex, SupplierRegistry registry, MutationLedger ledger) {
        if (registry.getMode() != ClassificationMode.EXPLICIT_PAIRS) return;
        for (String col : NON_CHILD_REPORT_FLAGS) {
            ledger.update(table, rowIndex, col, FLAG);
        }
    }
}
