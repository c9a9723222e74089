package com.example.CommonSupplier.logic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every cell the merge changed, recorded once per cell. Drives the highlighting of the upload file.
 */
public class MutationLedger {

    private final Set<CellMutation> mutations = new LinkedHashSet<>();

    /**
     * Writes {@code newValue} into the cell and records it when the trimmed value actually changes.
     * Columns the table does not have are skipped.
     *
     * @return true when the cell was changed
     */
    public boolean update(SheetTable table, int rowIndex, String column, String newValue) {
        if (!table.hasColumn(column)) return false;

        String oldValue = table.get(rowIndex, column);
        String value = newValue == null ? "" : newValue;
        if (oldValue.trim().equals(value.trim())) return false;

        table.set(rowIndex, column, value);
        record(table.getSheetName(), rowIndex, column);
        return true;
    }

    public boolean record(String sheetName, int rowIndex, String column) {
        return mutations.add(new CellMutation(sheetName, rowIndex, column));
    }

    public boolean contains(String sheetName, int rowIndex, String column) {
        return mutations.contains(new CellMutation(sheetName, rowIndex, column));
    }

    public Set<CellMutation> getMutations() {
        return Collections.unmodifiableSet(mutations);
    }

    public Set<CellMutation> mutationsFor(String sheetName) {
        return mutations.stream()
                .filter(m -> m.getSheetName().equals(sheetName))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> changedColumns(String sheetName) {
        return mutations.stream()
                .filter(m -> m.getSheetName().equals(sheetName))
                .map(CellMutation::getColumn)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return mutations.size();
    }

    public boolean isEmpty() {
        return mutations.isEmpty();
    }
}
