package com.example.CommonSupplier.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Tags each registered ID as PO or NPO by how often it appears in the role sheet.
 * Informational only, no mutation rule reads it.
 */
public final class RoleAnnotator {

    private static final Logger log = LoggerFactory.getLogger(RoleAnnotator.class);

    private RoleAnnotator() {
    }

    public static SupplierRegistry annotate(SupplierRegistry registry, SheetTable roleSheet) {
        String sourceCol = ColumnResolver.findColumn(roleSheet, SheetNames.SOURCE_ID);
        Map<String, Integer> counts = countOccurrences(roleSheet, sourceCol);

        SupplierRegistry annotated = registry.withRoles(
                sid -> counts.getOrDefault(sid, 0) > 1 ? SupplierRole.PO : SupplierRole.NPO);
        log.info("Source_ID attributes and roles assigned");
        return annotated;
    }

    static Map<String, Integer> countOccurrences(SheetTable table, String column) {
        Map<String, Integer> counts = new HashMap<>();
        for (int r = 0; r < table.rowCount(); r++) {
            String value = table.get(r, column).trim();
            if (!value.isEmpty()) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        return counts;
    }
}
