package com.example.CommonSupplier.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Legacy single-target mode: an ID whose 4th character is '3' is a parent, every other ID
 * of the general sheet is a child of the first parent found.
 */
public class PositionalClassifier implements IdentityClassifier {

    private static final Logger log = LoggerFactory.getLogger(PositionalClassifier.class);

    static final int MARKER_POSITION = 3;
    static final char PARENT_MARKER = '3';

    @Override
    public ClassificationMode getMode() {
        return ClassificationMode.POSITIONAL;
    }

    @Override
    public SupplierRegistry classify(SheetTable generalSheet) {
        String sourceCol = ColumnResolver.findColumn(generalSheet, SheetNames.SOURCE_ID);

        Map<String, SupplierRecord> records = new LinkedHashMap<>();
        String referenceParent = null;
        for (int r = 0; r < generalSheet.rowCount(); r++) {
            String sid = generalSheet.get(r, sourceCol).trim();
            if (sid.isEmpty()) continue;

            SupplierClassification type = isParentId(sid) ? SupplierClassification.PARENT : SupplierClassification.CHILD;
            records.put(sid, new SupplierRecord(sid, type, null));
            if (type == SupplierClassification.PARENT && referenceParent == null) {
                referenceParent = sid;
            }
        }

        if (referenceParent == null) {
            log.warn("No parent ID (4th character '3') in {}, children map to {}",
                    generalSheet.getSheetName(), SupplierRegistry.PLACEHOLDER_PARENT_ID);
            referenceParent = SupplierRegistry.PLACEHOLDER_PARENT_ID;
        }

        Map<String, String> identityMap = new LinkedHashMap<>();
        for (SupplierRecord record : records.values()) {
            if (record.isChild()) {
                identityMap.put(record.getSourceId(), referenceParent);
            }
        }

        log.info("Reference parent ID: {} ({} children)", referenceParent, identityMap.size());
        return new SupplierRegistry(getMode(), records, identityMap);
    }

    static boolean isParentId(String sourceId) {
        return sourceId.length() > MARKER_POSITION && sourceId.charAt(MARKER_POSITION) == PARENT_MARKER;
    }
}
