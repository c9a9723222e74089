package com.example.CommonSupplier.logic;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the pairs typed into the upload form before the merge is started: 10-digit IDs that
 * exist in the BUT000 Source_ID column, and no ID on both sides.
 */
public final class MergePairValidator {

    public static final int ID_LENGTH = 10;

    private MergePairValidator() {
    }

    public static List<String> validate(List<MergePair> pairs, Map<String, SheetTable> sheets) {
        SheetTable general = sheets.get(SheetNames.GENERAL);
        if (general == null) {
            throw new MissingSheetException(SheetNames.GENERAL);
        }
        return validate(pairs, sourceIds(HeaderNormalizer.cleanHeaders(general)));
    }

    public static List<String> validate(List<MergePair> pairs, Set<String> knownSourceIds) {
        List<String> errors = new ArrayList<>();
        if (pairs.isEmpty()) {
            errors.add("At least one parent-child pair is required.");
            return errors;
        }

        for (int i = 0; i < pairs.size(); i++) {
            MergePair pair = pairs.get(i);
            if (!isWellFormed(pair.getParentId())) {
                errors.add("Pair #" + (i + 1) + ": Parent ID '" + pair.getParentId() + "' must be exactly 10 digits.");
            }
            if (!isWellFormed(pair.getChildId())) {
                errors.add("Pair #" + (i + 1) + ": Child ID '" + pair.getChildId() + "' must be exactly 10 digits.");
            }
        }

        for (int i = 0; i < pairs.size(); i++) {
            MergePair pair = pairs.get(i);
            if (!knownSourceIds.contains(pair.getParentId())) {
                errors.add("Pair #" + (i + 1) + ": Parent ID '" + pair.getParentId() + "' not found in Source_ID column.");
            }
            if (!knownSourceIds.contains(pair.getChildId())) {
                errors.add("Pair #" + (i + 1) + ": Child ID '" + pair.getChildId() + "' not found in Source_ID column.");
            }
        }

        try {
            ExplicitPairClassifier.checkUnambiguous(pairs);
        } catch (AmbiguousMergePairException e) {
            errors.addAll(e.getProblems());
        }
        return errors;
    }

    static boolean isWellFormed(String id) {
        if (id == null || id.length() != ID_LENGTH) return false;
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    public static Set<String> sourceIds(SheetTable general) {
        String sourceCol = ColumnResolver.findColumn(general, SheetNames.SOURCE_ID);
        Set<String> ids = new LinkedHashSet<>();
        for (int r = 0; r < general.rowCount(); r++) {
            String sid = general.get(r, sourceCol).trim();
            if (!sid.isEmpty()) ids.add(sid);
        }
        return ids;
    }
}
