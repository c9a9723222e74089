package com.example.CommonSupplier.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the registry from user supplied parent-child pairs. Several independent merge
 * groups can be handled in one run.
 */
public class ExplicitPairClassifier implements IdentityClassifier {

    private static final Logger log = LoggerFactory.getLogger(ExplicitPairClassifier.class);

    private final List<MergePair> pairs;

    public ExplicitPairClassifier(List<MergePair> pairs) {
        this.pairs = List.copyOf(pairs);
    }

    @Override
    public ClassificationMode getMode() {
        return ClassificationMode.EXPLICIT_PAIRS;
    }

    public List<MergePair> getPairs() {
        return pairs;
    }

    @Override
    public SupplierRegistry classify(SheetTable generalSheet) {
        checkUnambiguous(pairs);

        Map<String, String> identityMap = new LinkedHashMap<>();
        Map<String, SupplierRecord> records = new LinkedHashMap<>();
        for (MergePair pair : pairs) {
            identityMap.put(pair.getChildId(), pair.getParentId());
            records.put(pair.getParentId(), new SupplierRecord(pair.getParentId(), SupplierClassification.PARENT, null));
            records.put(pair.getChildId(), new SupplierRecord(pair.getChildId(), SupplierClassification.CHILD, null));
        }

        log.info("Parent-child mapping built: {} children into {} parents",
                identityMap.size(), new LinkedHashSet<>(identityMap.values()).size());
        return new SupplierRegistry(getMode(), records, identityMap);
    }

    /**
     * Rejects pair lists that do not describe a plain child-to-parent map.
     *
     * @throws AmbiguousMergePairException listing every offending pair
     */
    static void checkUnambiguous(List<MergePair> pairs) {
        Set<String> parents = new LinkedHashSet<>();
        Map<String, String> parentByChild = new LinkedHashMap<>();
        for (MergePair pair : pairs) {
            parents.add(pair.getParentId());
        }

        List<String> problems = new ArrayList<>();
        for (int i = 0; i < pairs.size(); i++) {
            MergePair pair = pairs.get(i);
            int n = i + 1;
            String child = pair.getChildId();
            if (child.equals(pair.getParentId())) {
                problems.add("Pair #" + n + ": ID '" + child + "' cannot be merged into itself.");
                continue;
            }
            if (parents.contains(child)) {
                problems.add("Pair #" + n + ": Child ID '" + child + "' is also used as a parent.");
            }
            String earlier = parentByChild.putIfAbsent(child, pair.getParentId());
            if (earlier != null && !earlier.equals(pair.getParentId())) {
                problems.add("Pair #" + n + ": Child ID '" + child + "' is already merged into '" + earlier + "'.");
            }
        }
        if (!problems.isEmpty()) {
            throw new AmbiguousMergePairException(problems);
        }
    }
}
