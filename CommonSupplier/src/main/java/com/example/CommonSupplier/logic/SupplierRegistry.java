package com.example.CommonSupplier.logic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-run view of who is merged into whom: the classified supplier IDs and the child-to-parent map.
 * Built once by an {@link IdentityClassifier} and handed to every sheet mutator.
 */
public final class SupplierRegistry {

    public static final String PLACEHOLDER_PARENT_ID = "0000000000";

    private final ClassificationMode mode;
    private final Map<String, SupplierRecord> records;
    private final Map<String, String> identityMap;

    public SupplierRegistry(ClassificationMode mode,
                            Map<String, SupplierRecord> records,
                            Map<String, String> identityMap) {
        this.mode = mode;
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.identityMap = Collections.unmodifiableMap(new LinkedHashMap<>(identityMap));
    }

    public ClassificationMode getMode() {
        return mode;
    }

    public Map<String, SupplierRecord> getRecords() {
        return records;
    }

    public Map<String, String> getIdentityMap() {
        return identityMap;
    }

    public Optional<SupplierRecord> find(String sourceId) {
        if (sourceId == null) return Optional.empty();
        return Optional.ofNullable(records.get(sourceId.trim()));
    }

    public boolean isChild(String sourceId) {
        return find(sourceId).map(SupplierRecord::isChild).orElse(false);
    }

    /**
     * Parent the given child is merged into, or {@link #PLACEHOLDER_PARENT_ID} when it has none.
     */
    public String parentOf(String childId) {
        if (childId == null) return PLACEHOLDER_PARENT_ID;
        return identityMap.getOrDefault(childId.trim(), PLACEHOLDER_PARENT_ID);
    }

    SupplierRegistry withRoles(Function<String, SupplierRole> roleLookup) {
        Map<String, SupplierRecord> annotated = new LinkedHashMap<>();
        for (Map.Entry<String, SupplierRecord> e : records.entrySet()) {
            annotated.put(e.getKey(), e.getValue().withRole(roleLookup.apply(e.getKey())));
        }
        return new SupplierRegistry(mode, annotated, identityMap);
    }

    @Override
    public String toString() {
        return "SupplierRegistry{" + mode + ", " + records.size() + " IDs, " + identityMap.size() + " merges}";
    }
}
