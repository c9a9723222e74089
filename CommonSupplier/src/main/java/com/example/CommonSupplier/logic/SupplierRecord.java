package com.example.CommonSupplier.logic;

import java.util.Objects;

public final class SupplierRecord {

    private final String sourceId;
    private final SupplierClassification classification;
    private final SupplierRole role;

    public SupplierRecord(String sourceId, SupplierClassification classification, SupplierRole role) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.classification = Objects.requireNonNull(classification, "classification");
        this.role = role;
    }

    public String getSourceId() {
        return sourceId;
    }

    public SupplierClassification getClassification() {
        return classification;
    }

    /** Null until the role sheet has been counted. */
    public SupplierRole getRole() {
        return role;
    }

    public boolean isChild() {
        return classification == SupplierClassification.CHILD;
    }

    SupplierRecord withRole(SupplierRole newRole) {
        return new SupplierRecord(sourceId, classification, newRole);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SupplierRecord)) return false;
        SupplierRecord other = (SupplierRecord) o;
        return sourceId.equals(other.sourceId)
                && classification == other.classification
                && role == other.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, classification, role);
    }

    @Override
    public String toString() {
        return sourceId + "[" + classification + (role == null ? "" : ", " + role) + "]";
    }
}
