package com.example.CommonSupplier.logic;

import java.util.Objects;

public final class MergePair {

    private final String parentId;
    private final String childId;

    public MergePair(String parentId, String childId) {
        this.parentId = parentId == null ? "" : parentId.trim();
        this.childId = childId == null ? "" : childId.trim();
    }

    public String getParentId() {
        return parentId;
    }

    public String getChildId() {
        return childId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergePair)) return false;
        MergePair other = (MergePair) o;
        return parentId.equals(other.parentId) && childId.equals(other.childId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentId, childId);
    }

    @Override
    public String toString() {
        return parentId + " <- " + childId;
    }
}
