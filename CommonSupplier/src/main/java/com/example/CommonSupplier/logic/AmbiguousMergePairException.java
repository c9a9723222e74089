package com.example.CommonSupplier.logic;

import java.util.List;

/**
 * Raised when the parent-child pairs cannot be turned into a single child-to-parent map,
 * e.g. an ID that is a parent in one pair and a child in another.
 */
public class AmbiguousMergePairException extends CommonSupplierException {

    private final List<String> problems;

    public AmbiguousMergePairException(List<String> problems) {
        super("Ambiguous parent-child pairs: " + String.join(" ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
