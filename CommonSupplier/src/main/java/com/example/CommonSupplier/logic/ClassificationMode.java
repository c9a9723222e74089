package com.example.CommonSupplier.logic;

public enum ClassificationMode {
    /** Parent-child pairs supplied by the user, any number of merge groups. */
    EXPLICIT_PAIRS,
    /** 4th character '3' marks the parent; a single merge target per run. */
    POSITIONAL
}
