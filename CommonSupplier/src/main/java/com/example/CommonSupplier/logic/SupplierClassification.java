package com.example.CommonSupplier.logic;

public enum SupplierClassification {
    PARENT,
    CHILD
}
