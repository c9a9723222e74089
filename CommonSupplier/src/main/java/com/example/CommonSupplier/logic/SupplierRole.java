package com.example.CommonSupplier.logic;

/**
 * PO when the ID occurs more than once in the role sheet (several partner roles), NPO otherwise.
 */
public enum SupplierRole {
    PO,
    NPO
}
