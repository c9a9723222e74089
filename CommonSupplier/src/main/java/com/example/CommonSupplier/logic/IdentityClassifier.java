package com.example.CommonSupplier.logic;

/**
 * Decides which supplier IDs are parents and which are children folded into them.
 */
public interface IdentityClassifier {

    ClassificationMode getMode();

    /**
     * @param generalSheet the header-normalized {@code BUT000 - General} sheet
     */
    SupplierRegistry classify(SheetTable generalSheet);
}
