package com.example.CommonSupplier.logic;

/**
 * Base type of every failure raised while building the upload file.
 */
public class CommonSupplierException extends RuntimeException {

    public CommonSupplierException(String message) {
        super(message);
    }

    public CommonSupplierException(String message, Throwable cause) {
        super(message, cause);
    }
}
