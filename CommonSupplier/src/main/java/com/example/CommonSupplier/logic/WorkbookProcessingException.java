package com.example.CommonSupplier.logic;

/**
 * I/O failure while reading the pre-file or writing the upload file.
 */
public class WorkbookProcessingException extends CommonSupplierException {

    public enum Phase {
        READ, WRITE
    }

    private final String fileLabel;
    private final Phase phase;

    public WorkbookProcessingException(String fileLabel, Phase phase, Exception cause) {
        super(describe(fileLabel, phase) + ": " + cause.getMessage(), cause);
        this.fileLabel = fileLabel;
        this.phase = phase;
    }

    private static String describe(String fileLabel, Phase phase) {
        return phase == Phase.READ
                ? "Failed to read workbook '" + fileLabel + "'"
                : "Failed to write workbook '" + fileLabel + "'. Please close it if it's open";
    }

    public String getFileLabel() {
        return fileLabel;
    }

    public Phase getPhase() {
        return phase;
    }
}
