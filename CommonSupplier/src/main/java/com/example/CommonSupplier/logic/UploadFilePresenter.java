package com.example.CommonSupplier.logic;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;

/**
 * Turns the merged sheets into the upload workbook. All highlighting and visibility rules
 * live behind this interface, the merge itself never touches a workbook.
 */
public interface UploadFilePresenter {

    void write(Collection<SheetTable> sheets, MutationLedger ledger, OutputStream out) throws IOException;
}
