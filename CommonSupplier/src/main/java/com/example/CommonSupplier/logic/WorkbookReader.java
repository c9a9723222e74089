package com.example.CommonSupplier.logic;

import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads every sheet of a pre-file as text. Row 1 is kept as the preamble, row 2 is the header.
 * Blank rows between data rows are kept as empty rows.
 */
public final class WorkbookReader {

    private static final Logger log = LoggerFactory.getLogger(WorkbookReader.class);

    static final int PREAMBLE_ROW = 0;
    static final int HEADER_ROW = 1;
    static final int FIRST_DATA_ROW = 2;

    static {
        // Fiori extracts of large vendor bases exceed POI's default record size
        IOUtils.setByteArrayMaxOverride(150_000_000);
    }

    private WorkbookReader() {
    }

    public static Map<String, SheetTable> read(byte[] content, String fileLabel) {
        try (InputStream in = new ByteArrayInputStream(content)) {
            return read(in, fileLabel);
        } catch (IOException e) {
            throw new WorkbookProcessingException(fileLabel, WorkbookProcessingException.Phase.READ, e);
        }
    }

    public static Map<String, SheetTable> read(InputStream in, String fileLabel) {
        log.info("Loading {} (header at row 2, keeping all text)...", fileLabel);
        Map<String, SheetTable> sheets = new LinkedHashMap<>();
        DataFormatter formatter = new DataFormatter();

        try (Workbook workbook = new XSSFWorkbook(in)) {
            for (Sheet sheet : workbook) {
                SheetTable table = new SheetTable(
                        sheet.getSheetName(),
                        rowValues(sheet.getRow(PREAMBLE_ROW), formatter),
                        rowValues(sheet.getRow(HEADER_ROW), formatter));

                // gaps stay in place so the upload file lines up with the pre-file, trailing blanks go
                int pendingBlanks = 0;
                for (int r = FIRST_DATA_ROW; r <= sheet.getLastRowNum(); r++) {
                    List<String> values = rowValues(sheet.getRow(r), formatter);
                    if (isBlank(values)) {
                        pendingBlanks++;
                        continue;
                    }
                    for (; pendingBlanks > 0; pendingBlanks--) {
                        table.addRow(new ArrayList<>());
                    }
                    table.addRow(values);
                }
                sheets.put(sheet.getSheetName(), table);
                log.debug("Read {}", table);
            }
        } catch (IOException | UnsupportedFileFormatException | POIXMLException e) {
            throw new WorkbookProcessingException(fileLabel, WorkbookProcessingException.Phase.READ, e);
        }
        return sheets;
    }

    private static List<String> rowValues(Row row, DataFormatter formatter) {
        List<String> values = new ArrayList<>();
        if (row == null || row.getLastCellNum() < 0) return values;

        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            values.add(cell == null ? "" : formatter.formatCellValue(cell));
        }
        return values;
    }

    private static boolean isBlank(List<String> values) {
        for (String value : values) {
            if (!value.trim().isEmpty()) return false;
        }
        return true;
    }
}
