package com.example.CommonSupplier.logic;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Writes the upload file with POI: preamble row, header row, data, then highlights the
 * changed cells and applies the sheet and column visibility rules.
 */
public class PoiUploadFilePresenter implements UploadFilePresenter {

    private static final Logger log = LoggerFactory.getLogger(PoiUploadFilePresenter.class);

    static final int PREAMBLE_ROW = 0;
    static final int HEADER_ROW = 1;
    static final int FIRST_DATA_ROW = 2;

    /** Sheets that only show the source ID and the columns the merge changed. */
    static final List<String> CHANGED_ONLY_SHEETS = List.of(SheetNames.GENERAL, SheetNames.ADDRESS);
    static final List<String> PARTNER_FUNCTION_AUDIT_COLUMNS = List.of("ERNAM", "ERDAT", "LIFN2", "LIFNR");

    private final UploadFileStyle style;

    public PoiUploadFilePresenter() {
        this(UploadFileStyle.defaults());
    }

    public PoiUploadFilePresenter(UploadFileStyle style) {
        this.style = style;
    }

    @Override
    public void write(Collection<SheetTable> sheets, MutationLedger ledger, OutputStream out) throws IOException {
        log.info("Saving results and applying highlights...");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFCellStyle highlightStyle = solidFill(workbook, style.getHighlightColor());
            XSSFCellStyle bannerStyle = bannerStyle(workbook, style.getBannerColor());

            for (SheetTable table : sheets) {
                XSSFSheet sheet = workbook.createSheet(table.getSheetName());
                writeTable(sheet, table);
                highlightChanges(sheet, table, ledger, highlightStyle);
                applyColumnVisibility(sheet, table, ledger);
                styleBanner(sheet, bannerStyle);
            }
            applySheetVisibility(workbook);

            workbook.write(out);
        }
    }

    private void writeTable(XSSFSheet sheet, SheetTable table) {
        writeRow(sheet.createRow(PREAMBLE_ROW), table.getPreamble());
        writeRow(sheet.createRow(HEADER_ROW), table.getHeaders());
        for (int r = 0; r < table.rowCount(); r++) {
            writeRow(sheet.createRow(FIRST_DATA_ROW + r), table.getRow(r));
        }
    }

    private void writeRow(Row row, List<String> values) {
        for (int c = 0; c < values.size(); c++) {
            String value = values.get(c);
            if (value == null || value.isEmpty()) continue;
            row.createCell(c).setCellValue(value);
        }
    }

    private void highlightChanges(XSSFSheet sheet, SheetTable table, MutationLedger ledger, XSSFCellStyle highlightStyle) {
        for (CellMutation mutation : ledger.mutationsFor(table.getSheetName())) {
            int col = table.columnIndex(mutation.getColumn());
            if (col < 0) continue;
            Row row = sheet.getRow(FIRST_DATA_ROW + mutation.getRowIndex());
            if (row == null) continue;
            Cell cell = row.getCell(col, Row.MissingCellPolicy.CREATE_NULL_AS_BLANK);
            cell.setCellStyle(highlightStyle);
        }
    }

    private void applyColumnVisibility(XSSFSheet sheet, SheetTable table, MutationLedger ledger) {
        String name = table.getSheetName();
        List<String> headers = table.getHeaders();

        if (CHANGED_ONLY_SHEETS.contains(name)) {
            Set<String> visible = new LinkedHashSet<>(ledger.changedColumns(name));
            for (String header : headers) {
                if (isSourceIdHeader(header)) visible.add(header.trim());
            }
            for (int c = 0; c < headers.size(); c++) {
                String header = headers.get(c);
                if (!header.isEmpty() && !visible.contains(header.trim())) {
                    sheet.setColumnHidden(c, true);
                }
            }
        } else if (SheetNames.PARTNER_FUNCTION.equals(name)) {
            for (int c = 0; c < headers.size(); c++) {
                if (PARTNER_FUNCTION_AUDIT_COLUMNS.contains(headers.get(c).trim().toUpperCase(Locale.ROOT))) {
                    sheet.setColumnHidden(c, true);
                }
            }
        } else {
            for (int c = 0; c < headers.size(); c++) {
                if (!headers.get(c).isEmpty()) sheet.setColumnHidden(c, false);
            }
        }
    }

    static boolean isSourceIdHeader(String header) {
        String lower = header.toLowerCase(Locale.ROOT);
        return lower.contains("source") && lower.contains("id");
    }

    /**
     * Hides every sheet outside the allow-list, and the role sheet. The first remaining sheet
     * becomes the active one since Excel refuses to open on a hidden tab.
     */
    private void applySheetVisibility(XSSFWorkbook workbook) {
        Set<String> shown = new LinkedHashSet<>(SheetNames.allowList());
        shown.remove(SheetNames.ROLE);

        List<Integer> hidden = new ArrayList<>();
        int firstVisible = -1;
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            if (shown.contains(workbook.getSheetName(i))) {
                if (firstVisible < 0) firstVisible = i;
            } else {
                hidden.add(i);
            }
        }
        if (firstVisible < 0) {
            log.warn("None of the upload sheets is present, leaving all sheets visible");
            return;
        }

        workbook.setActiveSheet(firstVisible);
        workbook.setFirstVisibleTab(firstVisible);
        for (int i : hidden) {
            workbook.getSheetAt(i).setSelected(false);
            workbook.setSheetHidden(i, true);
        }
    }

    private void styleBanner(XSSFSheet sheet, XSSFCellStyle bannerStyle) {
        int maxCol = 0;
        for (Row row : sheet) {
            maxCol = Math.max(maxCol, row.getLastCellNum());
        }
        for (int r = PREAMBLE_ROW; r <= HEADER_ROW; r++) {
            Row row = sheet.getRow(r);
            if (row == null) row = sheet.createRow(r);
            for (int c = 0; c < maxCol; c++) {
                row.getCell(c, Row.MissingCellPolicy.CREATE_NULL_AS_BLANK).setCellStyle(bannerStyle);
            }
        }
    }

    private static XSSFCellStyle solidFill(XSSFWorkbook workbook, String hexColor) {
        XSSFCellStyle cellStyle = workbook.createCellStyle();
        cellStyle.setFillForegroundColor(toColor(hexColor));
        cellStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return cellStyle;
    }

    private static XSSFCellStyle bannerStyle(XSSFWorkbook workbook, String hexColor) {
        XSSFCellStyle cellStyle = solidFill(workbook, hexColor);
        short black = IndexedColors.BLACK.getIndex();
        cellStyle.setBorderTop(BorderStyle.THIN);
        cellStyle.setBorderBottom(BorderStyle.THIN);
        cellStyle.setBorderLeft(BorderStyle.THIN);
        cellStyle.setBorderRight(BorderStyle.THIN);
        cellStyle.setTopBorderColor(black);
        cellStyle.setBottomBorderColor(black);
        cellStyle.setLeftBorderColor(black);
        cellStyle.setRightBorderColor(black);
        return cellStyle;
    }

    static XSSFColor toColor(String hexColor) {
        String hex = hexColor.startsWith("#") ? hexColor : "#" + hexColor;
        return new XSSFColor(Color.decode(hex), null);
    }
}
