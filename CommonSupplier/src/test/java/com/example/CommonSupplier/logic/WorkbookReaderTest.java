package com.example.CommonSupplier.logic;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkbookReaderTest {

    @Test
    void readsPreambleHeaderAndTextCells() throws Exception {
        byte[] content;
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(SheetNames.COMPANY_CODE);
            sheet.createRow(0).createCell(0).setCellValue("Company Code Data (Supplier)");
            Row header = sheet.createRow(1);
            header.createCell(0).setCellValue("Source_ID");
            header.createCell(1).setCellValue("BUKRS");
            header.createCell(2).setCellValue("ZTERM");
            Row data = sheet.createRow(2);
            data.createCell(0).setCellValue("0000123456");
            data.createCell(1).setCellValue(1000);
            // row 4 left blank between data rows, row 6 blank at the end
            Row last = sheet.createRow(4);
            last.createCell(0).setCellValue("0000654321");
            last.createCell(3).setCellValue("overflow");
            sheet.createRow(5).createCell(0).setCellValue("   ");
            workbook.createSheet("Notes");
            workbook.write(out);
            content = out.toByteArray();
        }

        Map<String, SheetTable> sheets = WorkbookReader.read(content, "pre.xlsx");

        assertThat(sheets).containsOnlyKeys(SheetNames.COMPANY_CODE, "Notes");
        SheetTable table = sheets.get(SheetNames.COMPANY_CODE);
        assertThat(table.getPreamble()).containsExactly("Company Code Data (Supplier)");
        assertThat(table.getHeaders()).containsExactly("Source_ID", "BUKRS", "ZTERM", "");
        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.getRow(0)).containsExactly("0000123456", "1000", "", "");
        assertThat(table.getRow(1)).containsExactly("", "", "", "");
        assertThat(table.getRow(2)).containsExactly("0000654321", "", "", "overflow");

        SheetTable empty = sheets.get("Notes");
        assertThat(empty.getHeaders()).isEmpty();
        assertThat(empty.rowCount()).isZero();
    }

    @Test
    void brokenFileIsReportedAsReadFailure() {
        assertThatThrownBy(() -> WorkbookReader.read(new byte[]{1, 2, 3}, "broken.xlsx"))
                .isInstanceOf(WorkbookProcessingException.class)
                .satisfies(e -> {
                    WorkbookProcessingException ex = (WorkbookProcessingException) e;
                    assertThat(ex.getFileLabel()).isEqualTo("broken.xlsx");
                    assertThat(ex.getPhase()).isEqualTo(WorkbookProcessingException.Phase.READ);
                });
    }
}
