package com.example.CommonSupplier.logic;

import com.example.CommonSupplier.support.TestSheets;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.CommonSupplier.support.TestSheets.CHILD;
import static com.example.CommonSupplier.support.TestSheets.PARENT;
import static com.example.CommonSupplier.support.TestSheets.row;
import static com.example.CommonSupplier.support.TestSheets.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommonSupplierLogicTest {

    private static IdentityClassifier pairs() {
        return new ExplicitPairClassifier(List.of(new MergePair(PARENT, CHILD)));
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        void mergesChildAcrossAllSheets() {
            Map<String, SheetTable> sheets = TestSheets.preFile();

            MergeResult result = CommonSupplierLogic.merge(sheets, pairs());

            String common = "COMMON SUPPLIER " + PARENT;
            assertThat(result.getSheet(SheetNames.GENERAL).get(1, "NAME_ORG1")).isEqualTo(common);
            assertThat(result.getSheet(SheetNames.ADDRESS).get(1, "Name1")).isEqualTo(common);
            assertThat(result.getSheet(SheetNames.SUPPLIER_GENERAL).get(1, "NAME1")).isEqualTo(common);
            assertThat(result.getSheet(SheetNames.COMPANY_CODE).getRow(1)).containsExactly(PARENT, "2000", "160000", "I");

            SheetTable purchasing = result.getSheet(SheetNames.PURCHASING_ORG);
            assertThat(purchasing.getRow(1)).containsExactly(CHILD, "P100", "LKR", "");
            assertThat(purchasing.getRow(2)).containsExactly(PARENT, "P200", "USD", "I");

            SheetTable partners = result.getSheet(SheetNames.PARTNER_FUNCTION);
            assertThat(partners.get(0, "DEFPA")).isEqualTo("X");
            assertThat(partners.get(1, "Source_ID")).isEqualTo(PARENT);
            assertThat(partners.get(1, "_ACTION_CODE")).isEqualTo("I");
        }

        @Test
        void roleSheetIsCountedButNotChanged() {
            Map<String, SheetTable> sheets = TestSheets.preFile();

            MergeResult result = CommonSupplierLogic.merge(sheets, pairs());

            assertThat(result.getRegistry().find(PARENT).get().getRole()).isEqualTo(SupplierRole.PO);
            assertThat(result.getRegistry().find(CHILD).get().getRole()).isEqualTo(SupplierRole.NPO);
            assertThat(result.getLedger().mutationsFor(SheetNames.ROLE)).isEmpty();
        }

        @Test
        void ledgerMatchesEveryChangedCell() {
            Map<String, SheetTable> original = TestSheets.preFile();
            Map<String, SheetTable> sheets = TestSheets.preFile();

            MergeResult result = CommonSupplierLogic.merge(sheets, pairs());

            List<CellMutation> changed = new ArrayList<>();
            for (SheetTable after : result.getSheets().values()) {
                SheetTable before = original.get(after.getSheetName());
                for (int r = 0; r < after.rowCount(); r++) {
                    for (String column : after.getHeaders()) {
                        String old = before.hasColumn(column) ? before.get(r, column) : "";
                        if (!old.trim().equals(after.get(r, column).trim())) {
                            changed.add(new CellMutation(after.getSheetName(), r, column));
                        }
                    }
                }
            }
            assertThat(result.getLedger().getMutations()).containsExactlyInAnyOrderElementsOf(changed);
        }

        @Test
        void optionalSheetsMayBeAbsent() {
            Map<String, SheetTable> sheets = TestSheets.preFile();
            sheets.remove(SheetNames.PURCHASING_ORG);
            sheets.remove(SheetNames.PARTNER_FUNCTION);

            MergeResult result = CommonSupplierLogic.merge(sheets, pairs());

            assertThat(result.getSheets()).doesNotContainKey(SheetNames.PURCHASING_ORG);
            assertThat(result.getLedger().changedColumns(SheetNames.COMPANY_CODE)).contains("_ACTION_CODE");
        }

        @Test
        void missingRequiredSheetAbortsBeforeAnyChange() {
            Map<String, SheetTable> sheets = TestSheets.preFile();
            sheets.remove(SheetNames.COMPANY_CODE);

            assertThatThrownBy(() -> CommonSupplierLogic.merge(sheets, pairs()))
                    .isInstanceOf(MissingSheetException.class)
                    .hasMessage("Missing required sheet: " + SheetNames.COMPANY_CODE);
            assertThat(sheets.get(SheetNames.GENERAL).get(1, "NAME_ORG1")).isEqualTo("Acme Limited");
        }

        @Test
        void ambiguousPairsAbortBeforeAnyChange() {
            Map<String, SheetTable> sheets = TestSheets.preFile();
            IdentityClassifier classifier = new ExplicitPairClassifier(List.of(
                    new MergePair(PARENT, CHILD), new MergePair(CHILD, "1000000005")));

            assertThatThrownBy(() -> CommonSupplierLogic.merge(sheets, classifier))
                    .isInstanceOf(AmbiguousMergePairException.class);
            assertThat(sheets.get(SheetNames.GENERAL).get(1, "NAME_ORG1")).isEqualTo("Acme Limited");
        }

        @Test
        void positionalModeUsesFirstMarkedParent() {
            Map<String, SheetTable> sheets = TestSheets.preFile();
            sheets.put(SheetNames.GENERAL, TestSheets.general(List.of(
                    TestSheets.generalRow("1003000001", "Parent"),
                    TestSheets.generalRow(CHILD, "Child"))));
            sheets.put(SheetNames.COMPANY_CODE, table(SheetNames.COMPANY_CODE, List.of("Source_ID", "BUKRS"), List.of(
                    row("1003000001", "1000"),
                    row(CHILD, "2000"),
                    row(CHILD, "1000"))));

            MergeResult result = CommonSupplierLogic.merge(sheets, new PositionalClassifier());

            SheetTable general = result.getSheet(SheetNames.GENERAL);
            assertThat(general.get(1, "NAME_ORG1")).isEqualTo("COMMON SUPPLIER 1003000001");
            // no report flags for non-children in this mode
            assertThat(general.get(0, "ZGSTS_CMT_REP_FLG")).isEmpty();
            SheetTable codes = result.getSheet(SheetNames.COMPANY_CODE);
            assertThat(codes.getRow(1)).containsExactly("1003000001", "2000", "I");
            assertThat(codes.getRow(2)).containsExactly(CHILD, "1000", "");
        }

        @Test
        void headersAreNormalizedBeforeLookup() {
            Map<String, SheetTable> sheets = TestSheets.preFile();
            sheets.put(SheetNames.SUPPLIER_GENERAL, table(SheetNames.SUPPLIER_GENERAL,
                    List.of(" Source_ID", "NAME1 ", "LOEVM"), List.of(row(CHILD, "Acme Limited", ""))));

            MergeResult result = CommonSupplierLogic.merge(sheets, pairs());

            SheetTable lfa1 = result.getSheet(SheetNames.SUPPLIER_GENERAL);
            assertThat(lfa1.getHeaders()).containsExactly("Source_ID", "NAME1", "LOEVM");
            assertThat(lfa1.getRow(0)).containsExactly(CHILD, "COMMON SUPPLIER " + PARENT, "X");
        }
    }

    @Nested
    @DisplayName("generateUploadFile")
    class GenerateUploadFile {

        @Test
        void producesReadableWorkbookFromBytes() throws Exception {
            byte[] preFile = TestSheets.toWorkbook(TestSheets.preFile());

            byte[] upload = CommonSupplierLogic.generateUploadFile(preFile, "pre.xlsx", pairs(), new PoiUploadFilePresenter());

            try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(upload))) {
                assertThat(workbook.getNumberOfSheets()).isEqualTo(7);
                assertThat(workbook.getSheet(SheetNames.COMPANY_CODE).getRow(3).getCell(3).getStringCellValue())
                        .isEqualTo("I");
            }
        }

        @Test
        void blankRowsBetweenSuppliersKeepTheirPlace() throws Exception {
            Map<String, SheetTable> sheets = TestSheets.preFile();
            sheets.put(SheetNames.GENERAL, TestSheets.general(List.of(
                    TestSheets.generalRow(PARENT, "Acme Ltd"),
                    row("", "", "", "", "", "", "", "", "", ""),
                    TestSheets.generalRow(CHILD, "Acme Limited"))));
            sheets.put(SheetNames.SUPPLIER_GENERAL, table(SheetNames.SUPPLIER_GENERAL,
                    List.of("Source_ID", "NAME1", "NAME2", "NAME3", "NAME4", "LOEVM", "SPERR", "SPERM"), List.of(
                            row(PARENT, "Acme Ltd", "", "", "", "", "", ""),
                            row("", "", "", "", "", "", "", ""),
                            row(CHILD, "Acme Limited", "Branch", "", "", "", "", ""))));

            byte[] upload = CommonSupplierLogic.generateUploadFile(
                    TestSheets.toWorkbook(sheets), "pre.xlsx", pairs(), new PoiUploadFilePresenter());

            try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(upload))) {
                for (String name : List.of(SheetNames.GENERAL, SheetNames.SUPPLIER_GENERAL)) {
                    XSSFRow gap = workbook.getSheet(name).getRow(3);
                    assertThat(gap == null || gap.getPhysicalNumberOfCells() == 0)
                            .as("gap row in %s", name)
                            .isTrue();
                    assertThat(workbook.getSheet(name).getRow(4).getCell(0).getStringCellValue())
                            .as("child row in %s", name)
                            .isEqualTo(CHILD);
                    assertThat(workbook.getSheet(name).getRow(4).getCell(1).getStringCellValue())
                            .isEqualTo("COMMON SUPPLIER " + PARENT);
                }
            }
        }

        @Test
        void writesOutputFile(@TempDir Path dir) throws Exception {
            File input = dir.resolve("pre.xlsx").toFile();
            File output = dir.resolve("UploadFile.xlsx").toFile();
            Files.write(input.toPath(), TestSheets.toWorkbook(TestSheets.preFile()));

            CommonSupplierLogic.generateUploadFile(input, output, pairs(), new PoiUploadFilePresenter());

            assertThat(output).exists();
            try (XSSFWorkbook workbook = new XSSFWorkbook(Files.newInputStream(output.toPath()))) {
                assertThat(workbook.getSheet(SheetNames.GENERAL).getRow(3).getCell(1).getStringCellValue())
                        .isEqualTo("COMMON SUPPLIER " + PARENT);
            }
        }

        @Test
        void noOutputWhenMergeFails(@TempDir Path dir) throws Exception {
            Map<String, SheetTable> sheets = TestSheets.preFile();
            sheets.remove(SheetNames.ROLE);
            File input = dir.resolve("pre.xlsx").toFile();
            File output = dir.resolve("UploadFile.xlsx").toFile();
            Files.write(input.toPath(), TestSheets.toWorkbook(sheets));

            assertThatThrownBy(() -> CommonSupplierLogic.generateUploadFile(input, output, pairs(), new PoiUploadFilePresenter()))
                    .isInstanceOf(MissingSheetException.class);
            assertThat(output).doesNotExist();
        }

        @Test
        void unreadableInputNamesFileAndPhase() {
            assertThatThrownBy(() -> CommonSupplierLogic.generateUploadFile(
                    "not a workbook".getBytes(), "broken.xlsx", pairs(), new PoiUploadFilePresenter()))
                    .isInstanceOf(CommonSupplierException.class)
                    .hasMessageContaining("broken.xlsx");
        }
    }
}
