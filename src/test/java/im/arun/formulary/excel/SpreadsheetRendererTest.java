package im.arun.formulary.excel;

import im.arun.formulary.exception.RenderingException;
import im.arun.formulary.model.Category;
import im.arun.formulary.model.SubCategory;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadsheetRendererTest {

    @TempDir
    Path tempDir;

    private final SpreadsheetRenderer renderer = new SpreadsheetRenderer();

    @Test
    void writesOneSheetPerCategoryWithSubCategoryBlocks() throws IOException {
        Category antibiotics = new Category("Antibiotics");
        SubCategory penicillins = new SubCategory("Penicillins");
        penicillins.getRows().add(row("Drug Name", "Amoxicillin", "Tier", "1"));
        penicillins.getRows().add(row("Drug Name", "Penicillin VK", "Tier", "2", "Notes", "PA"));
        antibiotics.getSubCategories().add(penicillins);
        antibiotics.getSubCategories().add(new SubCategory("Macrolides"));

        Path output = renderer.render(List.of(antibiotics, new Category("Antivirals")), tempDir.resolve("book.xlsx"));

        try (Workbook workbook = open(output)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(2);
            Sheet sheet = workbook.getSheet("Antibiotics");
            assertThat(text(sheet, 0, 0)).isEqualTo("Antibiotics");
            assertThat(text(sheet, 2, 0)).isEqualTo("Penicillins");
            assertThat(text(sheet, 3, 0)).isEqualTo("Drug Name");
            assertThat(text(sheet, 3, 1)).isEqualTo("Tier");
            assertThat(text(sheet, 3, 2)).isEqualTo("Notes");
            assertThat(sheet.getRow(3).getCell(0).getCellStyle().getFillForegroundColor()).isNotZero();
            assertThat(text(sheet, 4, 0)).isEqualTo("Amoxicillin");
            assertThat(text(sheet, 4, 2)).isEmpty();
            assertThat(text(sheet, 5, 2)).isEqualTo("PA");
            assertThat(text(sheet, 7, 0)).isEqualTo("Macrolides");
            assertThat(workbook.getSheetAt(1).getSheetName()).isEqualTo("Antivirals");
        }
    }

    @Test
    void emptyDocumentStillProducesAWorkbook() throws IOException {
        Path output = renderer.render(List.of(), tempDir.resolve("empty.xlsx"));

        try (Workbook workbook = open(output)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(1);
            assertThat(workbook.getSheetName(0)).isEqualTo(SpreadsheetRenderer.EMPTY_SHEET_NAME);
        }
    }

    @Test
    void sheetNamesAreSafeAndUnique() {
        Set<String> used = new HashSet<>();

        String first = SpreadsheetRenderer.uniqueSheetName("Anti-infectives: Antibiotics/Antivirals [Systemic]", used);
        String second = SpreadsheetRenderer.uniqueSheetName("Anti-infectives: Antibiotics/Antivirals [Systemic]", used);
        String third = SpreadsheetRenderer.uniqueSheetName("antibiotics", used);
        String fourth = SpreadsheetRenderer.uniqueSheetName("ANTIBIOTICS", used);

        assertThat(first).hasSizeLessThanOrEqualTo(31).doesNotContain(":", "/", "[", "]");
        assertThat(second).isNotEqualTo(first).endsWith(" (2)").hasSizeLessThanOrEqualTo(31);
        assertThat(third).isEqualTo("antibiotics");
        assertThat(fourth).isEqualTo("ANTIBIOTICS (2)");
    }

    @Test
    void raggedRowsKeepEveryColumnInFirstSeenOrder() {
        SubCategory subCategory = new SubCategory("Penicillins");
        subCategory.getRows().add(row("Drug Name", "Amoxicillin", "Tier", "1"));
        subCategory.getRows().add(row("Drug Name", "Ampicillin", "Limits", "QL"));

        assertThat(SpreadsheetRenderer.columnsOf(subCategory)).containsExactly("Drug Name", "Tier", "Limits");
    }

    @Test
    void unwritableTargetRaisesRenderingException() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");

        assertThatThrownBy(() -> renderer.render(List.of(new Category("Antibiotics")), blocker.resolve("book.xlsx")))
            .isInstanceOf(RenderingException.class);
    }

    private static Map<String, String> row(String... keyValues) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put(keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static Workbook open(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return new XSSFWorkbook(in);
        }
    }

    private static String text(Sheet sheet, int row, int column) {
        Row r = sheet.getRow(row);
        return r.getCell(column).getStringCellValue();
    }
}
