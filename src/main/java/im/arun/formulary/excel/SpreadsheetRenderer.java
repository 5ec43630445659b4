package im.arun.formulary.excel;

import im.arun.formulary.exception.RenderingException;
import im.arun.formulary.model.Category;
import im.arun.formulary.model.SubCategory;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lays the category tree out as an XLSX workbook: one sheet per category, a shaded
 * sub-header per subcategory followed by its column header and data rows.
 */
public class SpreadsheetRenderer {
    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetRenderer.class);

    static final String EMPTY_SHEET_NAME = "Formulary";
    private static final int MAX_SHEET_NAME_LENGTH = 31;
    private static final int MAX_COLUMN_WIDTH_CHARS = 60;

    /**
     * Render the categories into {@code outputPath}, replacing any existing file.
     *
     * @throws RenderingException when the workbook cannot be built or written
     */
    public Path render(List<Category> categories, Path outputPath) {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Styles styles = new Styles(workbook);

            if (categories == null || categories.isEmpty()) {
                Sheet sheet = workbook.createSheet(EMPTY_SHEET_NAME);
                setCell(sheet.createRow(0), 0, "No categories were extracted", styles.title);
            } else {
                Set<String> usedNames = new HashSet<>();
                for (Category category : categories) {
                    Sheet sheet = workbook.createSheet(uniqueSheetName(category.getName(), usedNames));
                    writeCategory(sheet, category, styles);
                }
            }

            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            try (OutputStream out = Files.newOutputStream(outputPath)) {
                workbook.write(out);
            }
            logger.info("Workbook written to {} ({} sheets)", outputPath, workbook.getNumberOfSheets());
            return outputPath;
        } catch (IOException | RuntimeException e) {
            throw new RenderingException("Failed to render workbook " + outputPath + ": " + e.getMessage(), e);
        }
    }

    private void writeCategory(Sheet sheet, Category category, Styles styles) {
        Map<Integer, Integer> widths = new HashMap<>();
        int rowIndex = 0;

        Row titleRow = sheet.createRow(rowIndex++);
        setCell(titleRow, 0, category.getName(), styles.title);
        sheet.createFreezePane(0, 1);

        for (SubCategory subCategory : category.getSubCategories()) {
            rowIndex++;
            List<String> columns = columnsOf(subCategory);

            Row subHeaderRow = sheet.createRow(rowIndex);
            setCell(subHeaderRow, 0, subCategory.getName(), styles.subHeader);
            for (int i = 1; i < columns.size(); i++) {
                setCell(subHeaderRow, i, "", styles.subHeader);
            }
            if (columns.size() > 1) {
                sheet.addMergedRegion(new CellRangeAddress(rowIndex, rowIndex, 0, columns.size() - 1));
            }
            rowIndex++;

            if (columns.isEmpty()) {
                continue;
            }

            Row headerRow = sheet.createRow(rowIndex++);
            for (int i = 0; i < columns.size(); i++) {
                setCell(headerRow, i, columns.get(i), styles.columnHeader);
                track(widths, i, columns.get(i));
            }

            for (Map<String, String> values : subCategory.getRows()) {
                Row dataRow = sheet.createRow(rowIndex++);
                for (int i = 0; i < columns.size(); i++) {
                    String value = values.getOrDefault(columns.get(i), "");
                    setCell(dataRow, i, value, styles.data);
                    track(widths, i, value);
                }
            }
        }

        widths.forEach((column, chars) ->
            sheet.setColumnWidth(column, Math.min(chars + 2, MAX_COLUMN_WIDTH_CHARS) * 256));
    }

    /**
     * Union of the row keys in first-seen order; ragged tables keep every column.
     */
    static List<String> columnsOf(SubCategory subCategory) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, String> row : subCategory.getRows()) {
            columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }

    static String uniqueSheetName(String name, Set<String> usedNames) {
        String base = name == null || name.isBlank() ? "Category" : WorkbookUtil.createSafeSheetName(name.trim());
        String candidate = base;
        int counter = 2;
        while (usedNames.contains(candidate.toLowerCase(Locale.ROOT))) {
            String suffix = " (" + counter++ + ")";
            int keep = Math.min(base.length(), MAX_SHEET_NAME_LENGTH - suffix.length());
            candidate = base.substring(0, keep) + suffix;
        }
        usedNames.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }

    private static void setCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value == null ? "" : value);
        cell.setCellStyle(style);
    }

    private static void track(Map<Integer, Integer> widths, int column, String value) {
        int length = value == null ? 0 : value.length();
        widths.merge(column, length, Math::max);
    }

    private static final class Styles {
        final CellStyle title;
        final CellStyle subHeader;
        final CellStyle columnHeader;
        final CellStyle data;

        Styles(Workbook workbook) {
            Font titleFont = workbook.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 14);
            title = workbook.createCellStyle();
            title.setFont(titleFont);

            Font boldFont = workbook.createFont();
            boldFont.setBold(true);

            subHeader = workbook.createCellStyle();
            subHeader.setFont(boldFont);
            subHeader.setFillForegroundColor(IndexedColors.PALE_BLUE.getIndex());
            subHeader.setFillPattern(FillPatternType.SOLID_FOREGROUND);

            columnHeader = workbook.createCellStyle();
            columnHeader.setFont(boldFont);
            columnHeader.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
            columnHeader.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            columnHeader.setBorderBottom(BorderStyle.THIN);

            data = workbook.createCellStyle();
            data.setWrapText(true);
        }
    }
}
