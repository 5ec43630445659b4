package im.arun.formulary.classify;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;

class ColumnGridTest {

    private static final float TOLERANCE = 12f;

    private final ColumnGrid grid = ColumnGrid.fromHeader(line(cell("Drug Name", 72f), cell("Tier", 250f), cell("Notes", 400f)));

    @Test
    void readsCellsIntoTheirColumns() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Amoxicillin", 72f), cell("1", 252f), cell("PA", 398f)), TOLERANCE, false);

        assertThat(parse.isAccepted()).isTrue();
        assertThat(parse.getRow()).containsExactly(
            entry("Drug Name", "Amoxicillin"), entry("Tier", "1"), entry("Notes", "PA"));
    }

    @Test
    void leavesMissingTrailingColumnsEmpty() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Penicillin VK", 72f), cell("2", 250f)), TOLERANCE, false);

        assertThat(parse.isAccepted()).isTrue();
        assertThat(parse.getRow()).containsEntry("Notes", "");
        assertThat(parse.getRow().keySet()).containsExactly("Drug Name", "Tier", "Notes");
    }

    @Test
    void keepsAGapInTheMiddleOfTheRow() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Ampicillin", 72f), cell("QL", 401f)), TOLERANCE, false);

        assertThat(parse.getRow()).containsEntry("Tier", "").containsEntry("Notes", "QL");
    }

    @Test
    void rejectsMoreCellsThanColumns() {
        ColumnGrid.RowParse parse = grid.parse(
            line(cell("A", 72f), cell("B", 150f), cell("C", 250f), cell("D", 400f)), TOLERANCE, false);

        assertThat(parse.isAccepted()).isFalse();
        assertThat(parse.getProblem()).contains("4 cells for 3 columns");
    }

    @Test
    void rejectsTwoCellsInOneColumn() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Amoxicillin", 72f), cell("500mg", 110f)), TOLERANCE, false);

        assertThat(parse.isAccepted()).isFalse();
        assertThat(parse.getProblem()).contains("both fall into column 'Drug Name'");
    }

    @Test
    void rejectsCellInTheGapBetweenColumns() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Amoxicillin", 72f), cell("PA", 330f)), TOLERANCE, false);

        assertThat(parse.isAccepted()).isFalse();
        assertThat(parse.getProblem()).contains("'PA'").contains("outside column 'Tier'");
    }

    @Test
    void acceptsRightAlignedValueUnderItsLabel() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Amoxicillin", 72f), cell("12", 278f)), TOLERANCE, false);

        assertThat(parse.isAccepted()).isTrue();
        assertThat(parse.getRow()).containsEntry("Tier", "12");
    }

    @Test
    void lenientModeKeepsCellInTheGap() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Amoxicillin", 72f), cell("PA", 330f)), TOLERANCE, true);

        assertThat(parse.getRow()).containsEntry("Tier", "PA").containsEntry("Notes", "");
    }

    @Test
    void rejectsCellLeftOfTheGrid() {
        ColumnGrid.RowParse parse = grid.parse(line(cell("Footnote", 20f), cell("1", 250f)), TOLERANCE, false);

        assertThat(parse.isAccepted()).isFalse();
    }

    @Test
    void lenientModeJoinsAndClampsCells() {
        ColumnGrid.RowParse parse = grid.parse(
            line(cell("See", 20f), cell("Amoxicillin", 72f), cell("500mg", 150f), cell("1", 250f)), TOLERANCE, true);

        assertThat(parse.isAccepted()).isTrue();
        assertThat(parse.getRow()).containsEntry("Drug Name", "See Amoxicillin 500mg").containsEntry("Tier", "1");
    }

    @Test
    void suffixesRepeatedHeaderLabels() {
        ColumnGrid repeated = ColumnGrid.fromHeader(line(cell("Drug", 72f), cell("Tier", 200f), cell("Tier", 300f)));

        assertThat(repeated.columnNames()).containsExactly("Drug", "Tier", "Tier 2");
        assertThat(repeated.isImplicit()).isFalse();
    }

    @Test
    void implicitGridNamesColumnsByPosition() {
        ColumnGrid implicit = ColumnGrid.implicitFrom(line(cell("Amoxicillin", 72f), cell("1", 250f)));

        assertThat(implicit.isImplicit()).isTrue();
        assertThat(implicit.columnNames()).containsExactly("Column 1", "Column 2");
    }

    private static TextCell cell(String text, float x) {
        return new TextCell(text, x, x + text.length() * 5f, 10f, false);
    }

    private static TextLine line(TextCell... cells) {
        return new TextLine(200f, new ArrayList<>(List.of(cells)));
    }
}
