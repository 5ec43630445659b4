package im.arun.formulary.tree;

import im.arun.formulary.classify.ClassifiedLine;
import im.arun.formulary.classify.ColumnGrid;
import im.arun.formulary.model.Category;
import im.arun.formulary.model.SubCategory;
import im.arun.formulary.model.WarningReason;
import im.arun.formulary.warning.WarningCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assembles the category → subcategory → row tree from classified lines in document order.
 *
 * <p>Open nodes are tracked as indexes into append-only lists and survive page breaks:
 * only a new header closes them. Closed nodes are never reopened, so a header repeated
 * later in the document starts a new node, except for a "(continued)" repetition of the
 * node that is still open.
 */
public class HierarchyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    /** Placeholder category opened for a subcategory that appears before any category. */
    public static final String SYNTHETIC_CATEGORY_NAME = "Uncategorized";

    public enum State {
        NO_OPEN_CATEGORY,
        CATEGORY_OPEN,
        SUBCATEGORY_OPEN
    }

    private final List<Category> categories = new ArrayList<>();
    private final WarningCollector warnings;
    private final float columnTolerance;
    private final boolean lenientRows;

    private State state = State.NO_OPEN_CATEGORY;
    private int openCategoryIndex = -1;
    private int openSubCategoryIndex = -1;

    public HierarchyBuilder(WarningCollector warnings, float columnTolerance, boolean lenientRows) {
        this.warnings = warnings;
        this.columnTolerance = columnTolerance;
        this.lenientRows = lenientRows;
    }

    public void accept(ClassifiedLine line) {
        switch (line.getRole()) {
            case CATEGORY_HEADER:
                onCategoryHeader(line);
                break;
            case SUBCATEGORY_HEADER:
                onSubCategoryHeader(line);
                break;
            case DATA_ROW:
                onDataRow(line);
                break;
            case TOC_ENTRY:
            case NOISE:
                break;
            default:
                throw new IllegalStateException("Unhandled line role: " + line.getRole());
        }
    }

    /**
     * Close whatever is still open and hand back the tree. Nothing is emitted for the closing.
     */
    public List<Category> finish() {
        state = State.NO_OPEN_CATEGORY;
        openCategoryIndex = -1;
        openSubCategoryIndex = -1;
        return Collections.unmodifiableList(categories);
    }

    public State getState() {
        return state;
    }

    public int getOpenCategoryIndex() {
        return openCategoryIndex;
    }

    public int getOpenSubCategoryIndex() {
        return openSubCategoryIndex;
    }

    private void onCategoryHeader(ClassifiedLine line) {
        if (line.isContinuation() && state != State.NO_OPEN_CATEGORY
                && currentCategory().getName().equalsIgnoreCase(line.getText())) {
            logger.debug("Page {}: category '{}' continues", line.getPageNumber(), line.getText());
            return;
        }
        openCategory(line.getText());
    }

    private void onSubCategoryHeader(ClassifiedLine line) {
        if (line.isContinuation() && state == State.SUBCATEGORY_OPEN
                && currentSubCategory().getName().equalsIgnoreCase(line.getText())) {
            logger.debug("Page {}: subcategory '{}' continues", line.getPageNumber(), line.getText());
            return;
        }
        if (state == State.NO_OPEN_CATEGORY) {
            warnings.record(line.getPageNumber(), line.rawText(), WarningReason.SUBCATEGORY_WITHOUT_CATEGORY,
                line.getContext());
            openCategory(SYNTHETIC_CATEGORY_NAME);
        }
        Category category = currentCategory();
        category.getSubCategories().add(new SubCategory(line.getText()));
        openSubCategoryIndex = category.getSubCategories().size() - 1;
        state = State.SUBCATEGORY_OPEN;
    }

    private void onDataRow(ClassifiedLine line) {
        if (state != State.SUBCATEGORY_OPEN) {
            warnings.record(line.getPageNumber(), line.rawText(), WarningReason.ROW_BEFORE_SUBCATEGORY,
                line.getContext());
            return;
        }
        ColumnGrid grid = line.getGrid() != null ? line.getGrid() : ColumnGrid.implicitFrom(line.getLine());
        ColumnGrid.RowParse parse = grid.parse(line.getLine(), columnTolerance, lenientRows);
        if (!parse.isAccepted()) {
            logger.debug("Page {}: rejecting row '{}': {}", line.getPageNumber(), line.rawText(), parse.getProblem());
            warnings.record(line.getPageNumber(), line.rawText(), WarningReason.MALFORMED_ROW, line.getContext());
            return;
        }
        currentSubCategory().getRows().add(parse.getRow());
    }

    private void openCategory(String name) {
        categories.add(new Category(name));
        openCategoryIndex = categories.size() - 1;
        openSubCategoryIndex = -1;
        state = State.CATEGORY_OPEN;
    }

    private Category currentCategory() {
        return categories.get(openCategoryIndex);
    }

    private SubCategory currentSubCategory() {
        return currentCategory().getSubCategories().get(openSubCategoryIndex);
    }
}
