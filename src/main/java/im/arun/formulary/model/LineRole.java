package im.arun.formulary.model;

/**
 * Role assigned to a logical line by the classifier.
 */
public enum LineRole {
    CATEGORY_HEADER,
    SUBCATEGORY_HEADER,
    DATA_ROW,
    TOC_ENTRY,
    NOISE
}
