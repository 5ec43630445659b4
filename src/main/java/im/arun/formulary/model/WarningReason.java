package im.arun.formulary.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of causes for content that could not be placed in the hierarchy.
 */
public enum WarningReason {
    MALFORMED_ROW("malformed_row"),
    ROW_BEFORE_SUBCATEGORY("row_before_subcategory"),
    SUBCATEGORY_WITHOUT_CATEGORY("subcategory_without_category"),
    UNCLASSIFIABLE_HEADER("unclassifiable_header");

    private final String code;

    WarningReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Whether this warning stands for a data row that was not inserted.
     */
    public boolean isRowRejection() {
        return this == MALFORMED_ROW || this == ROW_BEFORE_SUBCATEGORY;
    }
}
