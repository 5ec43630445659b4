package im.arun.formulary.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root aggregate of one document's extraction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"categories", "warnings", "table_of_contents"})
public class ExtractionResult {

    @JsonProperty("categories")
    private List<Category> categories = new ArrayList<>();

    @JsonProperty("warnings")
    private List<ExtractionWarning> warnings = new ArrayList<>();

    @JsonProperty("table_of_contents")
    private List<TocEntry> tableOfContents = new ArrayList<>();

    /** Number of lines classified as data rows, whether inserted or rejected. */
    @JsonIgnore
    private int dataRowCandidates;

    public int countSubCategories() {
        return categories.stream().mapToInt(category -> category.getSubCategories().size()).sum();
    }

    public int countRows() {
        return categories.stream()
            .flatMap(category -> category.getSubCategories().stream())
            .mapToInt(subCategory -> subCategory.getRows().size())
            .sum();
    }

    public long countRejectedRows() {
        return warnings.stream().filter(warning -> warning.getReason().isRowRejection()).count();
    }
}
