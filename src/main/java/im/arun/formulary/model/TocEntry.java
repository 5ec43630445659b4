package im.arun.formulary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a single line of the document's printed table of contents.
 * The page reference is an {@link Integer} for decimal page numbers and the raw
 * {@link String} otherwise (roman numerals in front matter).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"label", "pageReference"})
public class TocEntry {

    @JsonProperty("label")
    private String label;

    @JsonProperty("pageReference")
    private Object pageReference;
}
