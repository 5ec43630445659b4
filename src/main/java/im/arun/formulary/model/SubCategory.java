package im.arun.formulary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Second-level grouping nested under exactly one {@link Category}.
 * Each row maps column names to the cell text in column order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"name", "rows"})
public class SubCategory {

    @JsonProperty("name")
    private String name;

    @JsonProperty("rows")
    private List<Map<String, String>> rows = new ArrayList<>();

    public SubCategory(String name) {
        this.name = name;
    }
}
