package im.arun.formulary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level grouping of the formulary (usually a drug class).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"name", "subCategories"})
public class Category {

    @JsonProperty("name")
    private String name;

    @JsonProperty("subCategories")
    private List<SubCategory> subCategories = new ArrayList<>();

    public Category(String name) {
        this.name = name;
    }
}
