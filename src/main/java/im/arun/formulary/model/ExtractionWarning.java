package im.arun.formulary.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Anomaly recorded while structuring a document. Immutable once created.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"pageNumber", "rawText", "reason", "context"})
public class ExtractionWarning {

    @JsonProperty("pageNumber")
    int pageNumber;

    @JsonProperty("rawText")
    String rawText;

    @JsonProperty("reason")
    WarningReason reason;

    @JsonProperty("context")
    String context;
}
