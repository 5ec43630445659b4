package im.arun.formulary.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Represents a single PDF page as the ordered positioned tokens found on it.
 * Coordinates are top-down page space: y grows towards the bottom of the page.
 */
@Data
@AllArgsConstructor
public class PdfPage {
    private int pageNumber;
    private float width;
    private float height;
    private List<TextToken> tokens;

    public boolean hasText() {
        return tokens != null && tokens.stream().anyMatch(token -> !token.getText().isBlank());
    }
}
