package im.arun.formulary.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One run of text on a page with its horizontal extent, baseline and font metadata.
 */
@Data
@AllArgsConstructor
public class TextToken {
    private String text;
    private float x;
    private float endX;
    private float y;
    private float fontSize;
    private String fontName;
    private boolean bold;
}
