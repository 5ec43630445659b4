package im.arun.formulary.classify;

import im.arun.formulary.model.LineRole;
import im.arun.formulary.model.WarningReason;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A line with the role the classifier gave it and what downstream stages need to act on it.
 * {@code text} is the header name (continuation marker removed) for headers and the
 * full line text otherwise.
 */
@Value
@AllArgsConstructor
public class ClassifiedLine {
    LineRole role;
    TextLine line;
    int pageNumber;
    String text;
    /** Grid active when a data row was classified; null for other roles. */
    ColumnGrid grid;
    /** Set on NOISE lines that must still be reported. */
    WarningReason anomaly;
    /** Header repeated across a page break with a "(continued)" marker. */
    boolean continuation;
    /** Text of the previous non-noise line on the same page, if any. */
    String context;

    public String rawText() {
        return line.text();
    }

    static ClassifiedLine of(LineRole role, TextLine line, int pageNumber, String context) {
        return new ClassifiedLine(role, line, pageNumber, line.text(), null, null, false, context);
    }
}
