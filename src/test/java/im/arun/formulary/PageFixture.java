package im.arun.formulary;

import im.arun.formulary.model.PdfPage;
import im.arun.formulary.model.TextToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds synthetic pages token by token. Token width is approximated as half the font
 * size per character, close enough to Helvetica for the layout heuristics.
 */
public final class PageFixture {
    public static final float PAGE_WIDTH = 612f;
    public static final float PAGE_HEIGHT = 792f;
    public static final float BODY_SIZE = 10f;

    private final int pageNumber;
    private final List<TextToken> tokens = new ArrayList<>();
    private float nextY = 100f;

    private PageFixture(int pageNumber) {
        this.pageNumber = pageNumber;
    }

    public static PageFixture page(int pageNumber) {
        return new PageFixture(pageNumber);
    }

    public static TextToken token(String text, float x, float y, float fontSize, boolean bold) {
        return new TextToken(text, x, x + text.length() * fontSize * 0.5f, y, fontSize,
            bold ? "Helvetica-Bold" : "Helvetica", bold);
    }

    /** Single-cell header line. */
    public PageFixture header(String text, float x, float fontSize) {
        tokens.add(token(text, x, advance(), fontSize, true));
        return this;
    }

    /** Bold column header line with cells at the given x positions. */
    public PageFixture columns(float[] xs, String... labels) {
        float y = advance();
        for (int i = 0; i < labels.length; i++) {
            tokens.add(token(labels[i], xs[i], y, BODY_SIZE, true));
        }
        return this;
    }

    /** Plain body-size line with cells at the given x positions; null cells are skipped. */
    public PageFixture row(float[] xs, String... cells) {
        float y = advance();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] != null) {
                tokens.add(token(cells[i], xs[i], y, BODY_SIZE, false));
            }
        }
        return this;
    }

    /** Plain single-cell text line. */
    public PageFixture text(String text, float x) {
        tokens.add(token(text, x, advance(), BODY_SIZE, false));
        return this;
    }

    public PageFixture footer(String text) {
        tokens.add(token(text, 290f, PAGE_HEIGHT - 20f, 8f, false));
        return this;
    }

    public PdfPage build() {
        return new PdfPage(pageNumber, PAGE_WIDTH, PAGE_HEIGHT, new ArrayList<>(tokens));
    }

    private float advance() {
        float y = nextY;
        nextY += 18f;
        return y;
    }
}
