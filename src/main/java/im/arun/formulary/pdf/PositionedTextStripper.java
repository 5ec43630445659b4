package im.arun.formulary.pdf;

import im.arun.formulary.model.TextToken;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Captures every word PDFBox emits for a page as a {@link TextToken} instead of plain text.
 * Not thread-safe; one instance per document.
 */
class PositionedTextStripper extends PDFTextStripper {
    private static final float BOLD_WEIGHT = 600f;

    private final List<TextToken> tokens = new ArrayList<>();

    PositionedTextStripper() throws IOException {
        super();
        setSortByPosition(true);
        setSuppressDuplicateOverlappingText(true);
    }

    /**
     * Strip a single page.
     *
     * @param document   loaded document
     * @param pageNumber 1-indexed page number
     * @return tokens in the order PDFBox wrote them
     */
    List<TextToken> stripPage(PDDocument document, int pageNumber) throws IOException {
        tokens.clear();
        setStartPage(pageNumber);
        setEndPage(pageNumber);
        getText(document);
        return new ArrayList<>(tokens);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (text == null || text.isBlank() || textPositions == null || textPositions.isEmpty()) {
            return;
        }

        float x = Float.MAX_VALUE;
        float endX = 0f;
        float y = textPositions.get(0).getYDirAdj();
        float fontSize = 0f;
        for (TextPosition position : textPositions) {
            x = Math.min(x, position.getXDirAdj());
            endX = Math.max(endX, position.getXDirAdj() + position.getWidthDirAdj());
            float size = position.getFontSizeInPt() > 0 ? position.getFontSizeInPt() : position.getFontSize();
            fontSize = Math.max(fontSize, size);
        }

        PDFont font = textPositions.get(0).getFont();
        String fontName = font != null ? font.getName() : null;
        tokens.add(new TextToken(text.strip(), x, Math.max(endX, x), y, fontSize, fontName, isBold(font)));
    }

    static boolean isBold(PDFont font) {
        if (font == null) {
            return false;
        }
        String name = font.getName();
        if (name != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.contains("bold") || lower.contains("black") || lower.contains("heavy")
                    || lower.contains("semibold") || lower.contains("demi")) {
                return true;
            }
        }
        PDFontDescriptor descriptor = font.getFontDescriptor();
        return descriptor != null && (descriptor.isForceBold() || descriptor.getFontWeight() >= BOLD_WEIGHT);
    }
}
