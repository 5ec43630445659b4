package im.arun.formulary.classify;

import im.arun.formulary.config.ExtractionConfig;
import im.arun.formulary.model.PdfPage;
import im.arun.formulary.model.TextToken;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups a page's tokens into lines by baseline, then into cells by horizontal gap.
 */
public class LineGrouper {
    private static final Comparator<TextToken> READING_ORDER =
        Comparator.comparingDouble(TextToken::getY).thenComparingDouble(TextToken::getX);

    private final float lineMergeTolerance;
    private final float cellGapRatio;

    public LineGrouper(ExtractionConfig config) {
        this.lineMergeTolerance = config.getLineMergeTolerance();
        this.cellGapRatio = config.getCellGapRatio();
    }

    public List<TextLine> group(PdfPage page) {
        List<TextToken> tokens = new ArrayList<>();
        if (page.getTokens() != null) {
            for (TextToken token : page.getTokens()) {
                if (token.getText() != null && !token.getText().isBlank()) {
                    tokens.add(token);
                }
            }
        }
        tokens.sort(READING_ORDER);

        List<TextLine> lines = new ArrayList<>();
        List<TextToken> current = new ArrayList<>();
        float anchorY = 0f;
        for (TextToken token : tokens) {
            if (!current.isEmpty() && Math.abs(token.getY() - anchorY) > lineMergeTolerance) {
                lines.add(toLine(anchorY, current));
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                anchorY = token.getY();
            }
            current.add(token);
        }
        if (!current.isEmpty()) {
            lines.add(toLine(anchorY, current));
        }
        return lines;
    }

    private TextLine toLine(float y, List<TextToken> tokens) {
        tokens.sort(Comparator.comparingDouble(TextToken::getX));

        List<TextCell> cells = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        float cellX = 0f;
        float cellEndX = 0f;
        float cellFontSize = 0f;
        boolean cellBold = true;
        for (TextToken token : tokens) {
            if (text.length() > 0) {
                float gap = token.getX() - cellEndX;
                float maxGap = cellGapRatio * Math.max(Math.max(cellFontSize, token.getFontSize()), 1f);
                if (gap < maxGap) {
                    text.append(' ').append(token.getText().trim());
                    cellEndX = Math.max(cellEndX, token.getEndX());
                    cellFontSize = Math.max(cellFontSize, token.getFontSize());
                    cellBold = cellBold && token.isBold();
                    continue;
                }
                cells.add(new TextCell(text.toString(), cellX, cellEndX, cellFontSize, cellBold));
                text.setLength(0);
            }
            text.append(token.getText().trim());
            cellX = token.getX();
            cellEndX = token.getEndX();
            cellFontSize = token.getFontSize();
            cellBold = token.isBold();
        }
        if (text.length() > 0) {
            cells.add(new TextCell(text.toString(), cellX, cellEndX, cellFontSize, cellBold));
        }
        return new TextLine(y, cells);
    }
}
