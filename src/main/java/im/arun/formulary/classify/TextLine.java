package im.arun.formulary.classify;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical line of a page: cells sharing a baseline, ordered left to right.
 */
@Value
public class TextLine {
    float y;
    List<TextCell> cells;

    public String text() {
        return cells.stream()
            .map(TextCell::getText)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .collect(Collectors.joining(" "));
    }

    public float minX() {
        return cells.isEmpty() ? 0f : cells.get(0).getX();
    }

    public float maxX() {
        return cells.isEmpty() ? 0f : cells.get(cells.size() - 1).getEndX();
    }

    public float fontSize() {
        float max = 0f;
        for (TextCell cell : cells) {
            max = Math.max(max, cell.getFontSize());
        }
        return max;
    }

    public boolean isBold() {
        return !cells.isEmpty() && cells.stream().allMatch(TextCell::isBold);
    }

    public int cellCount() {
        return cells.size();
    }

    public boolean isBlank() {
        return text().isEmpty();
    }
}
