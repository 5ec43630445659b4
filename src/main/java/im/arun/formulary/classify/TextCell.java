package im.arun.formulary.classify;

import lombok.Value;

/**
 * Horizontally contiguous run of tokens within one line.
 */
@Value
public class TextCell {
    String text;
    float x;
    float endX;
    float fontSize;
    boolean bold;

    public boolean hasDigit() {
        return text.chars().anyMatch(Character::isDigit);
    }

    public boolean hasLetter() {
        return text.chars().anyMatch(Character::isLetter);
    }
}
