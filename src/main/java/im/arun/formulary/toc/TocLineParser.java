package im.arun.formulary.toc;

import im.arun.formulary.model.TocEntry;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes "label ..... page" lines of a printed table of contents.
 */
public final class TocLineParser {
    private static final Pattern DOT_LEADER = Pattern.compile("\\.{3,}|(?:\\.\\s){3,}\\.?|…+|(?:·\\s?){3,}|_{3,}");
    private static final Pattern DECIMAL_ENTRY = Pattern.compile("^(?<label>.*\\p{L}.*?)\\s+(?<page>\\d{1,4})$");
    private static final Pattern ROMAN_ENTRY = Pattern.compile("^(?<label>.*\\p{L}.*?)\\s+(?<page>[ivxlcdm]{1,7})$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTENTS_TITLE = Pattern.compile("^(?:table\\s+of\\s+)?contents:?$",
        Pattern.CASE_INSENSITIVE);

    private TocLineParser() {
    }

    public static boolean isContentsTitle(String text) {
        return text != null && CONTENTS_TITLE.matcher(text.trim()).matches();
    }

    public static boolean hasLeader(String text) {
        return text != null && DOT_LEADER.matcher(text).find();
    }

    public static boolean isTocShaped(String text) {
        return parse(text).isPresent();
    }

    /**
     * Parse a line into a TOC entry. Dot leaders become plain separators; roman page
     * numbers are only accepted after a leader since a trailing word such as "C" or
     * "XL" is too common in ordinary labels.
     */
    public static Optional<TocEntry> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher leader = DOT_LEADER.matcher(text);
        boolean hasLeader = leader.find();
        String normalized = leader.replaceAll(" ").replaceAll("\\s+", " ").trim();

        Matcher decimal = DECIMAL_ENTRY.matcher(normalized);
        if (decimal.matches()) {
            return Optional.of(new TocEntry(cleanLabel(decimal.group("label")),
                Integer.valueOf(decimal.group("page"))));
        }
        if (hasLeader) {
            Matcher roman = ROMAN_ENTRY.matcher(normalized);
            if (roman.matches()) {
                return Optional.of(new TocEntry(cleanLabel(roman.group("label")),
                    roman.group("page").toLowerCase(Locale.ROOT)));
            }
        }
        return Optional.empty();
    }

    private static String cleanLabel(String label) {
        return label.replaceAll("[\\s:.]+$", "").trim();
    }
}
