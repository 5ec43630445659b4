package im.arun.formulary.classify;

import im.arun.formulary.config.ExtractionConfig;
import im.arun.formulary.model.LineRole;
import im.arun.formulary.model.PdfPage;
import im.arun.formulary.model.WarningReason;
import im.arun.formulary.toc.TocLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Assigns a {@link LineRole} to each line from typography, indentation and column alignment.
 *
 * <p>One instance per document: it carries the layout learned so far (body font size,
 * indentation of the last category header, active column grid) from page to page.
 */
public class LineClassifier {
    private static final Logger logger = LoggerFactory.getLogger(LineClassifier.class);

    private static final List<Pattern> PAGE_NUMBER_PATTERNS = List.of(
        Pattern.compile("^(?:page\\s+)?\\d{1,4}(?:\\s*(?:of|/)\\s*\\d{1,4})?$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^[-–—]\\s*\\d{1,4}\\s*[-–—]$")
    );
    private static final Pattern CONTINUATION = Pattern.compile(
        "^(?<name>.+?)\\s*(?:\\(\\s*(?:continued|cont'?d|cont\\.?)\\s*\\)|[-–—:,]\\s*(?:continued|cont'?d|cont\\.?))$",
        Pattern.CASE_INSENSITIVE);

    private final ExtractionConfig config;
    private final List<Pattern> noisePatterns = new ArrayList<>();

    private float bodyFontSize;
    private Float categoryIndent;
    private ColumnGrid grid;

    public LineClassifier(ExtractionConfig config) {
        this.config = config;
        this.bodyFontSize = config.getDefaultBodyFontSize();
        for (String pattern : config.getNoisePatterns()) {
            try {
                noisePatterns.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                logger.warn("Ignoring invalid noise pattern '{}': {}", pattern, e.getDescription());
            }
        }
    }

    /**
     * Classify every line of a page in reading order.
     *
     * @param page        the page the lines were grouped from
     * @param lines       lines from {@link LineGrouper#group(PdfPage)}
     * @param frontMatter whether the page may hold the table of contents
     */
    public PageClassification classifyPage(PdfPage page, List<TextLine> lines, boolean frontMatter) {
        updateBodyFontSize(lines);

        boolean[] noise = new boolean[lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            noise[i] = isNoise(lines.get(i), page);
        }
        boolean tocPage = frontMatter && isTocPage(lines, noise);

        List<ClassifiedLine> classified = new ArrayList<>(lines.size());
        String context = null;
        for (int i = 0; i < lines.size(); i++) {
            TextLine line = lines.get(i);
            ClassifiedLine result;
            if (noise[i]) {
                result = ClassifiedLine.of(LineRole.NOISE, line, page.getPageNumber(), context);
            } else if (tocPage) {
                LineRole role = TocLineParser.isTocShaped(line.text()) ? LineRole.TOC_ENTRY : LineRole.NOISE;
                result = ClassifiedLine.of(role, line, page.getPageNumber(), context);
            } else {
                result = classifyBodyLine(line, page.getPageNumber(), context);
            }
            classified.add(result);
            if (result.getRole() != LineRole.NOISE) {
                context = line.text();
            }
        }
        return new PageClassification(page.getPageNumber(), tocPage, classified);
    }

    public float getBodyFontSize() {
        return bodyFontSize;
    }

    public ColumnGrid getGrid() {
        return grid;
    }

    private ClassifiedLine classifyBodyLine(TextLine line, int pageNumber, String context) {
        String text = line.text();

        if (isColumnHeader(line)) {
            grid = ColumnGrid.fromHeader(line);
            logger.debug("Column grid on page {}: {}", pageNumber, grid.columnNames());
            return ClassifiedLine.of(LineRole.NOISE, line, pageNumber, context);
        }

        if (line.cellCount() == 1 && isEmphasized(line)) {
            return classifyHeader(line, pageNumber, context);
        }

        if (line.cellCount() >= 2) {
            if (grid == null) {
                grid = ColumnGrid.implicitFrom(line);
                logger.debug("No column header seen; inferred {} columns on page {}", grid.getColumns().size(), pageNumber);
            }
            return new ClassifiedLine(LineRole.DATA_ROW, line, pageNumber, text, grid, null, false, context);
        }

        if (grid != null) {
            // a wrapped drug line or merged cells under an open table; the grid accepts or rejects it
            return new ClassifiedLine(LineRole.DATA_ROW, line, pageNumber, text, grid, null, false, context);
        }

        return ClassifiedLine.of(LineRole.NOISE, line, pageNumber, context);
    }

    private ClassifiedLine classifyHeader(TextLine line, int pageNumber, String context) {
        String text = line.text();
        if (text.chars().noneMatch(Character::isLetter)) {
            return ClassifiedLine.of(LineRole.NOISE, line, pageNumber, context);
        }
        if (text.length() > config.getMaxHeaderLength()) {
            return new ClassifiedLine(LineRole.NOISE, line, pageNumber, text, null,
                WarningReason.UNCLASSIFIABLE_HEADER, false, context);
        }

        String name = text;
        boolean continuation = false;
        Matcher matcher = CONTINUATION.matcher(text);
        if (matcher.matches()) {
            name = matcher.group("name").trim();
            continuation = true;
        }

        LineRole role = headerRank(line, name);
        if (role == LineRole.CATEGORY_HEADER) {
            categoryIndent = line.minX();
        }
        if (grid != null && grid.isImplicit() && !continuation) {
            grid = null;
        }
        return new ClassifiedLine(role, line, pageNumber, name, null, null, continuation, context);
    }

    private LineRole headerRank(TextLine line, String name) {
        if (line.fontSize() >= bodyFontSize * config.getCategoryFontRatio()) {
            return LineRole.CATEGORY_HEADER;
        }
        if (categoryIndent != null && line.minX() > categoryIndent + config.getIndentTolerance()) {
            return LineRole.SUBCATEGORY_HEADER;
        }
        if (isUpperCase(name)) {
            return LineRole.CATEGORY_HEADER;
        }
        return LineRole.SUBCATEGORY_HEADER;
    }

    private boolean isColumnHeader(TextLine line) {
        if (line.cellCount() < 2) {
            return false;
        }
        for (TextCell cell : line.getCells()) {
            if (cell.hasDigit() || !cell.hasLetter()) {
                return false;
            }
        }
        if (isEmphasized(line)) {
            return true;
        }
        String first = line.getCells().get(0).getText().trim();
        return config.getColumnHeaderKeywords().stream().anyMatch(first::equalsIgnoreCase);
    }

    private boolean isEmphasized(TextLine line) {
        return line.isBold() || line.fontSize() >= bodyFontSize * config.getHeaderFontRatio();
    }

    private boolean isNoise(TextLine line, PdfPage page) {
        if (line.isBlank()) {
            return true;
        }
        float band = config.getMarginBand();
        if (line.getY() < band || (page.getHeight() > 0 && line.getY() > page.getHeight() - band)) {
            return true;
        }
        String text = line.text();
        for (Pattern pattern : PAGE_NUMBER_PATTERNS) {
            if (pattern.matcher(text).matches()) {
                return true;
            }
        }
        for (Pattern pattern : noisePatterns) {
            if (pattern.matcher(text).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A front-matter page is a TOC page when it is titled as one, or when most of its
     * lines are leadered "label ..... page" entries. A trailing number alone is not enough:
     * table rows ending in a tier or quantity have that shape too.
     */
    private boolean isTocPage(List<TextLine> lines, boolean[] noise) {
        int candidates = 0;
        int leaderedEntries = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (noise[i]) {
                continue;
            }
            String text = lines.get(i).text();
            if (TocLineParser.isContentsTitle(text)) {
                return true;
            }
            candidates++;
            if (TocLineParser.hasLeader(text) && TocLineParser.isTocShaped(text)) {
                leaderedEntries++;
            }
        }
        return leaderedEntries >= config.getMinTocEntries() && leaderedEntries * 2 >= candidates;
    }

    /**
     * Body size is the size carrying the most plain (non-bold) characters on the page.
     * Pages without plain text keep the previous estimate.
     */
    private void updateBodyFontSize(List<TextLine> lines) {
        Map<Float, Integer> weights = new TreeMap<>();
        for (TextLine line : lines) {
            for (TextCell cell : line.getCells()) {
                if (!cell.isBold() && cell.getFontSize() > 0) {
                    float size = Math.round(cell.getFontSize() * 2f) / 2f;
                    weights.merge(size, cell.getText().length(), Integer::sum);
                }
            }
        }
        float best = -1f;
        int bestWeight = 0;
        // TreeMap iterates ascending, so ties resolve to the smaller size
        for (Map.Entry<Float, Integer> entry : weights.entrySet()) {
            if (entry.getValue() > bestWeight) {
                best = entry.getKey();
                bestWeight = entry.getValue();
            }
        }
        if (best > 0) {
            bodyFontSize = best;
        }
    }

    private static boolean isUpperCase(String text) {
        long letters = text.chars().filter(Character::isLetter).count();
        return letters >= 3
            && text.equals(text.toUpperCase(Locale.ROOT))
            && !text.equals(text.toLowerCase(Locale.ROOT));
    }
}
