package im.arun.formulary.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ExtractionConfig {
    private int frontMatterPageLimit = 10;
    private float columnTolerance = 12f;
    private boolean lenientRows = false;
    private float lineMergeTolerance = 2f;
    private float cellGapRatio = 0.8f;
    private float headerFontRatio = 1.15f;
    private float categoryFontRatio = 1.35f;
    private float indentTolerance = 6f;
    private float marginBand = 36f;
    private int maxHeaderLength = 100;
    private int minTocEntries = 3;
    private float defaultBodyFontSize = 10f;
    private List<String> columnHeaderKeywords = new ArrayList<>(List.of(
        "drug name", "drug", "medication", "product", "generic name", "brand name", "description"));
    private List<String> noisePatterns = new ArrayList<>();

    /**
     * Rejects values that would make the layout heuristics meaningless.
     *
     * @throws IllegalArgumentException naming the first offending setting
     */
    public void validate() {
        if (frontMatterPageLimit < 0) {
            throw new IllegalArgumentException("front_matter_page_limit must be >= 0, got " + frontMatterPageLimit);
        }
        if (columnTolerance < 0) {
            throw new IllegalArgumentException("column_tolerance must be >= 0, got " + columnTolerance);
        }
        if (lineMergeTolerance < 0) {
            throw new IllegalArgumentException("line_merge_tolerance must be >= 0, got " + lineMergeTolerance);
        }
        if (cellGapRatio <= 0) {
            throw new IllegalArgumentException("cell_gap_ratio must be > 0, got " + cellGapRatio);
        }
        if (headerFontRatio <= 0 || categoryFontRatio <= 0) {
            throw new IllegalArgumentException("font ratios must be > 0");
        }
        if (indentTolerance < 0 || marginBand < 0) {
            throw new IllegalArgumentException("indent_tolerance and margin_band must be >= 0");
        }
        if (maxHeaderLength <= 0) {
            throw new IllegalArgumentException("max_header_length must be > 0, got " + maxHeaderLength);
        }
        if (minTocEntries <= 0) {
            throw new IllegalArgumentException("min_toc_entries must be > 0, got " + minTocEntries);
        }
        if (defaultBodyFontSize <= 0) {
            throw new IllegalArgumentException("default_body_font_size must be > 0, got " + defaultBodyFontSize);
        }
    }
}
