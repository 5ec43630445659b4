package im.arun.formulary.service;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Outcome of running the pipeline for one document.
 */
@Data
@NoArgsConstructor
public class ProcessingSummary {
    private Path source;
    private Path outputDirectory;
    private Path categoriesJson;
    private Path workbook;
    private int categories;
    private int subCategories;
    private int rows;
    private int warnings;
    private int tocEntries;
    /** Set when the document could not be extracted at all. */
    private String failure;
    /** Set when JSON was written but the workbook was not. */
    private String renderingFailure;

    public ProcessingSummary(Path source) {
        this.source = source;
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
