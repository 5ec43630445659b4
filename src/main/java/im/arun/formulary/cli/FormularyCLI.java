package im.arun.formulary.cli;

import im.arun.formulary.config.ConfigLoader;
import im.arun.formulary.config.ExtractionConfig;
import im.arun.formulary.exception.ExtractionException;
import im.arun.formulary.exception.RenderingException;
import im.arun.formulary.service.ExtractionResultWriter;
import im.arun.formulary.service.FormularyService;
import im.arun.formulary.service.ProcessingSummary;
import im.arun.formulary.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the formulary extractor using Picocli.
 */
@Command(
    name = "formulary",
    description = "Extract category/subcategory/row formulary tables from PDF documents into JSON and XLSX",
    mixinStandardHelpOptions = true,
    version = "Formulary Extractor 1.0"
)
public class FormularyCLI implements Callable<Integer> {
    private static final String RULE = "=".repeat(80);

    @Parameters(index = "0", arity = "0..1", paramLabel = "pdf_path", description = "Path to a PDF file")
    private String pdfPath;

    @Option(names = {"--pdf-dir"}, description = "Process every PDF in this directory")
    private String pdfDir;

    @Option(names = {"-o", "--output-dir"}, description = "Output directory", defaultValue = "output")
    private String outputDir;

    @Option(names = {"--json-only"}, description = "Write JSON only, skip the workbook")
    private boolean jsonOnly;

    @Option(names = {"--excel-only"}, description = "Render a workbook from an existing JSON file (needs --json-path)")
    private boolean excelOnly;

    @Option(names = {"--json-path"}, description = "Existing extracted_data.json for --excel-only")
    private String jsonPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--front-matter-page-limit"}, description = "Pages scanned for the table of contents")
    private Integer frontMatterPageLimit;

    @Option(names = {"--column-tolerance"}, description = "Column alignment tolerance in points")
    private Float columnTolerance;

    @Option(names = {"--lenient-rows"}, description = "Coerce misaligned rows into the column grid instead of skipping them")
    private boolean lenientRows;

    @Option(names = {"--threads"}, description = "Worker threads for --pdf-dir", defaultValue = "0")
    private int threads;

    private final PrintStream out;
    private final PrintStream err;

    public FormularyCLI() {
        this(System.out, System.err);
    }

    FormularyCLI(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() throws Exception {
        if (excelOnly) {
            return renderExcelOnly();
        }

        ExtractionConfig config;
        try {
            config = new ConfigLoader(configPath).load(overrides());
        } catch (IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }
        FormularyService service = new FormularyService(config);

        if (pdfDir != null) {
            return processDirectory(service);
        }

        if (pdfPath == null) {
            err.println("Error: pdf_path is required (unless using --pdf-dir or --excel-only)");
            return 1;
        }
        Path pdf = Paths.get(pdfPath);
        if (!Files.exists(pdf)) {
            err.println("Error: PDF file not found: " + pdfPath);
            return 1;
        }

        try {
            ProcessingSummary summary = processPdf(service, pdf);
            return summary.getRenderingFailure() == null ? 0 : 1;
        } catch (ExtractionException | IOException e) {
            err.println("Error processing document: " + e.getMessage());
            return 1;
        }
    }

    private Integer renderExcelOnly() {
        if (jsonPath == null) {
            err.println("Error: --excel-only requires --json-path");
            return 1;
        }
        Path json = Paths.get(jsonPath);
        if (!Files.exists(json)) {
            err.println("Error: JSON file not found: " + jsonPath);
            return 1;
        }

        out.println(RULE);
        out.println("EXCEL CREATION MODE");
        out.println(RULE);
        out.println("Input JSON: " + json);

        try {
            FormularyService service = new FormularyService(new ConfigLoader(configPath).load());
            Path workbook = service.renderFromJson(json);
            out.println("Output Excel: " + workbook);
            return 0;
        } catch (RenderingException | IOException e) {
            err.println("Error creating Excel file: " + e.getMessage());
            return 1;
        }
    }

    private Integer processDirectory(FormularyService service) throws IOException {
        Path dir = Paths.get(pdfDir);
        if (!Files.isDirectory(dir)) {
            err.println("Error: Directory not found: " + pdfDir);
            return 1;
        }

        out.println(RULE);
        out.println("Processing all PDFs in: " + dir);
        out.println(RULE);

        List<ProcessingSummary> summaries = service.processDirectory(dir, Paths.get(outputDir), jsonOnly, threads);
        if (summaries.isEmpty()) {
            err.println("No PDF files found in " + dir);
            return 1;
        }

        int failed = 0;
        for (ProcessingSummary summary : summaries) {
            out.println();
            out.println("--- " + summary.getSource().getFileName() + " ---");
            if (summary.isSuccess()) {
                printSummary(summary);
            } else {
                failed++;
                out.println("  FAILED: " + summary.getFailure());
            }
        }

        out.println();
        out.println("Batch processing complete! " + (summaries.size() - failed) + " succeeded, " + failed + " failed");
        return failed == 0 ? 0 : 1;
    }

    private ProcessingSummary processPdf(FormularyService service, Path pdf) throws IOException {
        out.println(RULE);
        out.println("PDF EXTRACTION for " + pdf.getFileName());
        out.println(RULE);
        out.println("Input PDF: " + pdf);

        ProcessingSummary summary = service.processPdf(pdf, Paths.get(outputDir), jsonOnly);
        printSummary(summary);
        return summary;
    }

    private void printSummary(ProcessingSummary summary) {
        Path dir = summary.getOutputDirectory();
        out.println("Output directory: " + dir);
        out.println("  - Categories saved to: " + summary.getCategoriesJson());
        out.println("  - Warnings saved to: " + dir.resolve(ExtractionResultWriter.WARNINGS_FILE));
        out.println("  - Table of Contents saved to: " + dir.resolve(ExtractionResultWriter.TOC_FILE));
        if (summary.getWorkbook() != null) {
            out.println("  - Excel saved to: " + summary.getWorkbook());
        } else if (summary.getRenderingFailure() != null) {
            out.println("  - Could not create Excel file: " + summary.getRenderingFailure());
            out.println("    JSON files have been created successfully in: " + dir);
        }
        out.println();
        out.println("Summary:");
        out.println("  - TOC entries found: " + summary.getTocEntries());
        out.println("  - Categories found: " + summary.getCategories());
        out.println("  - Total subcategories: " + summary.getSubCategories());
        out.println("  - Total rows extracted: " + summary.getRows());
        out.println("  - Warnings (skipped rows): " + summary.getWarnings());
    }

    private Map<String, Object> overrides() {
        Map<String, Object> options = new HashMap<>();
        if (frontMatterPageLimit != null) {
            options.put("front_matter_page_limit", frontMatterPageLimit);
        }
        if (columnTolerance != null) {
            options.put("column_tolerance", columnTolerance);
        }
        if (lenientRows) {
            options.put("lenient_rows", true);
        }
        return options;
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new FormularyCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
