package im.arun.formulary.service;

import im.arun.formulary.config.ExtractionConfig;
import im.arun.formulary.excel.SpreadsheetRenderer;
import im.arun.formulary.exception.ExtractionException;
import im.arun.formulary.exception.RenderingException;
import im.arun.formulary.model.Category;
import im.arun.formulary.model.ExtractionResult;
import im.arun.formulary.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the whole pipeline for a document: extraction, JSON output and the workbook.
 * Each document gets its own directory {@code <outputDir>/<pdf stem>/}.
 */
public class FormularyService {
    private static final Logger logger = LoggerFactory.getLogger(FormularyService.class);

    private final ExtractionCoordinator coordinator;
    private final ExtractionResultWriter resultWriter;
    private final SpreadsheetRenderer renderer;

    public FormularyService(ExtractionConfig config) {
        this(new ExtractionCoordinator(config), new ExtractionResultWriter(), new SpreadsheetRenderer());
    }

    public FormularyService(ExtractionCoordinator coordinator, ExtractionResultWriter resultWriter,
                            SpreadsheetRenderer renderer) {
        this.coordinator = coordinator;
        this.resultWriter = resultWriter;
        this.renderer = renderer;
    }

    /**
     * Extract one PDF and write its outputs.
     *
     * @throws ExtractionException when the document cannot be extracted at all
     * @throws IOException         when the JSON files cannot be written
     */
    public ProcessingSummary processPdf(Path pdfPath, Path outputDir, boolean jsonOnly) throws IOException {
        String stem = stem(pdfPath);
        Path documentDir = outputDir.resolve(stem);
        logger.info("Processing {} into {}", pdfPath, documentDir);

        ExtractionResult result = coordinator.extract(pdfPath);
        Path categoriesJson = resultWriter.write(result, documentDir);

        ProcessingSummary summary = new ProcessingSummary(pdfPath);
        summary.setOutputDirectory(documentDir);
        summary.setCategoriesJson(categoriesJson);
        summary.setCategories(result.getCategories().size());
        summary.setSubCategories((int) result.countSubCategories());
        summary.setRows((int) result.countRows());
        summary.setWarnings(result.getWarnings().size());
        summary.setTocEntries(result.getTableOfContents().size());

        if (jsonOnly) {
            logger.info("JSON-only mode, skipping workbook for {}", pdfPath.getFileName());
            return summary;
        }

        Path workbook = documentDir.resolve(stem + ".xlsx");
        try {
            summary.setWorkbook(renderer.render(result.getCategories(), workbook));
        } catch (RenderingException e) {
            logger.error("Workbook for {} not created, JSON output kept in {}: {}",
                pdfPath.getFileName(), documentDir, e.getMessage());
            summary.setRenderingFailure(e.getMessage());
        }
        return summary;
    }

    /**
     * Render a workbook from a previously written categories file, next to it as
     * {@code <parent>/<parent name>.xlsx}.
     */
    public Path renderFromJson(Path categoriesJson) throws IOException {
        List<Category> categories = resultWriter.readCategories(categoriesJson);
        Path parent = categoriesJson.toAbsolutePath().getParent();
        Path workbook = parent.resolve(parent.getFileName() + ".xlsx");
        return renderer.render(categories, workbook);
    }

    /**
     * Process every {@code *.pdf} in {@code pdfDir}, in name order, on the shared worker pool.
     * A document that fails is reported in its summary and does not stop the others.
     */
    public List<ProcessingSummary> processDirectory(Path pdfDir, Path outputDir, boolean jsonOnly, int threads)
            throws IOException {
        List<Path> pdfs = listPdfs(pdfDir);
        logger.info("Found {} PDF files in {}", pdfs.size(), pdfDir);

        ExecutorService executor = ExecutorProvider.getExecutor(threads);
        List<Future<ProcessingSummary>> futures = new ArrayList<>();
        for (Path pdf : pdfs) {
            futures.add(executor.submit(() -> processSafely(pdf, outputDir, jsonOnly)));
        }

        List<ProcessingSummary> summaries = new ArrayList<>(pdfs.size());
        for (int i = 0; i < futures.size(); i++) {
            Path pdf = pdfs.get(i);
            try {
                summaries.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while processing " + pdfDir, e);
            } catch (ExecutionException e) {
                logger.error("Unexpected failure processing {}", pdf, e.getCause());
                summaries.add(failed(pdf, e.getCause()));
            }
        }

        long failures = summaries.stream().filter(s -> !s.isSuccess()).count();
        logger.info("Batch complete: {} documents, {} failed", summaries.size(), failures);
        return summaries;
    }

    static List<Path> listPdfs(Path pdfDir) throws IOException {
        try (Stream<Path> files = Files.list(pdfDir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        }
    }

    private ProcessingSummary processSafely(Path pdf, Path outputDir, boolean jsonOnly) {
        try {
            return processPdf(pdf, outputDir, jsonOnly);
        } catch (ExtractionException | IOException e) {
            logger.error("Failed to process {}: {}", pdf.getFileName(), e.getMessage());
            return failed(pdf, e);
        }
    }

    private static ProcessingSummary failed(Path pdf, Throwable cause) {
        ProcessingSummary summary = new ProcessingSummary(pdf);
        if (cause == null) {
            summary.setFailure("unknown error");
        } else {
            summary.setFailure(cause.getMessage() != null ? cause.getMessage() : cause.toString());
        }
        return summary;
    }

    static String stem(Path pdfPath) {
        String name = pdfPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
