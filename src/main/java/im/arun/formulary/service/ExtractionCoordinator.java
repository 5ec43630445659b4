package im.arun.formulary.service;

import im.arun.formulary.classify.ClassifiedLine;
import im.arun.formulary.classify.LineClassifier;
import im.arun.formulary.classify.LineGrouper;
import im.arun.formulary.classify.PageClassification;
import im.arun.formulary.config.ExtractionConfig;
import im.arun.formulary.exception.DocumentUnreadableException;
import im.arun.formulary.exception.NoExtractableTextException;
import im.arun.formulary.model.ExtractionResult;
import im.arun.formulary.model.PdfPage;
import im.arun.formulary.pdf.PdfExtractor;
import im.arun.formulary.toc.TocIndexer;
import im.arun.formulary.tree.HierarchyBuilder;
import im.arun.formulary.warning.WarningCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Drives the pages of one document through grouping, classification, the TOC indexer and
 * the hierarchy builder, strictly in physical page order.
 *
 * <p>All run state (front-matter mode, open nodes, column grid) lives inside a single
 * {@link #extract} call, so documents never share state even when one instance is reused.
 */
public class ExtractionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionCoordinator.class);

    private final ExtractionConfig config;
    private final PdfExtractor pdfExtractor;

    public ExtractionCoordinator(ExtractionConfig config) {
        this(config, new PdfExtractor());
    }

    public ExtractionCoordinator(ExtractionConfig config, PdfExtractor pdfExtractor) {
        this.config = config;
        this.pdfExtractor = pdfExtractor;
    }

    /**
     * Extract the formulary hierarchy from a PDF file.
     *
     * @throws DocumentUnreadableException when PDFBox cannot open the file
     * @throws NoExtractableTextException  when no page carries text
     */
    public ExtractionResult extract(Path pdfPath) {
        List<PdfPage> pages;
        try {
            pages = pdfExtractor.extractPages(pdfPath);
        } catch (IOException e) {
            throw new DocumentUnreadableException(pdfPath.toString(), e);
        }
        return extract(pages, pdfPath.getFileName().toString());
    }

    public ExtractionResult extract(List<PdfPage> pages) {
        return extract(pages, "document");
    }

    public ExtractionResult extract(List<PdfPage> pages, String documentName) {
        if (pages == null || pages.stream().noneMatch(PdfPage::hasText)) {
            throw new NoExtractableTextException(documentName, pages == null ? 0 : pages.size());
        }

        List<PdfPage> ordered = new ArrayList<>(pages);
        ordered.sort(Comparator.comparingInt(PdfPage::getPageNumber));

        LineGrouper grouper = new LineGrouper(config);
        LineClassifier classifier = new LineClassifier(config);
        WarningCollector warnings = new WarningCollector();
        HierarchyBuilder builder = new HierarchyBuilder(warnings, config.getColumnTolerance(), config.isLenientRows());
        TocIndexer tocIndexer = new TocIndexer();

        boolean bodyStarted = false;
        boolean previousPageWasToc = false;
        int dataRowCandidates = 0;

        for (PdfPage page : ordered) {
            boolean frontMatter = !bodyStarted
                && (page.getPageNumber() <= config.getFrontMatterPageLimit() || previousPageWasToc);
            PageClassification classification = classifier.classifyPage(page, grouper.group(page), frontMatter);

            for (ClassifiedLine line : classification.getLines()) {
                switch (line.getRole()) {
                    case TOC_ENTRY:
                        tocIndexer.accept(line);
                        break;
                    case NOISE:
                        if (line.getAnomaly() != null) {
                            warnings.record(line.getPageNumber(), line.rawText(), line.getAnomaly(), line.getContext());
                        }
                        break;
                    case CATEGORY_HEADER:
                        if (!bodyStarted) {
                            bodyStarted = true;
                            logger.info("{}: body starts on page {} with '{}'", documentName, page.getPageNumber(), line.getText());
                        }
                        builder.accept(line);
                        break;
                    case DATA_ROW:
                        dataRowCandidates++;
                        builder.accept(line);
                        break;
                    case SUBCATEGORY_HEADER:
                        builder.accept(line);
                        break;
                    default:
                        throw new IllegalStateException("Unhandled line role: " + line.getRole());
                }
            }
            previousPageWasToc = frontMatter && classification.isTocPage();
        }

        ExtractionResult result = new ExtractionResult(
            new ArrayList<>(builder.finish()),
            new ArrayList<>(warnings.getWarnings()),
            new ArrayList<>(tocIndexer.getEntries()),
            dataRowCandidates
        );

        long accounted = result.countRows() + result.countRejectedRows();
        if (accounted != dataRowCandidates) {
            logger.error("{}: {} data rows seen but {} rows + rejected rows accounted for",
                documentName, dataRowCandidates, accounted);
        }

        logger.info("{}: {} pages, {} categories, {} subcategories, {} rows, {} warnings, {} TOC entries",
            documentName, ordered.size(), result.getCategories().size(), result.countSubCategories(),
            result.countRows(), result.getWarnings().size(), result.getTableOfContents().size());
        return result;
    }
}
