package im.arun.formulary.pdf;

import im.arun.formulary.model.PdfPage;
import im.arun.formulary.model.TextToken;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF token extractor using Apache PDFBox.
 * Turns each page into positioned text tokens with font metadata.
 */
public class PdfExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PdfExtractor.class);

    /**
     * Extract pages from a PDF file.
     *
     * @param pdfPath Path to the PDF file
     * @return pages in physical order, 1-indexed
     * @throws IOException If PDF cannot be read
     */
    public List<PdfPage> extractPages(Path pdfPath) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            return extractPagesFromDocument(document);
        }
    }

    /**
     * Extract pages from a PDF byte array.
     *
     * @param pdfBytes PDF file as byte array
     * @return pages in physical order, 1-indexed
     * @throws IOException If PDF cannot be read
     */
    public List<PdfPage> extractPages(byte[] pdfBytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            return extractPagesFromDocument(document);
        }
    }

    public List<PdfPage> extractPages(InputStream inputStream) throws IOException {
        return extractPages(inputStream.readAllBytes());
    }

    private List<PdfPage> extractPagesFromDocument(PDDocument document) throws IOException {
        int totalPages = document.getNumberOfPages();
        List<PdfPage> pages = new ArrayList<>(totalPages);

        // PDFBox is not thread-safe per document, so pages are stripped one after another
        PositionedTextStripper stripper = new PositionedTextStripper();
        for (int i = 0; i < totalPages; i++) {
            PDPage page = document.getPage(i);
            PDRectangle box = page.getCropBox();
            float width = box.getWidth();
            float height = box.getHeight();
            if (page.getRotation() % 180 != 0) {
                width = box.getHeight();
                height = box.getWidth();
            }
            List<TextToken> tokens = stripper.stripPage(document, i + 1);
            pages.add(new PdfPage(i + 1, width, height, tokens));
        }

        logger.info("Extracted {} pages from PDF", totalPages);
        return pages;
    }
}
