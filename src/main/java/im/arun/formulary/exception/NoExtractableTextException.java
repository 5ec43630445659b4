package im.arun.formulary.exception;

/**
 * The document opened but none of its pages carries extractable text (image-only scan).
 */
public class NoExtractableTextException extends ExtractionException {

    public NoExtractableTextException(String document, int pageCount) {
        super("No extractable text in " + document + " (" + pageCount + " pages); OCR is not supported");
    }
}
