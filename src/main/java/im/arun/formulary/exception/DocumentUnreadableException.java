package im.arun.formulary.exception;

/**
 * The source document could not be opened or parsed by PDFBox (missing, corrupt or encrypted).
 */
public class DocumentUnreadableException extends ExtractionException {

    public DocumentUnreadableException(String document, Throwable cause) {
        super("Unable to read PDF document: " + document, cause);
    }
}
