package im.arun.formulary.exception;

/**
 * Base unchecked exception for failures that stop the extraction of one document.
 * Layout ambiguities never surface as exceptions; they are recorded as warnings.
 */
public abstract class ExtractionException extends RuntimeException {

    protected ExtractionException(String message) {
        super(message);
    }

    protected ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
