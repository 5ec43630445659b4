package im.arun.formulary.exception;

/**
 * Writing the spreadsheet failed. JSON output produced before rendering is unaffected.
 */
public class RenderingException extends RuntimeException {

    public RenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
