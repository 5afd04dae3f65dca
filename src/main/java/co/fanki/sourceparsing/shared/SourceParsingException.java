package co.fanki.sourceparsing.shared;

/**
 * Raised when the parsing infrastructure itself fails.
 *
 * <p>Malformed source text never produces this exception. It signals that
 * a collaborator the parsers depend on could not do its job, for example
 * the embedded Python runtime failing to start or returning an unreadable
 * answer. Parsers catch it and degrade to their fallback path.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceParsingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when the embedded Python runtime fails. */
    public static final String PYTHON_ENGINE_ERROR = "PYTHON_ENGINE_ERROR";

    private final String errorCode;

    /**
     * Creates a new exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code
     */
    public SourceParsingException(final String message,
            final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates a new exception with message, error code, and cause.
     *
     * @param message the error message
     * @param errorCode the specific error code
     * @param cause the underlying cause
     */
    public SourceParsingException(final String message,
            final String errorCode, final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
