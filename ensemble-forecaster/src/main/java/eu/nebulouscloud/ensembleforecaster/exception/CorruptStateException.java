package eu.nebulouscloud.ensembleforecaster.exception;

/**
 * A persisted state document is structurally invalid or incomplete.
 */
public class CorruptStateException extends ForecastingException {

    public CorruptStateException(String message) {
        super(message);
    }

    public CorruptStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
