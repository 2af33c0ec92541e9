package eu.nebulouscloud.ensembleforecaster.exception;

/**
 * Base type of every error raised by the forecasting engine.
 */
public class ForecastingException extends RuntimeException {

    public ForecastingException(String message) {
        super(message);
    }

    public ForecastingException(String message, Throwable cause) {
        super(message, cause);
    }
}
