package eu.nebulouscloud.ensembleforecaster.exception;

public class NoComponentsAvailableException extends ForecastingException {

    public NoComponentsAvailableException(String message) {
        super(message);
    }
}
