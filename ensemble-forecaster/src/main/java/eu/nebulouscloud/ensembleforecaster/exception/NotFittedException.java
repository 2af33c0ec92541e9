package eu.nebulouscloud.ensembleforecaster.exception;

public class NotFittedException extends ForecastingException {

    public NotFittedException(String modelName, String operation) {
        super(String.format("Model %s must be fitted before %s", modelName, operation));
    }
}
