package eu.nebulouscloud.ensembleforecaster.exception;

public class PredictionAlignmentException extends ForecastingException {

    public PredictionAlignmentException(String message) {
        super(message);
    }
}
