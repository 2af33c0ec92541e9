package eu.nebulouscloud.ensembleforecaster.exception;

import lombok.Getter;

/**
 * A single component model failed during fit. The ensemble recovers by dropping it from the roster.
 */
@Getter
public class ComponentTrainingException extends ForecastingException {

    private final String modelName;

    public ComponentTrainingException(String modelName, Throwable cause) {
        super("Failed to train component model " + modelName + ": " + cause.getMessage(), cause);
        this.modelName = modelName;
    }
}
