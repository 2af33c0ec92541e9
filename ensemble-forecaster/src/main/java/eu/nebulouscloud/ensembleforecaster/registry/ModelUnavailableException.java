package eu.nebulouscloud.ensembleforecaster.registry;

/**
 * A model definition cannot build its model in this runtime, e.g. because a library it loads
 * on demand is absent. Thrown by {@link ModelDefinition} factories.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
