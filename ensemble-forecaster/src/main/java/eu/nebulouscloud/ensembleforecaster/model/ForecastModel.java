package eu.nebulouscloud.ensembleforecaster.model;

import com.fasterxml.jackson.databind.JsonNode;
import eu.nebulouscloud.ensembleforecaster.dataset.TimeSeriesDataset;

import java.nio.file.Path;

/**
 * Capability contract shared by every forecasting model, including the ensemble itself.
 * <p>
 * A model is created unfit, trained with {@link #fit}, and may then be asked for forecasts and
 * validation metrics any number of times. Implementations are not thread-safe.
 */
public interface ForecastModel {

    String getName();

    boolean isFitted();

    /**
     * Trains on the whole supplied dataset.
     *
     * @throws eu.nebulouscloud.ensembleforecaster.exception.InsufficientDataException if the dataset is too short
     */
    void fit(TimeSeriesDataset dataset, String targetField);

    /**
     * Forecasts {@code periods} rows following the end of the training data.
     *
     * @throws eu.nebulouscloud.ensembleforecaster.exception.NotFittedException if called before {@link #fit}
     */
    ForecastResult predict(int periods, double confidenceLevel);

    /**
     * Compares the model's predictions with the target values of {@code dataset}. Never changes fitted state.
     */
    ValidationMetrics validate(TimeSeriesDataset dataset, String targetField);

    /**
     * In-sample metrics recorded by the last {@link #fit}.
     */
    ValidationMetrics getTrainingMetrics();

    ModelInfo getModelInfo();

    boolean save(Path location);

    boolean load(Path location);

    /**
     * Fitted state as a JSON tree, sufficient to reproduce {@link #predict} and {@link #validate} exactly.
     */
    JsonNode exportState();

    void restoreState(JsonNode state);
}
