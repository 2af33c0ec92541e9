package eu.nebulouscloud.ensembleforecaster.ensembling;

import com.fasterxml.jackson.databind.JsonNode;
import eu.nebulouscloud.ensembleforecaster.EnsembleProperties;
import eu.nebulouscloud.ensembleforecaster.dataset.TimeSeriesDataset;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightCalculator;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightVector;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightingPolicy;
import eu.nebulouscloud.ensembleforecaster.exception.InsufficientDataException;
import eu.nebulouscloud.ensembleforecaster.exception.NoComponentsAvailableException;
import eu.nebulouscloud.ensembleforecaster.model.AbstractForecastModel;
import eu.nebulouscloud.ensembleforecaster.model.ForecastModel;
import eu.nebulouscloud.ensembleforecaster.model.ForecastResult;
import eu.nebulouscloud.ensembleforecaster.model.ValidationMetrics;
import eu.nebulouscloud.ensembleforecaster.persistence.EnsembleStateStore;
import eu.nebulouscloud.ensembleforecaster.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.queue.CircularFifoQueue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Trains a set of component models, weights them by validation accuracy and merges their forecasts.
 * <p>
 * The ensemble owns its component models and its weights. It is meant for one caller at a time;
 * only the training of components inside {@link #fit} runs in parallel.
 */
@Slf4j
public class EnsembleForecaster extends AbstractForecastModel {

    public static final String NAME = ForecastCombiner.ENSEMBLE_MODEL_NAME;
    static final int MIN_OBSERVATIONS = 2;

    private final List<ForecastModel> candidates;
    private final TrainingCoordinator trainingCoordinator;
    private final ForecastCombiner forecastCombiner;
    private final EnsembleStateStore stateStore;
    private final double minWeightFraction;
    private final int minValidationSize;
    private final boolean refitOnFullDataset;
    private final CircularFifoQueue<TrainingSummary> trainingHistory;

    private WeightCalculator weightCalculator;
    private List<ForecastModel> roster = Collections.emptyList();
    private WeightVector weights = WeightVector.empty();
    private Map<String, ValidationMetrics> componentMetrics = Collections.emptyMap();
    private TrainingSummary trainingSummary;
    private boolean fitted;

    /**
     * @param candidates    component models to train on every fit; may be empty
     * @param properties    ensemble tunables
     * @param modelRegistry rebuilds component models by name when loading saved state
     */
    public EnsembleForecaster(List<ForecastModel> candidates, EnsembleProperties properties, ModelRegistry modelRegistry) {
        super(NAME);
        Set<String> names = new HashSet<>();
        for (ForecastModel candidate : candidates) {
            if (!names.add(candidate.getName())) {
                throw new IllegalArgumentException("Duplicate component model name: " + candidate.getName());
            }
        }
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.trainingCoordinator = new TrainingCoordinator(
                properties.getValidationFraction(), properties.getMaxParallelism());
        this.forecastCombiner = new ForecastCombiner();
        this.stateStore = new EnsembleStateStore(modelRegistry);
        this.minWeightFraction = properties.getMinWeightFraction();
        this.weightCalculator = new WeightCalculator(properties.getWeightingPolicyType(), minWeightFraction);
        this.minValidationSize = properties.getMinValidationSize();
        this.refitOnFullDataset = properties.isRefitOnFullDataset();
        this.trainingHistory = new CircularFifoQueue<>(Math.max(1, properties.getHistorySize()));
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    @Override
    public void fit(TimeSeriesDataset dataset, String targetField) {
        fitted = false;
        roster = Collections.emptyList();
        weights = WeightVector.empty();
        componentMetrics = Collections.emptyMap();

        if (candidates.isEmpty()) {
            throw new NoComponentsAvailableException("No component models available for ensemble");
        }
        if (dataset.size() < MIN_OBSERVATIONS) {
            throw new InsufficientDataException(NAME, dataset.size(), MIN_OBSERVATIONS);
        }
        dataset.getTargetValues(targetField);
        log.info("Training ensemble with {} component models", candidates.size());

        DataSplit split = trainingCoordinator.split(dataset);
        if (split.getTraining().isEmpty()) {
            throw new InsufficientDataException(NAME + " training slice", 0, 1);
        }
        TrainingOutcome outcome = trainingCoordinator.train(candidates, split.getTraining(), targetField);
        if (outcome.isEmpty()) {
            throw new NoComponentsAvailableException(
                    "No component models trained successfully, failed: " + outcome.getFailures().keySet());
        }
        List<ForecastModel> survivors = outcome.getTrained();
        List<String> failed = new ArrayList<>(outcome.getFailures().keySet());

        Map<String, ValidationMetrics> metrics = new LinkedHashMap<>();
        WeightVector newWeights;
        boolean weightedByValidation = split.getValidation().size() >= minValidationSize;
        if (weightedByValidation) {
            metrics = validateComponents(survivors, split.getValidation(), targetField);
            newWeights = weightCalculator.calculate(outcome.getTrainedNames(), metrics);
        } else {
            log.info("Validation slice has {} rows, fewer than {}: using equal weights",
                    split.getValidation().size(), minValidationSize);
            newWeights = WeightVector.equal(outcome.getTrainedNames());
        }

        if (refitOnFullDataset && !split.getValidation().isEmpty()) {
            log.info("Refitting {} component models on all {} rows", survivors.size(), dataset.size());
            TrainingOutcome refit = trainingCoordinator.train(survivors, dataset, targetField);
            if (refit.isEmpty()) {
                throw new NoComponentsAvailableException(
                        "No component models survived refitting, failed: " + refit.getFailures().keySet());
            }
            failed.addAll(refit.getFailures().keySet());
            survivors = refit.getTrained();
            newWeights = newWeights.restrictTo(refit.getTrainedNames());
        }

        roster = Collections.unmodifiableList(new ArrayList<>(survivors));
        weights = newWeights;
        componentMetrics = Collections.unmodifiableMap(metrics);
        trainingMetrics = aggregate(trainingMetricsByModel(), weights);
        fitted = true;

        trainingSummary = new TrainingSummary(
                Instant.now(),
                roster.size(),
                weightCalculator.getPolicy().getId(),
                weights.asMap(),
                Collections.unmodifiableList(failed),
                split.getTraining().size(),
                split.getValidation().size(),
                weightedByValidation);
        trainingHistory.add(trainingSummary);
        log.info("Ensemble model trained with weights: {}", weights);
    }

    @Override
    public ForecastResult predict(int periods, double confidenceLevel) {
        requireFitted("predicting");
        requirePeriods(periods);
        requireConfidenceLevel(confidenceLevel);

        Map<String, ForecastResult> forecasts = new LinkedHashMap<>();
        for (ForecastModel model : roster) {
            try {
                forecasts.put(model.getName(), model.predict(periods, confidenceLevel));
            } catch (RuntimeException e) {
                log.warn("Error getting predictions from {}, leaving it out of this forecast: {}",
                        model.getName(), e.getMessage());
            }
        }
        if (forecasts.isEmpty()) {
            throw new NoComponentsAvailableException("No component models provided predictions");
        }

        ForecastResult combined = forecastCombiner.combine(forecasts, weights, confidenceLevel);
        if (combined.size() < periods) {
            log.warn("Component forecasts share only {} of {} requested periods", combined.size(), periods);
        }
        log.info("Generated ensemble forecast for {} periods from {} models", combined.size(), forecasts.size());
        return combined;
    }

    /**
     * Weighted average of the metrics of every component that validates successfully, with the
     * weights renormalized over those components.
     */
    @Override
    public ValidationMetrics validate(TimeSeriesDataset dataset, String targetField) {
        requireFitted("validation");
        Map<String, ValidationMetrics> metrics = validateComponents(roster, dataset, targetField);
        if (metrics.isEmpty()) {
            throw new NoComponentsAvailableException("No component models validated successfully");
        }
        // models that validated may all carry zero weight after a manual override
        WeightVector effective = weights.restrictTo(new ArrayList<>(metrics.keySet()));
        ValidationMetrics combined = aggregate(metrics, effective);
        if (combined.isEmpty()) {
            throw new NoComponentsAvailableException("No component models produced usable validation metrics");
        }
        log.info("Ensemble validation completed. MAE: {}", combined.getMae());
        return combined;
    }

    /**
     * Current combination weights; empty before the first fit.
     */
    public WeightVector getWeights() {
        return weights;
    }

    /**
     * Replaces the weights manually. Roster models missing from {@code newWeights} get zero weight and
     * the result is renormalized to sum to one.
     *
     * @throws IllegalArgumentException for unknown models, negative weights or a non-positive total
     */
    public void updateWeights(Map<String, Double> newWeights) {
        requireFitted("updating weights");
        List<String> names = getRosterNames();
        for (String name : newWeights.keySet()) {
            if (!names.contains(name)) {
                throw new IllegalArgumentException("Model " + name + " is not part of the roster " + names);
            }
        }
        Map<String, Double> complete = new LinkedHashMap<>();
        for (String name : names) {
            complete.put(name, newWeights.containsKey(name) ? newWeights.get(name) : 0.0);
        }
        weights = WeightVector.normalize(complete);
        log.info("Updated model weights: {}", weights);
    }

    public WeightingPolicy getWeightingPolicy() {
        return weightCalculator.getPolicy();
    }

    /**
     * Models that every fit starts from, whether or not they survived the last one.
     */
    public List<String> getCandidateNames() {
        return candidates.stream().map(ForecastModel::getName).collect(Collectors.toList());
    }

    public List<ForecastModel> getRoster() {
        return roster;
    }

    public List<String> getRosterNames() {
        return roster.stream().map(ForecastModel::getName).collect(Collectors.toList());
    }

    /**
     * Validation metrics gathered for weighting during the last fit.
     */
    public Map<String, ValidationMetrics> getComponentMetrics() {
        return componentMetrics;
    }

    public TrainingSummary getTrainingSummary() {
        return trainingSummary;
    }

    public List<TrainingSummary> getTrainingHistory() {
        return new ArrayList<>(trainingHistory);
    }

    @Override
    public JsonNode exportState() {
        requireFitted("exporting state");
        return stateStore.encode(weightCalculator.getPolicy(), weights, roster);
    }

    /**
     * Replaces roster, weights and policy with the persisted ones. The current state is kept if the
     * document is invalid.
     */
    @Override
    public void restoreState(JsonNode state) {
        EnsembleStateStore.Snapshot snapshot = stateStore.decode(state);
        weightCalculator = new WeightCalculator(snapshot.getPolicy(), minWeightFraction);
        roster = snapshot.getRoster();
        weights = snapshot.getWeights();
        componentMetrics = Collections.emptyMap();
        trainingMetrics = aggregate(trainingMetricsByModel(), weights);
        fitted = true;
        log.info("Ensemble restored with policy {} and weights {}", snapshot.getPolicy().getId(), weights);
    }

    @Override
    public boolean save(Path location) {
        requireFitted("saving");
        return stateStore.write(location, exportState());
    }

    @Override
    public boolean load(Path location) {
        JsonNode document;
        try {
            document = stateStore.read(location);
        } catch (IOException e) {
            log.error("Error loading ensemble state from {}", location, e);
            return false;
        }
        restoreState(document);
        return true;
    }

    private Map<String, ValidationMetrics> validateComponents(List<ForecastModel> models,
                                                              TimeSeriesDataset dataset,
                                                              String targetField) {
        Map<String, ValidationMetrics> metrics = new LinkedHashMap<>();
        for (ForecastModel model : models) {
            try {
                metrics.put(model.getName(), model.validate(dataset, targetField));
            } catch (RuntimeException e) {
                log.warn("Error validating {}: {}", model.getName(), e.getMessage());
            }
        }
        return metrics;
    }

    private Map<String, ValidationMetrics> trainingMetricsByModel() {
        Map<String, ValidationMetrics> metrics = new LinkedHashMap<>();
        for (ForecastModel model : roster) {
            metrics.put(model.getName(), model.getTrainingMetrics());
        }
        return metrics;
    }

    /**
     * Per metric, the average over the models reporting it, weighted by their ensemble weight.
     */
    static ValidationMetrics aggregate(Map<String, ValidationMetrics> metricsByModel, WeightVector weights) {
        Map<String, Double> weightedSums = new LinkedHashMap<>();
        Map<String, Double> weightTotals = new LinkedHashMap<>();
        metricsByModel.forEach((name, metrics) -> {
            double weight = weights.get(name);
            metrics.asMap().forEach((metric, value) -> {
                if (Double.isFinite(value)) {
                    weightedSums.merge(metric, weight * value, Double::sum);
                    weightTotals.merge(metric, weight, Double::sum);
                }
            });
        });
        Map<String, Double> combined = new LinkedHashMap<>();
        weightedSums.forEach((metric, sum) -> {
            double total = weightTotals.get(metric);
            if (total > 0) {
                combined.put(metric, sum / total);
            }
        });
        return new ValidationMetrics(combined);
    }
}
