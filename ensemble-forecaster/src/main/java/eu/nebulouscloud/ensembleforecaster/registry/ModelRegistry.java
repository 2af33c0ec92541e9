package eu.nebulouscloud.ensembleforecaster.registry;

import eu.nebulouscloud.ensembleforecaster.EnsembleProperties;
import eu.nebulouscloud.ensembleforecaster.exception.NoComponentsAvailableException;
import eu.nebulouscloud.ensembleforecaster.model.ForecastModel;
import eu.nebulouscloud.ensembleforecaster.model.seasonal.SeasonalDecompositionModel;
import eu.nebulouscloud.ensembleforecaster.model.sequence.SequenceRegressionModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds component models by name. Model types whose optional runtime dependency is missing are
 * left out of the default roster instead of failing the whole ensemble.
 */
@Slf4j
public class ModelRegistry {

    private final Map<String, ModelDefinition> definitions = new LinkedHashMap<>();

    public ModelRegistry(List<ModelDefinition> definitions) {
        for (ModelDefinition definition : definitions) {
            if (this.definitions.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate model definition: " + definition.getName());
            }
        }
    }

    /**
     * Registry of the shipped component models, configured from {@code properties}.
     */
    public static ModelRegistry withDefaults(EnsembleProperties properties) {
        return new ModelRegistry(List.of(
                new ModelDefinition(SeasonalDecompositionModel.NAME,
                        () -> new SeasonalDecompositionModel(properties.getSeasonalPeriod())),
                new ModelDefinition(SequenceRegressionModel.NAME,
                        () -> new SequenceRegressionModel(
                                properties.getSequenceLookback(),
                                properties.getSequenceMinSequences(),
                                properties.getSequenceRegularization()))
        ));
    }

    public List<String> getModelNames() {
        return Collections.unmodifiableList(new ArrayList<>(definitions.keySet()));
    }

    /**
     * Instantiates every known model type, skipping those that are unavailable at runtime.
     * <p>
     * The shipped models link commons-math3 directly, so a missing library surfaces as a
     * {@link LinkageError} when their class is first loaded; that error is the gate for them.
     * Factories of other model types may also throw {@link ModelUnavailableException}.
     *
     * @throws NoComponentsAvailableException if no model type could be instantiated
     */
    public List<ForecastModel> createDefaultRoster() {
        List<ForecastModel> roster = new ArrayList<>();
        for (ModelDefinition definition : definitions.values()) {
            try {
                roster.add(definition.getFactory().get());
            } catch (ModelUnavailableException | LinkageError e) {
                log.warn("{} model not available: {}", definition.getName(), e.getMessage());
            }
        }
        if (roster.isEmpty()) {
            throw new NoComponentsAvailableException(
                    "No component models available, tried " + definitions.keySet());
        }
        log.info("Built default roster of {} component models: {}", roster.size(),
                roster.stream().map(ForecastModel::getName).collect(Collectors.toList()));
        return roster;
    }

    /**
     * Builds a fresh, unfit instance of the named model type.
     *
     * @throws IllegalArgumentException  if no model type has that name
     * @throws ModelUnavailableException if the model type is unavailable at runtime
     */
    public ForecastModel create(String name) {
        ModelDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown model type '" + name + "', known: " + definitions.keySet());
        }
        ForecastModel model = definition.getFactory().get();
        if (!name.equals(model.getName())) {
            throw new IllegalStateException(String.format(
                    "Definition '%s' built a model named '%s'", name, model.getName()));
        }
        return model;
    }
}
