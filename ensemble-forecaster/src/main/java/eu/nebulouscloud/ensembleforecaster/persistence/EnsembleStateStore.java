package eu.nebulouscloud.ensembleforecaster.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightVector;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightingPolicy;
import eu.nebulouscloud.ensembleforecaster.exception.CorruptStateException;
import eu.nebulouscloud.ensembleforecaster.model.ForecastModel;
import eu.nebulouscloud.ensembleforecaster.registry.ModelRegistry;
import eu.nebulouscloud.ensembleforecaster.registry.ModelUnavailableException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a trained ensemble to and from one versioned JSON document. Component models are rebuilt
 * through the {@link ModelRegistry} and restored from their own sub-documents.
 */
@Slf4j
@AllArgsConstructor
public class EnsembleStateStore {

    public static final int SCHEMA_VERSION = 1;

    private final ModelRegistry modelRegistry;

    public JsonNode encode(WeightingPolicy policy, WeightVector weights, List<ForecastModel> roster) {
        Map<String, JsonNode> components = new LinkedHashMap<>();
        for (ForecastModel model : roster) {
            components.put(model.getName(), model.exportState());
        }
        EnsembleState state = new EnsembleState(
                SCHEMA_VERSION,
                policy.getId(),
                new LinkedHashMap<>(weights.asMap()),
                components);
        return JsonStateMapper.get().valueToTree(state);
    }

    /**
     * Rebuilds every persisted piece. Nothing is returned unless all of them are present and valid.
     *
     * @throws CorruptStateException if the document is invalid or incomplete
     */
    public Snapshot decode(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new CorruptStateException("Ensemble state is not a JSON object");
        }
        EnsembleState state;
        try {
            state = JsonStateMapper.get().treeToValue(document, EnsembleState.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new CorruptStateException("Unreadable ensemble state: " + e.getMessage(), e);
        }
        if (state.getSchemaVersion() != SCHEMA_VERSION) {
            throw new CorruptStateException(String.format(
                    "Unsupported ensemble state version %d, expected %d", state.getSchemaVersion(), SCHEMA_VERSION));
        }

        WeightingPolicy policy;
        try {
            policy = WeightingPolicy.fromId(state.getWeightingPolicy());
        } catch (IllegalArgumentException e) {
            throw new CorruptStateException("Unknown weighting policy in ensemble state: " + state.getWeightingPolicy(), e);
        }

        Map<String, Double> weights = state.getWeights();
        Map<String, JsonNode> components = state.getComponents();
        if (weights == null || weights.isEmpty() || components == null || components.isEmpty()) {
            throw new CorruptStateException("Ensemble state has no weights or no component models");
        }
        if (!weights.keySet().equals(components.keySet())) {
            throw new CorruptStateException(String.format(
                    "Weighted models %s do not match stored component models %s",
                    weights.keySet(), components.keySet()));
        }
        WeightVector weightVector;
        try {
            weightVector = WeightVector.normalize(weights);
        } catch (IllegalArgumentException e) {
            throw new CorruptStateException("Invalid weights in ensemble state: " + e.getMessage(), e);
        }

        List<ForecastModel> roster = new ArrayList<>();
        for (String name : weights.keySet()) {
            roster.add(restoreComponent(name, components.get(name)));
        }
        log.debug("Decoded ensemble state with policy {} and models {}", policy.getId(), weights.keySet());
        return new Snapshot(policy, weightVector, Collections.unmodifiableList(roster));
    }

    public boolean write(Path location, JsonNode document) {
        try {
            JsonStateMapper.get().writeValue(location.toFile(), document);
            log.info("Ensemble state saved to {}", location);
            return true;
        } catch (IOException e) {
            log.error("Error saving ensemble state to {}", location, e);
            return false;
        }
    }

    /**
     * @throws IOException           if the location cannot be read
     * @throws CorruptStateException if it does not hold JSON
     */
    public JsonNode read(Path location) throws IOException {
        byte[] content = Files.readAllBytes(location);
        try {
            return JsonStateMapper.get().readTree(content);
        } catch (IOException e) {
            throw new CorruptStateException("Ensemble state at " + location + " is not valid JSON", e);
        }
    }

    private ForecastModel restoreComponent(String name, JsonNode componentState) {
        ForecastModel model;
        try {
            model = modelRegistry.create(name);
        } catch (IllegalArgumentException | IllegalStateException | ModelUnavailableException e) {
            throw new CorruptStateException("Cannot rebuild component model " + name + ": " + e.getMessage(), e);
        }
        try {
            model.restoreState(componentState);
        } catch (CorruptStateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CorruptStateException("Cannot restore component model " + name + ": " + e.getMessage(), e);
        }
        if (!model.isFitted()) {
            throw new CorruptStateException("Component model " + name + " is not fitted after restoring its state");
        }
        return model;
    }

    @Getter
    @AllArgsConstructor
    public static class Snapshot {
        private final WeightingPolicy policy;
        private final WeightVector weights;
        private final List<ForecastModel> roster;
    }
}
