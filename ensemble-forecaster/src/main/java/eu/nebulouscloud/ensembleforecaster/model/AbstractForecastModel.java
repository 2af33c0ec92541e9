package eu.nebulouscloud.ensembleforecaster.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.nebulouscloud.ensembleforecaster.exception.CorruptStateException;
import eu.nebulouscloud.ensembleforecaster.exception.NotFittedException;
import eu.nebulouscloud.ensembleforecaster.persistence.JsonStateMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Common plumbing for component models: argument guards, the normal quantile and file persistence.
 */
@Slf4j
public abstract class AbstractForecastModel implements ForecastModel {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    @Getter
    private final String name;

    @Getter
    protected ValidationMetrics trainingMetrics = ValidationMetrics.empty();

    protected AbstractForecastModel(String name) {
        this.name = name;
    }

    /**
     * Two-sided standard normal quantile, e.g. 1.96 for a 0.95 level.
     */
    public static double zScore(double confidenceLevel) {
        requireConfidenceLevel(confidenceLevel);
        return STANDARD_NORMAL.inverseCumulativeProbability(0.5 + confidenceLevel / 2);
    }

    public static void requireConfidenceLevel(double confidenceLevel) {
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1), got " + confidenceLevel);
        }
    }

    public static void requirePeriods(int periods) {
        if (periods < 1) {
            throw new IllegalArgumentException("Number of periods must be positive, got " + periods);
        }
    }

    @Override
    public ModelInfo getModelInfo() {
        return new ModelInfo(name, isFitted(), getTrainingMetrics().asMap());
    }

    protected void requireFitted(String operation) {
        if (!isFitted()) {
            throw new NotFittedException(name, operation);
        }
    }

    @Override
    public boolean save(Path location) {
        requireFitted("saving");
        ObjectNode document = JsonStateMapper.get().createObjectNode();
        document.put("modelName", name);
        document.set("state", exportState());
        try {
            JsonStateMapper.get().writeValue(location.toFile(), document);
            log.info("Model {} saved to {}", name, location);
            return true;
        } catch (IOException e) {
            log.error("Error saving model {} to {}", name, location, e);
            return false;
        }
    }

    @Override
    public boolean load(Path location) {
        byte[] content;
        try {
            content = Files.readAllBytes(location);
        } catch (IOException e) {
            log.error("Error loading model {} from {}", name, location, e);
            return false;
        }
        JsonNode document;
        try {
            document = JsonStateMapper.get().readTree(content);
        } catch (IOException e) {
            throw new CorruptStateException("Model document at " + location + " is not valid JSON", e);
        }
        if (document == null || !document.path("state").isObject()) {
            throw new CorruptStateException("Model document at " + location + " has no state");
        }
        String storedName = document.path("modelName").asText();
        if (!name.equals(storedName)) {
            throw new CorruptStateException(String.format(
                    "Model document at %s belongs to '%s', not '%s'", location, storedName, name));
        }
        restoreState(document.get("state"));
        log.info("Model {} loaded from {}", name, location);
        return true;
    }

    /**
     * Maps a persisted state tree onto the model's state class, reporting malformed input as corrupt state.
     */
    protected <T> T readState(JsonNode state, Class<T> stateClass) {
        if (state == null || !state.isObject()) {
            throw new CorruptStateException("State of model " + name + " is not a JSON object");
        }
        try {
            return JsonStateMapper.get().treeToValue(state, stateClass);
        } catch (IOException | IllegalArgumentException e) {
            throw new CorruptStateException("Unreadable state for model " + name + ": " + e.getMessage(), e);
        }
    }

    protected JsonNode writeState(Object state) {
        return JsonStateMapper.get().valueToTree(state);
    }
}
