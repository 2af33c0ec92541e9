package eu.nebulouscloud.ensembleforecaster.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * Snapshot of a model's identity and training state.
 */
@Data
@AllArgsConstructor
public class ModelInfo {
    private final String name;
    private final boolean fitted;
    private final Map<String, Double> trainingMetrics;
}
