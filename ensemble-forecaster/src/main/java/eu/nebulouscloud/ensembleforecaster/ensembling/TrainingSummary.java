package eu.nebulouscloud.ensembleforecaster.ensembling;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate metadata of one completed ensemble fit.
 */
@Data
@AllArgsConstructor
public class TrainingSummary {
    private final Instant completedAt;
    private final int rosterSize;
    private final String weightingPolicy;
    private final Map<String, Double> weights;
    private final List<String> failedModels;
    private final int trainingRows;
    private final int validationRows;
    private final boolean weightedByValidation;
}
