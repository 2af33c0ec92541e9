package eu.nebulouscloud.ensembleforecaster.ensembling.weighting;

import eu.nebulouscloud.ensembleforecaster.model.ValidationMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns per-model validation error into combination weights.
 * <ul>
 *     <li>{@code equal}: every model gets {@code 1 / n}.</li>
 *     <li>{@code performance}: weights proportional to {@code 1 / (mae + epsilon)}.</li>
 *     <li>{@code adaptive}: as performance, with each score floored at a share of the score total.</li>
 * </ul>
 * A model without usable metrics keeps a small fixed score rather than being excluded.
 */
@Slf4j
@Getter
public class WeightCalculator {

    public static final double EPSILON = 1e-8;
    public static final double FAILED_VALIDATION_SCORE = 0.1;

    private final WeightingPolicy policy;
    private final double minWeightFraction;

    public WeightCalculator(WeightingPolicy policy, double minWeightFraction) {
        if (!(minWeightFraction >= 0 && minWeightFraction <= 1)) {
            throw new IllegalArgumentException("Minimum weight fraction must be in [0, 1], got " + minWeightFraction);
        }
        this.policy = policy;
        this.minWeightFraction = minWeightFraction;
    }

    /**
     * @param roster           surviving models, in roster order
     * @param metricsByModel   validation metrics of the models that validated; absent models failed validation
     */
    public WeightVector calculate(List<String> roster, Map<String, ValidationMetrics> metricsByModel) {
        if (roster.isEmpty()) {
            return WeightVector.empty();
        }
        WeightVector weights;
        switch (policy) {
            case EQUAL: {
                weights = WeightVector.equal(roster);
                break;
            }
            case PERFORMANCE: {
                weights = WeightVector.normalize(rawScores(roster, metricsByModel));
                break;
            }
            case ADAPTIVE: {
                weights = WeightVector.normalize(applyFloor(rawScores(roster, metricsByModel)));
                break;
            }
            default: {
                throw new IllegalArgumentException("Weighting policy not present in the system");
            }
        }
        log.debug("Calculated {} weights: {}", policy.getId(), weights);
        return weights;
    }

    /**
     * Inverse-error score of each model, before any normalization.
     */
    public Map<String, Double> rawScores(List<String> roster, Map<String, ValidationMetrics> metricsByModel) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String name : roster) {
            ValidationMetrics metrics = metricsByModel.get(name);
            double mae = metrics == null ? Double.NaN : metrics.getMae();
            if (Double.isFinite(mae) && mae >= 0) {
                scores.put(name, 1.0 / (mae + EPSILON));
            } else {
                log.warn("No usable validation error for {}, assigning score {}", name, FAILED_VALIDATION_SCORE);
                scores.put(name, FAILED_VALIDATION_SCORE);
            }
        }
        return scores;
    }

    /**
     * Raises every score to at least {@code minWeightFraction} of the original score total.
     */
    public Map<String, Double> applyFloor(Map<String, Double> scores) {
        double total = 0;
        for (double score : scores.values()) {
            total += score;
        }
        double floor = minWeightFraction * total;
        Map<String, Double> floored = new LinkedHashMap<>();
        scores.forEach((name, score) -> floored.put(name, Math.max(score, floor)));
        return floored;
    }
}
