package eu.nebulouscloud.ensembleforecaster.ensembling.weighting;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable combination weights keyed by model name. A non-empty vector sums to one; entries keep the
 * order they were given in, which fixes the summation order of every weighted combination.
 */
@EqualsAndHashCode
public final class WeightVector {

    private static final WeightVector EMPTY = new WeightVector(Collections.emptyMap());

    private final Map<String, Double> weights;

    private WeightVector(Map<String, Double> weights) {
        this.weights = weights;
    }

    public static WeightVector empty() {
        return EMPTY;
    }

    public static WeightVector equal(Collection<String> names) {
        Map<String, Double> raw = new LinkedHashMap<>();
        for (String name : names) {
            raw.put(name, 1.0);
        }
        return normalize(raw);
    }

    /**
     * Scales non-negative scores so they sum to one.
     *
     * @throws IllegalArgumentException for negative or non-finite scores, or a non-positive total
     */
    public static WeightVector normalize(Map<String, Double> scores) {
        if (scores.isEmpty()) {
            return EMPTY;
        }
        double total = 0;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            Double score = entry.getValue();
            if (score == null || !Double.isFinite(score) || score < 0) {
                throw new IllegalArgumentException(String.format(
                        "Weight of %s must be a non-negative number, got %s", entry.getKey(), score));
            }
            total += score;
        }
        if (!(total > 0)) {
            throw new IllegalArgumentException("Weights must have a positive total, got " + total);
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            normalized.put(entry.getKey(), entry.getValue() / total);
        }
        return new WeightVector(Collections.unmodifiableMap(normalized));
    }

    public double get(String name) {
        return weights.getOrDefault(name, 0.0);
    }

    public boolean contains(String name) {
        return weights.containsKey(name);
    }

    public Set<String> getNames() {
        return weights.keySet();
    }

    public int size() {
        return weights.size();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public double sum() {
        double total = 0;
        for (double weight : weights.values()) {
            total += weight;
        }
        return total;
    }

    /**
     * Weights of the given models only, renormalized over them. Falls back to equal weights when
     * the subset carries no weight at all.
     */
    public WeightVector restrictTo(List<String> names) {
        Map<String, Double> subset = new LinkedHashMap<>();
        double total = 0;
        for (String name : names) {
            subset.put(name, get(name));
            total += get(name);
        }
        return total > 0 ? normalize(subset) : equal(names);
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
