package eu.nebulouscloud.ensembleforecaster.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Accuracy of one model against one dataset, keyed by metric name.
 */
@EqualsAndHashCode
public class ValidationMetrics {

    public static final String MAE = "mae";
    public static final String MSE = "mse";
    public static final String RMSE = "rmse";
    public static final String R2 = "r2";
    public static final String MAPE = "mape";
    public static final String DIRECTION_ACCURACY = "direction_accuracy";

    private final Map<String, Double> values;

    public ValidationMetrics(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ValidationMetrics empty() {
        return new ValidationMetrics(Collections.emptyMap());
    }

    public OptionalDouble get(String metric) {
        Double value = values.get(metric);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public double getMae() {
        return values.getOrDefault(MAE, Double.NaN);
    }

    public double getRmse() {
        return values.getOrDefault(RMSE, Double.NaN);
    }

    public double getR2() {
        return values.getOrDefault(R2, Double.NaN);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ValidationMetrics" + values;
    }
}
