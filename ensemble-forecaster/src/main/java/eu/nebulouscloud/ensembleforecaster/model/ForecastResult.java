package eu.nebulouscloud.ensembleforecaster.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered forecast rows produced by one model. Every row satisfies {@code lower <= predicted <= upper}
 * and timestamps are strictly increasing.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ForecastResult {

    private final String modelName;
    private final List<ForecastPoint> points;

    public ForecastResult(String modelName, List<ForecastPoint> points) {
        this.modelName = modelName;
        for (int i = 0; i < points.size(); i++) {
            ForecastPoint point = points.get(i);
            if (!(point.getLowerBound() <= point.getPredictedValue()
                    && point.getPredictedValue() <= point.getUpperBound())) {
                throw new IllegalArgumentException(String.format(
                        "Forecast of %s at %s violates lower <= predicted <= upper: %s",
                        modelName, point.getTimestamp(), point));
            }
            if (i > 0 && !point.getTimestamp().isAfter(points.get(i - 1).getTimestamp())) {
                throw new IllegalArgumentException(String.format(
                        "Forecast of %s has non-increasing timestamp %s", modelName, point.getTimestamp()));
            }
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public int size() {
        return points.size();
    }

    public List<LocalDateTime> getTimestamps() {
        List<LocalDateTime> timestamps = new ArrayList<>(points.size());
        for (ForecastPoint point : points) {
            timestamps.add(point.getTimestamp());
        }
        return timestamps;
    }

    public double[] getPredictedValues() {
        return points.stream().mapToDouble(ForecastPoint::getPredictedValue).toArray();
    }

    public Map<LocalDateTime, ForecastPoint> byTimestamp() {
        Map<LocalDateTime, ForecastPoint> indexed = new LinkedHashMap<>();
        for (ForecastPoint point : points) {
            indexed.put(point.getTimestamp(), point);
        }
        return indexed;
    }
}
