package eu.nebulouscloud.ensembleforecaster.dataset;

import eu.nebulouscloud.ensembleforecaster.exception.InsufficientDataException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, timestamp-indexed table of numeric observations.
 * <p>
 * Timestamps are strictly increasing. Every field holds one value per timestamp; missing values are {@code NaN}.
 */
public final class TimeSeriesDataset {

    private final List<LocalDateTime> timestamps;
    private final Map<String, double[]> fields;

    private TimeSeriesDataset(List<LocalDateTime> timestamps, Map<String, double[]> fields) {
        this.timestamps = timestamps;
        this.fields = fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Single-field dataset, the common case for univariate forecasting.
     */
    public static TimeSeriesDataset of(List<LocalDateTime> timestamps, String field, double[] values) {
        return builder().timestamps(timestamps).field(field, values).build();
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public LocalDateTime getTimestamp(int index) {
        return timestamps.get(index);
    }

    public LocalDateTime getFirstTimestamp() {
        return timestamps.get(0);
    }

    public LocalDateTime getLastTimestamp() {
        return timestamps.get(timestamps.size() - 1);
    }

    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    public boolean hasField(String field) {
        return fields.containsKey(field);
    }

    /**
     * Raw values of a field, possibly containing {@code NaN}.
     */
    public double[] getValues(String field) {
        return requireField(field).clone();
    }

    /**
     * Values of the target field, guaranteed free of missing values.
     *
     * @throws IllegalArgumentException if the field is unknown or contains unresolved missing values
     */
    public double[] getTargetValues(String field) {
        double[] values = requireField(field);
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                throw new IllegalArgumentException(String.format(
                        "Target field '%s' has a missing value at %s", field, timestamps.get(i)));
            }
        }
        return values.clone();
    }

    public TimeSeriesDataset slice(int fromInclusive, int toExclusive) {
        if (fromInclusive < 0 || toExclusive > size() || fromInclusive > toExclusive) {
            throw new IndexOutOfBoundsException(String.format(
                    "Invalid slice [%d, %d) of dataset with %d rows", fromInclusive, toExclusive, size()));
        }
        Map<String, double[]> sliced = new LinkedHashMap<>();
        fields.forEach((name, values) -> sliced.put(name, Arrays.copyOfRange(values, fromInclusive, toExclusive)));
        return new TimeSeriesDataset(
                Collections.unmodifiableList(new ArrayList<>(timestamps.subList(fromInclusive, toExclusive))),
                Collections.unmodifiableMap(sliced));
    }

    public TimeSeriesDataset head(int rows) {
        return slice(0, Math.min(rows, size()));
    }

    public TimeSeriesDataset tail(int rows) {
        return slice(Math.max(0, size() - rows), size());
    }

    /**
     * Median spacing between consecutive timestamps, used to extend forecasts past the last observation.
     */
    public Duration inferStep() {
        if (size() < 2) {
            throw new InsufficientDataException("step inference", size(), 2);
        }
        long[] gaps = new long[size() - 1];
        for (int i = 1; i < size(); i++) {
            gaps[i - 1] = Duration.between(timestamps.get(i - 1), timestamps.get(i)).toNanos();
        }
        Arrays.sort(gaps);
        return Duration.ofNanos(gaps[gaps.length / 2]);
    }

    /**
     * Copy of this dataset with gaps in {@code field} filled by the last known value. Leading gaps stay missing.
     */
    public TimeSeriesDataset forwardFill(String field) {
        double[] values = requireField(field).clone();
        double last = Double.NaN;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = last;
            } else {
                last = values[i];
            }
        }
        Map<String, double[]> filled = new LinkedHashMap<>(fields);
        filled.put(field, values);
        return new TimeSeriesDataset(timestamps, Collections.unmodifiableMap(filled));
    }

    @Override
    public String toString() {
        return isEmpty()
                ? "TimeSeriesDataset(empty, fields=" + fields.keySet() + ")"
                : String.format("TimeSeriesDataset(%d rows %s..%s, fields=%s)",
                size(), getFirstTimestamp(), getLastTimestamp(), fields.keySet());
    }

    private double[] requireField(String field) {
        double[] values = fields.get(field);
        if (values == null) {
            throw new IllegalArgumentException("Unknown field '" + field + "', available: " + fields.keySet());
        }
        return values;
    }

    public static class Builder {
        private List<LocalDateTime> timestamps = new ArrayList<>();
        private final Map<String, double[]> fields = new LinkedHashMap<>();

        public Builder timestamps(List<LocalDateTime> timestamps) {
            this.timestamps = new ArrayList<>(timestamps);
            return this;
        }

        public Builder field(String name, double[] values) {
            fields.put(name, values.clone());
            return this;
        }

        public TimeSeriesDataset build() {
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("Dataset needs at least one field");
            }
            for (int i = 0; i < timestamps.size(); i++) {
                if (timestamps.get(i) == null) {
                    throw new IllegalArgumentException("Null timestamp at row " + i);
                }
                if (i > 0 && !timestamps.get(i).isAfter(timestamps.get(i - 1))) {
                    throw new IllegalArgumentException(String.format(
                            "Timestamps must be strictly increasing: %s follows %s",
                            timestamps.get(i), timestamps.get(i - 1)));
                }
            }
            fields.forEach((name, values) -> {
                if (values.length != timestamps.size()) {
                    throw new IllegalArgumentException(String.format(
                            "Field '%s' has %d values for %d timestamps", name, values.length, timestamps.size()));
                }
            });
            return new TimeSeriesDataset(
                    Collections.unmodifiableList(new ArrayList<>(timestamps)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
