package eu.nebulouscloud.ensembleforecaster.model.seasonal;

import com.fasterxml.jackson.databind.JsonNode;
import eu.nebulouscloud.ensembleforecaster.dataset.TimeSeriesDataset;
import eu.nebulouscloud.ensembleforecaster.exception.CorruptStateException;
import eu.nebulouscloud.ensembleforecaster.exception.InsufficientDataException;
import eu.nebulouscloud.ensembleforecaster.model.AbstractForecastModel;
import eu.nebulouscloud.ensembleforecaster.model.ForecastPoint;
import eu.nebulouscloud.ensembleforecaster.model.ForecastResult;
import eu.nebulouscloud.ensembleforecaster.model.MetricsCalculator;
import eu.nebulouscloud.ensembleforecaster.model.ValidationMetrics;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Additive decomposition forecaster: a least-squares linear trend plus a fixed-period seasonal profile.
 * <p>
 * Forecast bounds follow the regression prediction interval of the trend line, scaled by the residual
 * spread left after removing the seasonal profile. Training and forecasting are deterministic.
 */
@Slf4j
public class SeasonalDecompositionModel extends AbstractForecastModel {

    public static final String NAME = "SeasonalDecomposition";
    public static final int DEFAULT_PERIOD = 7;
    static final int MIN_OBSERVATIONS = 10;

    @Getter
    private int period;
    private State state;

    public SeasonalDecompositionModel() {
        this(DEFAULT_PERIOD);
    }

    public SeasonalDecompositionModel(int period) {
        super(NAME);
        if (period < 2) {
            throw new IllegalArgumentException("Seasonal period must be at least 2, got " + period);
        }
        this.period = period;
    }

    public int getMinimumObservations() {
        return Math.max(2 * period, MIN_OBSERVATIONS);
    }

    @Override
    public boolean isFitted() {
        return state != null;
    }

    @Override
    public void fit(TimeSeriesDataset dataset, String targetField) {
        double[] values = dataset.getTargetValues(targetField);
        int n = values.length;
        if (n < getMinimumObservations()) {
            throw new InsufficientDataException(NAME, n, getMinimumObservations());
        }
        log.info("Training {} model on {} samples with period {}", NAME, n, period);

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, values[i]);
        }
        double intercept = regression.getIntercept();
        double slope = regression.getSlope();

        double[] seasonal = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < n; i++) {
            seasonal[i % period] += values[i] - (intercept + slope * i);
            counts[i % period]++;
        }
        double seasonalMean = 0;
        for (int p = 0; p < period; p++) {
            seasonal[p] /= counts[p];
            seasonalMean += seasonal[p] / period;
        }
        for (int p = 0; p < period; p++) {
            seasonal[p] -= seasonalMean;
        }

        double[] fitted = new double[n];
        DescriptiveStatistics residuals = new DescriptiveStatistics();
        for (int i = 0; i < n; i++) {
            fitted[i] = intercept + slope * i + seasonal[i % period];
            residuals.addValue(values[i] - fitted[i]);
        }

        State fittedState = new State();
        fittedState.setPeriod(period);
        fittedState.setOrigin(dataset.getFirstTimestamp());
        fittedState.setLastTimestamp(dataset.getLastTimestamp());
        fittedState.setStepNanos(dataset.inferStep().toNanos());
        fittedState.setIntercept(intercept);
        fittedState.setSlope(slope);
        fittedState.setSeasonal(seasonal);
        fittedState.setResidualStd(residuals.getStandardDeviation());
        fittedState.setIndexSumSquares(regression.getXSumSquares());
        fittedState.setHistory(values);
        ValidationMetrics metrics = MetricsCalculator.calculate(values, fitted);
        fittedState.setTrainingMetrics(metrics.asMap());
        this.state = fittedState;
        this.trainingMetrics = metrics;

        log.info("{} model trained. Slope: {}, residual std: {}, R2: {}",
                NAME, slope, fittedState.getResidualStd(), trainingMetrics.getR2());
    }

    @Override
    public ForecastResult predict(int periods, double confidenceLevel) {
        requireFitted("predicting");
        requirePeriods(periods);
        double z = zScore(confidenceLevel);
        int n = state.getHistory().length;
        double indexMean = (n - 1) / 2.0;

        List<ForecastPoint> points = new ArrayList<>(periods);
        for (int h = 1; h <= periods; h++) {
            long t = n - 1L + h;
            double value = valueAt(t);
            double leverage = 1 + 1.0 / n + (t - indexMean) * (t - indexMean) / state.getIndexSumSquares();
            double halfWidth = z * state.getResidualStd() * Math.sqrt(leverage);
            points.add(new ForecastPoint(
                    state.getLastTimestamp().plusNanos(state.getStepNanos() * h),
                    value,
                    value - halfWidth,
                    value + halfWidth));
        }
        log.debug("Generated {} predictions with {} model", periods, NAME);
        return new ForecastResult(NAME, points);
    }

    @Override
    public ValidationMetrics validate(TimeSeriesDataset dataset, String targetField) {
        requireFitted("validation");
        if (dataset.isEmpty()) {
            throw new InsufficientDataException(NAME + " validation", 0, 1);
        }
        double[] actual = dataset.getTargetValues(targetField);
        double[] predicted = new double[actual.length];
        for (int i = 0; i < actual.length; i++) {
            predicted[i] = valueAt(indexOf(dataset.getTimestamp(i)));
        }
        ValidationMetrics metrics = MetricsCalculator.calculate(actual, predicted);
        log.info("{} validation completed. MAE: {}", NAME, metrics.getMae());
        return metrics;
    }

    /**
     * Trend, seasonal and residual parts of every training observation.
     */
    public Decomposition getComponents() {
        requireFitted("decomposing");
        double[] history = state.getHistory();
        double[] trend = new double[history.length];
        double[] seasonal = new double[history.length];
        double[] residual = new double[history.length];
        for (int i = 0; i < history.length; i++) {
            trend[i] = state.getIntercept() + state.getSlope() * i;
            seasonal[i] = state.getSeasonal()[i % state.getPeriod()];
            residual[i] = history[i] - trend[i] - seasonal[i];
        }
        return new Decomposition(trend, seasonal, residual);
    }

    @Override
    public JsonNode exportState() {
        requireFitted("exporting state");
        return writeState(state);
    }

    @Override
    public void restoreState(JsonNode node) {
        State restored = readState(node, State.class);
        if (restored.getPeriod() < 2
                || restored.getSeasonal() == null
                || restored.getSeasonal().length != restored.getPeriod()
                || restored.getHistory() == null
                || restored.getHistory().length < 2
                || restored.getOrigin() == null
                || restored.getLastTimestamp() == null
                || restored.getStepNanos() <= 0
                || !(restored.getIndexSumSquares() > 0)) {
            throw new CorruptStateException("Incomplete state for model " + NAME);
        }
        this.period = restored.getPeriod();
        this.state = restored;
        this.trainingMetrics = restored.getTrainingMetrics() == null
                ? ValidationMetrics.empty()
                : new ValidationMetrics(restored.getTrainingMetrics());
    }

    private double valueAt(long index) {
        return state.getIntercept() + state.getSlope() * index
                + state.getSeasonal()[(int) Math.floorMod(index, (long) state.getPeriod())];
    }

    private long indexOf(LocalDateTime timestamp) {
        long nanos = Duration.between(state.getOrigin(), timestamp).toNanos();
        return Math.round((double) nanos / state.getStepNanos());
    }

    @Getter
    @AllArgsConstructor
    public static class Decomposition {
        private final double[] trend;
        private final double[] seasonal;
        private final double[] residual;

        @Override
        public String toString() {
            return "Decomposition(rows=" + trend.length + ", seasonal=" + Arrays.toString(seasonal) + ")";
        }
    }

    @Data
    @NoArgsConstructor
    static class State {
        private int period;
        private LocalDateTime origin;
        private LocalDateTime lastTimestamp;
        private long stepNanos;
        private double intercept;
        private double slope;
        private double[] seasonal;
        private double residualStd;
        private double indexSumSquares;
        private double[] history;
        private Map<String, Double> trainingMetrics;
    }
}
