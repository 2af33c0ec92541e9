package eu.nebulouscloud.ensembleforecaster.model.sequence;

import com.fasterxml.jackson.databind.JsonNode;
import eu.nebulouscloud.ensembleforecaster.dataset.TimeSeriesDataset;
import eu.nebulouscloud.ensembleforecaster.exception.CorruptStateException;
import eu.nebulouscloud.ensembleforecaster.exception.InsufficientDataException;
import eu.nebulouscloud.ensembleforecaster.model.AbstractForecastModel;
import eu.nebulouscloud.ensembleforecaster.model.ForecastPoint;
import eu.nebulouscloud.ensembleforecaster.model.ForecastResult;
import eu.nebulouscloud.ensembleforecaster.model.MetricsCalculator;
import eu.nebulouscloud.ensembleforecaster.model.ValidationMetrics;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Sequence learner that maps a sliding window of past target values to the next value.
 * <p>
 * The target is standardized with the model's own scaler, then window coefficients are fitted by ridge
 * regression. Multi-step forecasts are produced recursively, feeding each prediction back into the window,
 * so the band widens with the square root of the horizon. Training is deterministic.
 */
@Slf4j
public class SequenceRegressionModel extends AbstractForecastModel {

    public static final String NAME = "SequenceRegression";
    public static final int DEFAULT_LOOKBACK = 14;
    public static final int DEFAULT_MIN_SEQUENCES = 20;
    public static final double DEFAULT_REGULARIZATION = 1e-3;

    @Getter
    private int lookback;
    @Getter
    private final int minSequences;
    @Getter
    private double regularization;
    private State state;

    public SequenceRegressionModel() {
        this(DEFAULT_LOOKBACK, DEFAULT_MIN_SEQUENCES, DEFAULT_REGULARIZATION);
    }

    public SequenceRegressionModel(int lookback, int minSequences, double regularization) {
        super(NAME);
        if (lookback < 1) {
            throw new IllegalArgumentException("Lookback must be positive, got " + lookback);
        }
        if (minSequences < 1) {
            throw new IllegalArgumentException("Minimum number of sequences must be positive, got " + minSequences);
        }
        if (!(regularization >= 0)) {
            throw new IllegalArgumentException("Regularization must be non-negative, got " + regularization);
        }
        this.lookback = lookback;
        this.minSequences = minSequences;
        this.regularization = regularization;
    }

    public int getMinimumObservations() {
        return lookback + minSequences;
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
        log.info("Training {} model on {} samples with lookback {}", NAME, n, lookback);

        DescriptiveStatistics targetStatistics = new DescriptiveStatistics(values);
        double mean = targetStatistics.getMean();
        double std = targetStatistics.getStandardDeviation();
        if (!(std > 0)) {
            std = 1.0;
        }
        double[] scaled = new double[n];
        for (int i = 0; i < n; i++) {
            scaled[i] = (values[i] - mean) / std;
        }

        int sequences = n - lookback;
        RealMatrix design = new Array2DRowRealMatrix(sequences, lookback + 1);
        RealVector response = new ArrayRealVector(sequences);
        for (int r = 0; r < sequences; r++) {
            design.setEntry(r, 0, 1.0);
            for (int j = 0; j < lookback; j++) {
                design.setEntry(r, j + 1, scaled[r + j]);
            }
            response.setEntry(r, scaled[r + lookback]);
        }
        RealMatrix normal = design.transpose().multiply(design);
        // intercept is not penalized
        for (int j = 1; j <= lookback; j++) {
            normal.addToEntry(j, j, regularization * sequences);
        }
        RealVector coefficients = new LUDecomposition(normal).getSolver()
                .solve(design.transpose().operate(response));

        State fittedState = new State();
        fittedState.setLookback(lookback);
        fittedState.setRegularization(regularization);
        fittedState.setMean(mean);
        fittedState.setStd(std);
        fittedState.setCoefficients(coefficients.toArray());
        fittedState.setTail(Arrays.copyOfRange(values, n - lookback, n));
        fittedState.setLastTimestamp(dataset.getLastTimestamp());
        fittedState.setStepNanos(dataset.inferStep().toNanos());

        double[] actual = Arrays.copyOfRange(values, lookback, n);
        double[] predicted = new double[sequences];
        DescriptiveStatistics residuals = new DescriptiveStatistics();
        for (int r = 0; r < sequences; r++) {
            predicted[r] = predictNext(fittedState, values, r);
            residuals.addValue(actual[r] - predicted[r]);
        }
        fittedState.setResidualStd(residuals.getStandardDeviation());
        ValidationMetrics metrics = MetricsCalculator.calculate(actual, predicted);
        fittedState.setTrainingMetrics(metrics.asMap());
        this.state = fittedState;
        this.trainingMetrics = metrics;

        log.info("{} model trained on {} sequences. Residual std: {}, R2: {}",
                NAME, sequences, fittedState.getResidualStd(), trainingMetrics.getR2());
    }

    @Override
    public ForecastResult predict(int periods, double confidenceLevel) {
        requireFitted("predicting");
        requirePeriods(periods);
        double z = zScore(confidenceLevel);

        double[] window = state.getTail().clone();
        List<ForecastPoint> points = new ArrayList<>(periods);
        for (int h = 1; h <= periods; h++) {
            double value = predictNext(state, window, 0);
            System.arraycopy(window, 1, window, 0, window.length - 1);
            window[window.length - 1] = value;

            double halfWidth = z * state.getResidualStd() * Math.sqrt(h);
            points.add(new ForecastPoint(
                    state.getLastTimestamp().plusNanos(state.getStepNanos() * h),
                    value,
                    value - halfWidth,
                    value + halfWidth));
        }
        log.debug("Generated {} predictions with {} model", periods, NAME);
        return new ForecastResult(NAME, points);
    }

    /**
     * One-step-ahead accuracy over {@code dataset}. A dataset that starts after the training data is
     * primed with the stored training tail; otherwise its own first {@code lookback} rows prime the window.
     */
    @Override
    public ValidationMetrics validate(TimeSeriesDataset dataset, String targetField) {
        requireFitted("validation");
        if (dataset.isEmpty()) {
            throw new InsufficientDataException(NAME + " validation", 0, lookback + 1);
        }
        double[] actual = dataset.getTargetValues(targetField);
        double[] context;
        if (dataset.getFirstTimestamp().isAfter(state.getLastTimestamp())) {
            context = new double[lookback + actual.length];
            System.arraycopy(state.getTail(), 0, context, 0, lookback);
            System.arraycopy(actual, 0, context, lookback, actual.length);
        } else {
            context = actual;
        }
        int compared = context.length - lookback;
        if (compared < 1) {
            throw new InsufficientDataException(NAME + " validation", dataset.size(), lookback + 1);
        }
        double[] expected = Arrays.copyOfRange(context, lookback, context.length);
        double[] predicted = new double[compared];
        for (int r = 0; r < compared; r++) {
            predicted[r] = predictNext(state, context, r);
        }
        ValidationMetrics metrics = MetricsCalculator.calculate(expected, predicted);
        log.info("{} validation completed. MAE: {}", NAME, metrics.getMae());
        return metrics;
    }

    @Override
    public JsonNode exportState() {
        requireFitted("exporting state");
        return writeState(state);
    }

    @Override
    public void restoreState(JsonNode node) {
        State restored = readState(node, State.class);
        if (restored.getLookback() < 1
                || restored.getCoefficients() == null
                || restored.getCoefficients().length != restored.getLookback() + 1
                || restored.getTail() == null
                || restored.getTail().length != restored.getLookback()
                || restored.getLastTimestamp() == null
                || restored.getStepNanos() <= 0
                || !(restored.getStd() > 0)) {
            throw new CorruptStateException("Incomplete state for model " + NAME);
        }
        this.lookback = restored.getLookback();
        this.regularization = restored.getRegularization();
        this.state = restored;
        this.trainingMetrics = restored.getTrainingMetrics() == null
                ? ValidationMetrics.empty()
                : new ValidationMetrics(restored.getTrainingMetrics());
    }

    /**
     * Predicts the value following {@code series[offset, offset + lookback)}, in original units.
     */
    private static double predictNext(State state, double[] series, int offset) {
        double[] coefficients = state.getCoefficients();
        double scaled = coefficients[0];
        for (int j = 0; j < state.getLookback(); j++) {
            scaled += coefficients[j + 1] * (series[offset + j] - state.getMean()) / state.getStd();
        }
        return scaled * state.getStd() + state.getMean();
    }

    @Data
    @NoArgsConstructor
    static class State {
        private int lookback;
        private double regularization;
        private double mean;
        private double std;
        private double[] coefficients;
        private double[] tail;
        private LocalDateTime lastTimestamp;
        private long stepNanos;
        private double residualStd;
        private Map<String, Double> trainingMetrics;
    }
}
