package eu.nebulouscloud.ensembleforecaster.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Regression accuracy metrics shared by every forecasting model.
 */
public final class MetricsCalculator {

    private MetricsCalculator() {
    }

    public static ValidationMetrics calculate(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException(String.format(
                    "Cannot compare %d actual values with %d predictions", actual.length, predicted.length));
        }
        if (actual.length == 0) {
            throw new IllegalArgumentException("Cannot compute metrics on empty series");
        }
        int n = actual.length;
        double absoluteErrorSum = 0;
        double squaredErrorSum = 0;
        double actualSum = 0;
        double percentageErrorSum = 0;
        int nonZeroActuals = 0;
        for (int i = 0; i < n; i++) {
            double error = actual[i] - predicted[i];
            absoluteErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            actualSum += actual[i];
            if (actual[i] != 0) {
                percentageErrorSum += Math.abs(error / actual[i]);
                nonZeroActuals++;
            }
        }
        double actualMean = actualSum / n;
        double totalSumOfSquares = 0;
        for (double value : actual) {
            totalSumOfSquares += (value - actualMean) * (value - actualMean);
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        double mse = squaredErrorSum / n;
        metrics.put(ValidationMetrics.MAE, absoluteErrorSum / n);
        metrics.put(ValidationMetrics.MSE, mse);
        metrics.put(ValidationMetrics.RMSE, Math.sqrt(mse));
        if (totalSumOfSquares == 0) {
            metrics.put(ValidationMetrics.R2, squaredErrorSum == 0 ? 1.0 : 0.0);
        } else {
            metrics.put(ValidationMetrics.R2, 1 - squaredErrorSum / totalSumOfSquares);
        }
        metrics.put(ValidationMetrics.MAPE, nonZeroActuals == 0 ? Double.NaN : percentageErrorSum / nonZeroActuals * 100);
        if (n > 1) {
            metrics.put(ValidationMetrics.DIRECTION_ACCURACY, directionAccuracy(actual, predicted));
        }
        return new ValidationMetrics(metrics);
    }

    private static double directionAccuracy(double[] actual, double[] predicted) {
        int matches = 0;
        for (int i = 1; i < actual.length; i++) {
            if (Math.signum(actual[i] - actual[i - 1]) == Math.signum(predicted[i] - predicted[i - 1])) {
                matches++;
            }
        }
        return (double) matches / (actual.length - 1);
    }
}
