package eu.nebulouscloud.ensembleforecaster.ensembling;

import eu.nebulouscloud.ensembleforecaster.TestDatasets;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightVector;
import eu.nebulouscloud.ensembleforecaster.exception.NoComponentsAvailableException;
import eu.nebulouscloud.ensembleforecaster.exception.PredictionAlignmentException;
import eu.nebulouscloud.ensembleforecaster.model.ForecastPoint;
import eu.nebulouscloud.ensembleforecaster.model.ForecastResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ForecastCombinerTest {

    private static final double Z_95 = 1.959963984540054;

    private final ForecastCombiner combiner = new ForecastCombiner();

    private static ForecastResult constant(String name, double value, int firstDay, int days) {
        List<ForecastPoint> points = new ArrayList<>();
        for (int d = firstDay; d < firstDay + days; d++) {
            LocalDateTime timestamp = TestDatasets.START.plusDays(d);
            points.add(new ForecastPoint(timestamp, value, value - 1, value + 1));
        }
        return new ForecastResult(name, points);
    }

    private static Map<String, ForecastResult> forecasts(ForecastResult... results) {
        Map<String, ForecastResult> map = new LinkedHashMap<>();
        for (ForecastResult result : results) {
            map.put(result.getModelName(), result);
        }
        return map;
    }

    @Test
    void weightsPointsAndWidensForDisagreement() {
        WeightVector weights = WeightVector.normalize(Map.of("A", 3.0, "B", 1.0));

        ForecastResult combined = combiner.combine(
                forecasts(constant("A", 10, 0, 3), constant("B", 20, 0, 3)), weights, 0.95);

        assertEquals(ForecastCombiner.ENSEMBLE_MODEL_NAME, combined.getModelName());
        assertEquals(3, combined.size());
        ForecastPoint first = combined.getPoints().get(0);
        assertEquals(12.5, first.getPredictedValue(), 1e-9);
        // population std of {10, 20} is 5
        assertEquals(12.5 - Z_95 * 5, first.getLowerBound(), 1e-6);
        assertEquals(12.5 + Z_95 * 5, first.getUpperBound(), 1e-6);
    }

    @Test
    void agreeingModelsKeepWeightedBounds() {
        WeightVector weights = WeightVector.equal(List.of("A", "B"));

        ForecastPoint point = combiner.combine(
                forecasts(constant("A", 7, 0, 1), constant("B", 7, 0, 1)), weights, 0.95).getPoints().get(0);

        assertEquals(7, point.getPredictedValue(), 1e-12);
        assertEquals(6, point.getLowerBound(), 1e-12);
        assertEquals(8, point.getUpperBound(), 1e-12);
    }

    @Test
    void combinesOnlyCommonTimestamps() {
        WeightVector weights = WeightVector.equal(List.of("A", "B"));

        ForecastResult combined = combiner.combine(
                forecasts(constant("A", 1, 0, 3), constant("B", 3, 1, 3)), weights, 0.9);

        assertEquals(List.of(TestDatasets.START.plusDays(1), TestDatasets.START.plusDays(2)), combined.getTimestamps());
        assertEquals(2, combined.getPoints().get(0).getPredictedValue(), 1e-12);
    }

    @Test
    void disjointForecastsCannotBeCombined() {
        WeightVector weights = WeightVector.equal(List.of("A", "B"));

        assertThrows(PredictionAlignmentException.class, () -> combiner.combine(
                forecasts(constant("A", 1, 0, 2), constant("B", 3, 5, 2)), weights, 0.9));
        assertThrows(NoComponentsAvailableException.class, () -> combiner.combine(Map.of(), weights, 0.9));
    }

    @Test
    void renormalizesOverSurvivingModels() {
        WeightVector weights = WeightVector.normalize(Map.of("A", 0.5, "B", 0.3, "C", 0.2));

        ForecastResult combined = combiner.combine(
                forecasts(constant("A", 0, 0, 1), constant("B", 8, 0, 1)), weights, 0.95);

        assertEquals(0.375 * 8, combined.getPoints().get(0).getPredictedValue(), 1e-9);
    }

    @Test
    void zeroWeightSurvivorsAreCombinedEqually() {
        WeightVector weights = WeightVector.normalize(Map.of("A", 0.0, "B", 0.0, "C", 1.0));

        ForecastResult combined = combiner.combine(
                forecasts(constant("A", 2, 0, 1), constant("B", 4, 0, 1)), weights, 0.95);

        assertEquals(3, combined.getPoints().get(0).getPredictedValue(), 1e-12);
    }
}
