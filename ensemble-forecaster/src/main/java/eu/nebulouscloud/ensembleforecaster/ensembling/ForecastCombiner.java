package eu.nebulouscloud.ensembleforecaster.ensembling;

import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightVector;
import eu.nebulouscloud.ensembleforecaster.exception.NoComponentsAvailableException;
import eu.nebulouscloud.ensembleforecaster.exception.PredictionAlignmentException;
import eu.nebulouscloud.ensembleforecaster.model.AbstractForecastModel;
import eu.nebulouscloud.ensembleforecaster.model.ForecastPoint;
import eu.nebulouscloud.ensembleforecaster.model.ForecastResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Merges component forecasts into one weighted forecast.
 * <p>
 * Only timestamps present in every forecast are combined. The combined band is the weighted average of the
 * component bands, widened wherever the spread of the component point forecasts would justify more.
 */
@Slf4j
public class ForecastCombiner {

    public static final String ENSEMBLE_MODEL_NAME = "Ensemble";

    /**
     * @param forecasts forecasts of the models that predicted successfully, in roster order
     * @param weights   stored ensemble weights; renormalized over the models in {@code forecasts}
     */
    public ForecastResult combine(Map<String, ForecastResult> forecasts, WeightVector weights, double confidenceLevel) {
        if (forecasts.isEmpty()) {
            throw new NoComponentsAvailableException("No component forecasts to combine");
        }
        double z = AbstractForecastModel.zScore(confidenceLevel);
        List<String> names = new ArrayList<>(forecasts.keySet());

        TreeSet<LocalDateTime> common = null;
        for (ForecastResult forecast : forecasts.values()) {
            if (common == null) {
                common = new TreeSet<>(forecast.getTimestamps());
            } else {
                common.retainAll(forecast.getTimestamps());
            }
        }
        if (common.isEmpty()) {
            throw new PredictionAlignmentException("No common prediction periods among component models " + names);
        }

        double survivingWeight = 0;
        for (String name : names) {
            survivingWeight += weights.get(name);
        }
        if (!(survivingWeight > 0)) {
            log.warn("Models {} carry no weight, combining them equally", names);
        }
        WeightVector effective = weights.restrictTo(names);

        List<Map<LocalDateTime, ForecastPoint>> indexed = new ArrayList<>(names.size());
        for (String name : names) {
            indexed.add(forecasts.get(name).byTimestamp());
        }

        StandardDeviation disagreement = new StandardDeviation(false);
        List<ForecastPoint> combined = new ArrayList<>(common.size());
        for (LocalDateTime timestamp : common) {
            double point = 0;
            double lower = 0;
            double upper = 0;
            double[] pointForecasts = new double[names.size()];
            for (int i = 0; i < names.size(); i++) {
                ForecastPoint component = indexed.get(i).get(timestamp);
                double weight = effective.get(names.get(i));
                point += weight * component.getPredictedValue();
                lower += weight * component.getLowerBound();
                upper += weight * component.getUpperBound();
                pointForecasts[i] = component.getPredictedValue();
            }
            double spread = disagreement.evaluate(pointForecasts);
            lower = Math.min(Math.min(lower, point - z * spread), point);
            upper = Math.max(Math.max(upper, point + z * spread), point);
            combined.add(new ForecastPoint(timestamp, point, lower, upper));
        }
        log.debug("Combined {} forecasts over {} common periods", names.size(), combined.size());
        return new ForecastResult(ENSEMBLE_MODEL_NAME, combined);
    }
}
