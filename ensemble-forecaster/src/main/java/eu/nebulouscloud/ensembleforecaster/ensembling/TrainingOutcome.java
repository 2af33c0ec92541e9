package eu.nebulouscloud.ensembleforecaster.ensembling;

import eu.nebulouscloud.ensembleforecaster.exception.ComponentTrainingException;
import eu.nebulouscloud.ensembleforecaster.model.ForecastModel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of one training round: the models that trained, in roster order, and the failure of every other one.
 */
@Getter
public class TrainingOutcome {

    private final List<ForecastModel> trained;
    private final Map<String, ComponentTrainingException> failures;

    public TrainingOutcome(List<ForecastModel> trained, Map<String, ComponentTrainingException> failures) {
        this.trained = Collections.unmodifiableList(new ArrayList<>(trained));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public List<String> getTrainedNames() {
        return trained.stream().map(ForecastModel::getName).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return trained.isEmpty();
    }
}
