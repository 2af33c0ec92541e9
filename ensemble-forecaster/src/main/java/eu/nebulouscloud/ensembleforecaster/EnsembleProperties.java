package eu.nebulouscloud.ensembleforecaster;

import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightingPolicy;
import eu.nebulouscloud.ensembleforecaster.model.seasonal.SeasonalDecompositionModel;
import eu.nebulouscloud.ensembleforecaster.model.sequence.SequenceRegressionModel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Tunables of the ensemble and of the shipped component models. Field initializers hold the defaults
 * used when the class is built outside a Spring context.
 */
@Configuration
@Getter
@Setter
@ToString
public class EnsembleProperties {

    @Value("${ensemble.weighting.policy:performance}")
    private String weightingPolicy = WeightingPolicy.PERFORMANCE.getId();

    @Value("${ensemble.weighting.min-weight-fraction:0.1}")
    private double minWeightFraction = 0.1;

    @Value("${ensemble.training.validation-fraction:0.2}")
    private double validationFraction = 0.2;

    @Value("${ensemble.training.max-parallelism:4}")
    private int maxParallelism = 4;

    @Value("${ensemble.training.min-validation-size:10}")
    private int minValidationSize = 10;

    @Value("${ensemble.training.refit-on-full-dataset:false}")
    private boolean refitOnFullDataset = false;

    @Value("${ensemble.history.size:20}")
    private int historySize = 20;

    @Value("${ensemble.models.seasonal.period:7}")
    private int seasonalPeriod = SeasonalDecompositionModel.DEFAULT_PERIOD;

    @Value("${ensemble.models.sequence.lookback:14}")
    private int sequenceLookback = SequenceRegressionModel.DEFAULT_LOOKBACK;

    @Value("${ensemble.models.sequence.min-sequences:20}")
    private int sequenceMinSequences = SequenceRegressionModel.DEFAULT_MIN_SEQUENCES;

    @Value("${ensemble.models.sequence.regularization:0.001}")
    private double sequenceRegularization = SequenceRegressionModel.DEFAULT_REGULARIZATION;

    public WeightingPolicy getWeightingPolicyType() {
        return WeightingPolicy.fromId(weightingPolicy);
    }
}
