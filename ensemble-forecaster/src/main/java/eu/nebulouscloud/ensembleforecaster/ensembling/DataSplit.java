package eu.nebulouscloud.ensembleforecaster.ensembling;

import eu.nebulouscloud.ensembleforecaster.dataset.TimeSeriesDataset;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Chronological split of a dataset into a training head and a validation tail.
 */
@Getter
@AllArgsConstructor
@ToString
public class DataSplit {
    private final TimeSeriesDataset training;
    private final TimeSeriesDataset validation;
    private final int splitIndex;
}
