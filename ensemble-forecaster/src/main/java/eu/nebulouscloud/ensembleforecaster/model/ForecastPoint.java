package eu.nebulouscloud.ensembleforecaster.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
public class ForecastPoint {
    private final LocalDateTime timestamp;
    private final double predictedValue;
    private final double lowerBound;
    private final double upperBound;
}
