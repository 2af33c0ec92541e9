package eu.nebulouscloud.ensembleforecaster.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends ForecastingException {

    private final int available;
    private final int required;

    public InsufficientDataException(String subject, int available, int required) {
        super(String.format("Insufficient data for %s: %d observations available, %d required",
                subject, available, required));
        this.available = available;
        this.required = required;
    }
}
