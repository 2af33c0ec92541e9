package eu.nebulouscloud.ensembleforecaster.registry;

import eu.nebulouscloud.ensembleforecaster.model.ForecastModel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.function.Supplier;

/**
 * A known model type: the name its instances carry and how to build a fresh, unfit instance.
 */
@Getter
@AllArgsConstructor
@ToString(of = "name")
public class ModelDefinition {
    private final String name;
    private final Supplier<ForecastModel> factory;
}
