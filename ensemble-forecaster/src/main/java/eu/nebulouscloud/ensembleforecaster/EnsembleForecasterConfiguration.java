package eu.nebulouscloud.ensembleforecaster;

import eu.nebulouscloud.ensembleforecaster.ensembling.EnsembleForecaster;
import eu.nebulouscloud.ensembleforecaster.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class EnsembleForecasterConfiguration {

    @Bean
    public ModelRegistry modelRegistry(EnsembleProperties properties) {
        return ModelRegistry.withDefaults(properties);
    }

    @Bean
    public EnsembleForecaster ensembleForecaster(ModelRegistry modelRegistry, EnsembleProperties properties) {
        log.info("Creating ensemble forecaster with {}", properties);
        return new EnsembleForecaster(modelRegistry.createDefaultRoster(), properties, modelRegistry);
    }
}
