package eu.nebulouscloud.ensembleforecaster.registry;

import eu.nebulouscloud.ensembleforecaster.EnsembleProperties;
import eu.nebulouscloud.ensembleforecaster.StubForecastModel;
import eu.nebulouscloud.ensembleforecaster.exception.NoComponentsAvailableException;
import eu.nebulouscloud.ensembleforecaster.model.ForecastModel;
import eu.nebulouscloud.ensembleforecaster.model.seasonal.SeasonalDecompositionModel;
import eu.nebulouscloud.ensembleforecaster.model.sequence.SequenceRegressionModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ModelRegistryTest {

    private static ModelDefinition unavailable(String name) {
        return new ModelDefinition(name, () -> {
            throw new ModelUnavailableException(name + " needs org.example.missing.Library");
        });
    }

    private static ModelDefinition unlinkable(String name) {
        return new ModelDefinition(name, () -> {
            throw new NoClassDefFoundError("org/apache/commons/math3/linear/LUDecomposition");
        });
    }

    @Test
    void defaultsCoverShippedModels() {
        ModelRegistry registry = ModelRegistry.withDefaults(new EnsembleProperties());

        assertEquals(List.of(SeasonalDecompositionModel.NAME, SequenceRegressionModel.NAME), registry.getModelNames());
        List<ForecastModel> roster = registry.createDefaultRoster();
        assertEquals(2, roster.size());
        roster.forEach(model -> assertFalse(model.isFitted()));
    }

    @Test
    void appliesConfiguredParameters() {
        EnsembleProperties properties = new EnsembleProperties();
        properties.setSeasonalPeriod(12);
        properties.setSequenceLookback(5);
        ModelRegistry registry = ModelRegistry.withDefaults(properties);

        assertEquals(12, ((SeasonalDecompositionModel) registry.create(SeasonalDecompositionModel.NAME)).getPeriod());
        assertEquals(5, ((SequenceRegressionModel) registry.create(SequenceRegressionModel.NAME)).getLookback());
    }

    @Test
    void createsFreshInstances() {
        ModelRegistry registry = ModelRegistry.withDefaults(new EnsembleProperties());

        assertNotSame(registry.create(SeasonalDecompositionModel.NAME), registry.create(SeasonalDecompositionModel.NAME));
        assertThrows(IllegalArgumentException.class, () -> registry.create("Prophet"));
    }

    @Test
    void skipsUnavailableModels() {
        ModelRegistry registry = new ModelRegistry(List.of(
                unavailable("Missing"),
                new ModelDefinition("Available", () -> new StubForecastModel("Available", 1))));

        List<ForecastModel> roster = registry.createDefaultRoster();

        assertEquals(1, roster.size());
        assertEquals("Available", roster.get(0).getName());
        assertThrows(ModelUnavailableException.class, () -> registry.create("Missing"));
    }

    @Test
    void skipsModelsWhoseLibraryCannotBeLinked() {
        ModelRegistry registry = new ModelRegistry(List.of(
                unlinkable("Unlinked"),
                new ModelDefinition("Available", () -> new StubForecastModel("Available", 1))));

        List<ForecastModel> roster = registry.createDefaultRoster();

        assertEquals(1, roster.size());
        assertEquals("Available", roster.get(0).getName());
    }

    @Test
    void failsWhenNothingIsAvailable() {
        ModelRegistry registry = new ModelRegistry(List.of(unavailable("First"), unlinkable("Second")));

        assertThrows(NoComponentsAvailableException.class, registry::createDefaultRoster);
    }

    @Test
    void rejectsInconsistentDefinitions() {
        assertThrows(IllegalArgumentException.class, () -> new ModelRegistry(List.of(
                new ModelDefinition("A", () -> new StubForecastModel("A", 1)),
                new ModelDefinition("A", () -> new StubForecastModel("A", 2)))));

        ModelRegistry misnamed = new ModelRegistry(List.of(
                new ModelDefinition("A", () -> new StubForecastModel("B", 1))));
        assertThrows(IllegalStateException.class, () -> misnamed.create("A"));
    }
}
