package eu.nebulouscloud.ensembleforecaster.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.nebulouscloud.ensembleforecaster.EnsembleProperties;
import eu.nebulouscloud.ensembleforecaster.StubForecastModel;
import eu.nebulouscloud.ensembleforecaster.TestDatasets;
import eu.nebulouscloud.ensembleforecaster.ensembling.EnsembleForecaster;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightVector;
import eu.nebulouscloud.ensembleforecaster.ensembling.weighting.WeightingPolicy;
import eu.nebulouscloud.ensembleforecaster.exception.CorruptStateException;
import eu.nebulouscloud.ensembleforecaster.exception.NotFittedException;
import eu.nebulouscloud.ensembleforecaster.model.ForecastResult;
import eu.nebulouscloud.ensembleforecaster.registry.ModelDefinition;
import eu.nebulouscloud.ensembleforecaster.registry.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static eu.nebulouscloud.ensembleforecaster.TestDatasets.TARGET;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnsembleStateStoreTest {

    @TempDir
    Path tempDir;

    private EnsembleProperties properties;
    private ModelRegistry stubRegistry;

    private static StubForecastModel stub(String name, double value, double mae) {
        StubForecastModel model = new StubForecastModel(name, value);
        model.setValidationMae(mae);
        return model;
    }

    @BeforeEach
    void setUp() {
        properties = new EnsembleProperties();
        stubRegistry = new ModelRegistry(List.of(
                new ModelDefinition("A", () -> stub("A", 10, 1)),
                new ModelDefinition("B", () -> stub("B", 20, 3))));
    }

    private EnsembleForecaster fittedStubEnsemble() {
        EnsembleForecaster ensemble = new EnsembleForecaster(stubRegistry.createDefaultRoster(), properties, stubRegistry);
        ensemble.fit(TestDatasets.daily(60), TARGET);
        return ensemble;
    }

    @Test
    void roundTripsShippedModels() {
        ModelRegistry registry = ModelRegistry.withDefaults(properties);
        EnsembleForecaster ensemble = new EnsembleForecaster(registry.createDefaultRoster(), properties, registry);
        ensemble.fit(TestDatasets.daily(120), TARGET);
        Path file = tempDir.resolve("ensemble.json");

        assertTrue(ensemble.save(file));
        EnsembleForecaster loaded = new EnsembleForecaster(registry.createDefaultRoster(), properties, registry);
        assertTrue(loaded.load(file));

        assertTrue(loaded.isFitted());
        assertEquals(ensemble.getRosterNames(), loaded.getRosterNames());
        for (String name : ensemble.getRosterNames()) {
            assertEquals(ensemble.getWeights().get(name), loaded.getWeights().get(name), 1e-6);
        }
        ForecastResult original = ensemble.predict(7, 0.95);
        ForecastResult restored = loaded.predict(7, 0.95);
        assertEquals(original.getTimestamps(), restored.getTimestamps());
        assertArrayEquals(original.getPredictedValues(), restored.getPredictedValues(), 1e-9);
    }

    @Test
    void roundTripsSubSecondSeries() {
        ModelRegistry registry = ModelRegistry.withDefaults(properties);
        EnsembleForecaster ensemble = new EnsembleForecaster(registry.createDefaultRoster(), properties, registry);
        ensemble.fit(TestDatasets.regular(120, Duration.ofMillis(500)), TARGET);
        Path file = tempDir.resolve("sub-second.json");

        assertTrue(ensemble.save(file));
        EnsembleForecaster loaded = new EnsembleForecaster(registry.createDefaultRoster(), properties, registry);
        assertTrue(loaded.load(file));

        ForecastResult original = ensemble.predict(4, 0.95);
        ForecastResult restored = loaded.predict(4, 0.95);
        assertEquals(original.getTimestamps(), restored.getTimestamps());
        assertEquals(Duration.ofMillis(500), Duration.between(
                restored.getTimestamps().get(0), restored.getTimestamps().get(1)));
        assertArrayEquals(original.getPredictedValues(), restored.getPredictedValues(), 1e-9);
    }

    @Test
    void documentCarriesVersionPolicyAndComponents() {
        JsonNode document = fittedStubEnsemble().exportState();

        assertEquals(EnsembleStateStore.SCHEMA_VERSION, document.get("schemaVersion").asInt());
        assertEquals("performance", document.get("weightingPolicy").asText());
        assertEquals(0.75, document.get("weights").get("A").asDouble(), 1e-6);
        assertTrue(document.get("components").get("B").isObject());
    }

    @Test
    void restoresWeightingPolicy() {
        properties.setWeightingPolicy("adaptive");
        JsonNode document = fittedStubEnsemble().exportState();

        EnsembleForecaster other = new EnsembleForecaster(List.of(), new EnsembleProperties(), stubRegistry);
        other.restoreState(document);

        assertEquals(WeightingPolicy.ADAPTIVE, other.getWeightingPolicy());
        assertEquals(List.of("A", "B"), other.getRosterNames());
        assertEquals(12.5, other.predict(1, 0.95).getPoints().get(0).getPredictedValue(), 1e-5);
    }

    @Test
    void corruptFileKeepsPriorState() throws IOException {
        EnsembleForecaster ensemble = fittedStubEnsemble();
        WeightVector before = ensemble.getWeights();
        Path file = tempDir.resolve("corrupt.json");
        Files.write(file, "{ not json".getBytes(StandardCharsets.UTF_8));

        assertThrows(CorruptStateException.class, () -> ensemble.load(file));

        assertTrue(ensemble.isFitted());
        assertEquals(before, ensemble.getWeights());
        assertEquals(3, ensemble.predict(3, 0.95).size());
    }

    @Test
    void rejectsUnsupportedVersion() {
        EnsembleForecaster ensemble = fittedStubEnsemble();
        ObjectNode document = (ObjectNode) ensemble.exportState();
        document.put("schemaVersion", 2);

        assertThrows(CorruptStateException.class, () -> ensemble.restoreState(document));
        assertTrue(ensemble.isFitted());
    }

    @Test
    void rejectsUnknownPolicy() {
        ObjectNode document = (ObjectNode) fittedStubEnsemble().exportState();
        document.put("weightingPolicy", "median");

        assertThrows(CorruptStateException.class, () -> new EnsembleStateStore(stubRegistry).decode(document));
    }

    @Test
    void rejectsWeightsWithoutComponents() {
        ObjectNode document = (ObjectNode) fittedStubEnsemble().exportState();
        ((ObjectNode) document.get("components")).remove("B");

        assertThrows(CorruptStateException.class, () -> new EnsembleStateStore(stubRegistry).decode(document));
    }

    @Test
    void rejectsNegativeWeights() {
        ObjectNode document = (ObjectNode) fittedStubEnsemble().exportState();
        ((ObjectNode) document.get("weights")).put("A", -1.0);

        assertThrows(CorruptStateException.class, () -> new EnsembleStateStore(stubRegistry).decode(document));
    }

    @Test
    void rejectsUnknownComponentType() {
        StubForecastModel unknown = stub("Z", 1, 1);
        unknown.fit(TestDatasets.daily(10), TARGET);
        EnsembleStateStore store = new EnsembleStateStore(stubRegistry);
        JsonNode document = store.encode(WeightingPolicy.EQUAL, WeightVector.equal(List.of("Z")), List.of(unknown));

        assertThrows(CorruptStateException.class, () -> store.decode(document));
    }

    @Test
    void rejectsBrokenComponentState() {
        ObjectNode document = (ObjectNode) fittedStubEnsemble().exportState();
        ((ObjectNode) document.get("components")).put("A", "not an object");

        assertThrows(CorruptStateException.class, () -> new EnsembleStateStore(stubRegistry).decode(document));
    }

    @Test
    void missingFileIsReportedNotThrown() {
        EnsembleForecaster ensemble = new EnsembleForecaster(stubRegistry.createDefaultRoster(), properties, stubRegistry);

        assertFalse(ensemble.load(tempDir.resolve("absent.json")));
        assertFalse(ensemble.isFitted());
        assertThrows(NotFittedException.class, () -> ensemble.save(tempDir.resolve("never.json")));
    }
}
