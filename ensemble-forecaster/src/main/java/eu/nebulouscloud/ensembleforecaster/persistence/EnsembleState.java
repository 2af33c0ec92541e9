package eu.nebulouscloud.ensembleforecaster.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted form of a trained ensemble: policy, weights and one state document per component model.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnsembleState {
    private int schemaVersion;
    private String weightingPolicy;
    private Map<String, Double> weights = new LinkedHashMap<>();
    private Map<String, JsonNode> components = new LinkedHashMap<>();
}
