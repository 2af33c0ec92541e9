package eu.nebulouscloud.ensembleforecaster.ensembling.weighting;

import lombok.Getter;

public enum WeightingPolicy {
    EQUAL("equal"),

    PERFORMANCE("performance"),

    ADAPTIVE("adaptive");

    @Getter
    private final String id;

    WeightingPolicy(String id) {
        this.id = id;
    }

    public static WeightingPolicy fromId(String id) {
        for (WeightingPolicy policy : values()) {
            if (policy.id.equalsIgnoreCase(id == null ? "" : id.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Weighting policy not present in the system: " + id);
    }
}
