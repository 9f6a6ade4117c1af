package tech.yump.boundary.compliance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Score penalty per violation severity. Missing entries use {@link Severity#defaultWeight()}.
 */
public final class SeverityWeights {

    private final Map<Severity, Double> weights;

    private SeverityWeights(Map<Severity, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static SeverityWeights defaults() {
        return of(Map.of());
    }

    public static SeverityWeights of(Map<Severity, Double> overrides) {
        EnumMap<Severity, Double> merged = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            Double weight = overrides != null ? overrides.get(severity) : null;
            if (weight != null && weight < 0) {
                throw new IllegalArgumentException("Weight for " + severity + " must not be negative");
            }
            merged.put(severity, weight != null ? weight : severity.defaultWeight());
        }
        return new SeverityWeights(merged);
    }

    public double weightOf(Severity severity) {
        return weights.get(severity);
    }

    public Map<Severity, Double> asMap() {
        return weights;
    }
}
