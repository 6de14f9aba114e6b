package dev.smellscope.domain.valueobject;

import dev.smellscope.domain.enums.Backend;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Caller-selected options. An empty detector set means "every enabled detector".
 */
public record AnalysisOptions(Set<Backend> detectors, double minConfidence) {

    public AnalysisOptions {
        detectors = detectors == null || detectors.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(detectors));
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0)
            throw new IllegalArgumentException("minConfidence must be within [0,1]");
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(Set.of(), 0.0);
    }

    public boolean selects(Backend backend) {
        return detectors.isEmpty() || detectors.contains(backend);
    }
}
