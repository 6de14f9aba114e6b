package dev.smellscope.aggregation;

import dev.smellscope.domain.valueobject.NormalizedFinding;

import java.util.List;

/**
 * Aggregator output: ordered findings plus how many raw findings were
 * discarded because their location did not fit the submitted source.
 */
public record AggregatedFindings(List<NormalizedFinding> findings, int droppedFindings) {
    public AggregatedFindings {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static AggregatedFindings empty() {
        return new AggregatedFindings(List.of(), 0);
    }
}
