package dev.smellscope.detector.staticanalysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.smellscope.detector.WireLocation;

import java.util.List;

/**
 * Body of the rule engine's detection endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StaticAnalysisResponse(List<Finding> findings) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Finding(String label, WireLocation location, String description) {}
}
