package dev.smellscope.detector.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.smellscope.detector.WireLocation;

import java.util.List;

/**
 * Body of the model-backed detection endpoint. Same shape as the rule
 * engine's, plus a per-finding confidence.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiAnalysisResponse(List<Finding> findings) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Finding(String label, WireLocation location, Double confidence, String description) {}
}
