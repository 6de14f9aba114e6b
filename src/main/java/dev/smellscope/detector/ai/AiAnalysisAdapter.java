package dev.smellscope.detector.ai;

import dev.smellscope.config.DetectorProperties;
import dev.smellscope.detector.HttpDetectorClient;
import dev.smellscope.detector.MalformedResponseException;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.valueobject.RawFinding;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Adapter for the model-backed detection engine. The model's confidence is
 * passed through, clamped into [0,1].
 */
@Component
public class AiAnalysisAdapter extends HttpDetectorClient<AiAnalysisResponse> {

    private static final Logger log = LoggerFactory.getLogger(AiAnalysisAdapter.class);
    static final String CIRCUIT_BREAKER = "ai-analysis";

    public AiAnalysisAdapter(DetectorProperties properties, WebClient.Builder builder,
                             CircuitBreakerRegistry circuitBreakerRegistry) {
        super(Backend.AI, properties.ai(), builder,
                circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER), AiAnalysisResponse.class);
    }

    @Override
    protected List<RawFinding> toRawFindings(AiAnalysisResponse body) {
        if (body.findings() == null) throw new MalformedResponseException("missing findings array");
        return body.findings().stream()
                .map(this::toRawFinding)
                .toList();
    }

    private RawFinding toRawFinding(AiAnalysisResponse.Finding finding) {
        if (finding == null || finding.location() == null)
            throw new MalformedResponseException("finding without location");
        return new RawFinding(Backend.AI, finding.location().toSourceLocation(),
                finding.label(), finding.description(), clampConfidence(finding));
    }

    /**
     * Absent stays absent (normalized to 1.0 later); NaN becomes 0.0.
     */
    static Double clampConfidence(AiAnalysisResponse.Finding finding) {
        Double confidence = finding.confidence();
        if (confidence == null) return null;
        if (confidence.isNaN()) return 0.0;
        if (confidence < 0.0 || confidence > 1.0) {
            log.debug("Clamping out-of-range confidence {} for label '{}'", confidence, finding.label());
            return Math.max(0.0, Math.min(1.0, confidence));
        }
        return confidence;
    }
}
