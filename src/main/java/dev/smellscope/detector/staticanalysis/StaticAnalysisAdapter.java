package dev.smellscope.detector.staticanalysis;

import dev.smellscope.config.DetectorProperties;
import dev.smellscope.detector.HttpDetectorClient;
import dev.smellscope.detector.MalformedResponseException;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.valueobject.RawFinding;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Adapter for the rule-based static-analysis engine.
 * Rule matches are deterministic, so findings carry no confidence score.
 */
@Component
public class StaticAnalysisAdapter extends HttpDetectorClient<StaticAnalysisResponse> {

    static final String CIRCUIT_BREAKER = "static-analysis";

    public StaticAnalysisAdapter(DetectorProperties properties, WebClient.Builder builder,
                                 CircuitBreakerRegistry circuitBreakerRegistry) {
        super(Backend.STATIC, properties.staticAnalysis(), builder,
                circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER), StaticAnalysisResponse.class);
    }

    @Override
    protected List<RawFinding> toRawFindings(StaticAnalysisResponse body) {
        if (body.findings() == null) throw new MalformedResponseException("missing findings array");
        return body.findings().stream()
                .map(this::toRawFinding)
                .toList();
    }

    private RawFinding toRawFinding(StaticAnalysisResponse.Finding finding) {
        if (finding == null || finding.location() == null)
            throw new MalformedResponseException("finding without location");
        return new RawFinding(Backend.STATIC, finding.location().toSourceLocation(),
                finding.label(), finding.description(), null);
    }
}
