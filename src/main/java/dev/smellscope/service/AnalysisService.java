package dev.smellscope.service;

import dev.smellscope.config.GatewayProperties;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.valueobject.AnalysisOptions;
import dev.smellscope.domain.valueobject.AnalysisRequest;
import dev.smellscope.domain.valueobject.AnalysisResult;
import dev.smellscope.dto.request.AnalysisPayload;
import dev.smellscope.dto.response.AnalysisResponse;
import dev.smellscope.exception.InvalidRequestException;
import dev.smellscope.infrastructure.report.ReportClient;
import dev.smellscope.orchestrator.AnalysisOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for analysis requests. Validates the payload (the only place a
 * caller-visible error can originate), runs the orchestration and attaches
 * the report reference.
 */
@Service
public class AnalysisService {
    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisOrchestrator orchestrator;
    private final ReportClient reportClient;
    private final GatewayProperties gatewayProperties;

    public AnalysisService(AnalysisOrchestrator orchestrator, ReportClient reportClient,
                           GatewayProperties gatewayProperties) {
        this.orchestrator = orchestrator;
        this.reportClient = reportClient;
        this.gatewayProperties = gatewayProperties;
    }

    public AnalysisResult analyze(AnalysisPayload payload, String requestId) {
        AnalysisRequest request = toRequest(payload, requestId);
        log.info("Analyzing {} chars of {} for request {}", request.code().length(),
                request.language(), request.requestId());

        AnalysisResult result = orchestrator.analyze(request);
        return reportClient.publish(AnalysisResponse.from(result))
                .map(result::withReportRef)
                .orElse(result);
    }

    AnalysisRequest toRequest(AnalysisPayload payload, String requestId) {
        if (payload == null) throw new InvalidRequestException("request body is required");
        if (payload.code() == null || payload.code().isBlank())
            throw new InvalidRequestException("code must not be empty");
        if (payload.code().length() > gatewayProperties.maxSourceChars())
            throw new InvalidRequestException("code exceeds %d characters".formatted(gatewayProperties.maxSourceChars()));
        if (payload.language() == null || payload.language().isBlank())
            throw new InvalidRequestException("language is required");
        if (!gatewayProperties.supports(payload.language()))
            throw new InvalidRequestException("unsupported language: " + payload.language());

        AnalysisOptions options = toOptions(payload.options());
        Set<Backend> available = orchestrator.availableBackends();
        boolean anyRunnable = available.stream().anyMatch(options::selects);
        if (!anyRunnable)
            throw new InvalidRequestException("no enabled detector matches the requested options");

        String id = requestId != null && !requestId.isBlank() ? requestId : UUID.randomUUID().toString();
        return new AnalysisRequest(id, payload.code(), payload.language().toLowerCase(Locale.ROOT),
                payload.fileName(), options);
    }

    private AnalysisOptions toOptions(AnalysisPayload.Options options) {
        if (options == null) return AnalysisOptions.defaults();

        Set<Backend> detectors = EnumSet.noneOf(Backend.class);
        if (options.detectors() != null) {
            for (String id : options.detectors()) {
                detectors.add(Backend.fromId(id)
                        .orElseThrow(() -> new InvalidRequestException("unknown detector: " + id)));
            }
        }
        double minConfidence = options.minConfidence() != null ? options.minConfidence() : 0.0;
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0)
            throw new InvalidRequestException("min_confidence must be within [0,1]");
        return new AnalysisOptions(detectors, minConfidence);
    }
}
