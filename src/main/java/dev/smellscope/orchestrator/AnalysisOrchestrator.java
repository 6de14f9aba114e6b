package dev.smellscope.orchestrator;

import dev.smellscope.aggregation.AggregatedFindings;
import dev.smellscope.aggregation.FindingAggregator;
import dev.smellscope.config.GatewayProperties;
import dev.smellscope.detector.DetectionOutcome;
import dev.smellscope.detector.DetectionRequest;
import dev.smellscope.detector.DetectorClient;
import dev.smellscope.domain.enums.AnalysisOutcome;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.enums.RequestState;
import dev.smellscope.domain.valueobject.AnalysisRequest;
import dev.smellscope.domain.valueobject.AnalysisResult;
import dev.smellscope.domain.valueobject.BackendStatus;
import dev.smellscope.domain.valueobject.NormalizedFinding;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one analysis request from fan-out to aggregated result.
 *
 * <pre>
 *  1. PENDING      select detectors (enabled and requested)
 *  2. FANNING_OUT  call them IN PARALLEL, each bounded by its own budget
 *  3.              await every slot: success, failure or timeout
 *  4. AGGREGATING  merge the findings exactly once
 *  5. COMPLETED    COMPLETED | PARTIAL_FAILURE | EMPTY_RESULT
 * </pre>
 *
 * <p>Backend problems never escape this class. A slow or failing detector
 * costs only its own slot; latency is bounded by the slowest detector's budget,
 * not the sum. When a slot exceeds budget plus grace its task is cancelled and
 * the slot is recorded as TIMEOUT while the other detectors carry on.
 */
@Component
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final Map<Backend, DetectorClient> detectors;
    private final FindingAggregator aggregator;
    private final ExecutorService detectorExecutor;
    private final Duration timeoutGrace;
    private final MeterRegistry meterRegistry;

    public AnalysisOrchestrator(List<DetectorClient> detectors,
                                FindingAggregator aggregator,
                                @Qualifier("detectorExecutorService") ExecutorService detectorExecutor,
                                GatewayProperties gatewayProperties,
                                MeterRegistry meterRegistry) {
        this.detectors = Collections.unmodifiableMap(detectors.stream()
                .collect(Collectors.toMap(DetectorClient::backend, Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Two detectors registered for " + a.backend());
                        },
                        () -> new EnumMap<>(Backend.class))));
        this.aggregator = aggregator;
        this.detectorExecutor = detectorExecutor;
        this.timeoutGrace = gatewayProperties.timeoutGrace();
        this.meterRegistry = meterRegistry;
    }

    /**
     * Backends that have an enabled detector and can therefore be requested.
     */
    public Set<Backend> availableBackends() {
        Set<Backend> available = EnumSet.noneOf(Backend.class);
        detectors.values().stream()
                .filter(DetectorClient::isEnabled)
                .forEach(d -> available.add(d.backend()));
        return available;
    }

    public AnalysisResult analyze(AnalysisRequest request) {
        Timer.Sample timerSample = Timer.start(meterRegistry);
        AnalysisRun run = new AnalysisRun(request.requestId());

        Map<Backend, DetectionOutcome> outcomes = new EnumMap<>(Backend.class);
        List<DetectorClient> selected = selectDetectors(request, outcomes);
        log.info("Request {}: fanning out to {}", request.requestId(),
                selected.stream().map(d -> d.backend().id()).toList());

        run.advance(RequestState.FANNING_OUT);
        DetectionRequest detectionRequest = DetectionRequest.from(request);
        List<CompletableFuture<DetectionOutcome>> slots = selected.stream()
                .map(detector -> dispatch(detector, detectionRequest))
                .toList();

        slots.stream()
                .map(CompletableFuture::join)
                .forEach(outcome -> outcomes.put(outcome.backend(), outcome));
        outcomes.values().forEach(this::recordDetectorCall);

        run.advance(RequestState.AGGREGATING);
        AggregatedFindings aggregated = aggregator.aggregate(request, outcomes.values());
        List<NormalizedFinding> findings = aggregated.findings().stream()
                .filter(f -> f.confidence() >= request.options().minConfidence())
                .toList();
        if (aggregated.droppedFindings() > 0) {
            meterRegistry.counter("smellscope.aggregation.dropped").increment(aggregated.droppedFindings());
        }

        Map<Backend, BackendStatus> statuses = new EnumMap<>(Backend.class);
        outcomes.forEach((backend, outcome) -> statuses.put(backend, outcome.status()));
        AnalysisOutcome outcome = AnalysisOutcome.from(statuses.values().stream()
                .filter(BackendStatus::wasAttempted)
                .toList());
        run.complete(outcome);

        timerSample.stop(meterRegistry.timer("smellscope.analysis.duration", "outcome", outcome.name()));
        log.info("Request {} completed: outcome={}, findings={}, status={}", request.requestId(),
                outcome, findings.size(), describe(statuses));

        return new AnalysisResult(request.requestId(), outcome, findings, statuses, null,
                aggregated.droppedFindings());
    }

    // ── Internal ───────────────────────────────────────────────────

    private List<DetectorClient> selectDetectors(AnalysisRequest request, Map<Backend, DetectionOutcome> outcomes) {
        for (Backend backend : Backend.values()) {
            DetectorClient detector = detectors.get(backend);
            if (detector == null) {
                outcomes.put(backend, DetectionOutcome.skipped(backend, "no detector registered"));
            } else if (!detector.isEnabled()) {
                outcomes.put(backend, DetectionOutcome.skipped(backend, "disabled by configuration"));
            } else if (!request.options().selects(backend)) {
                outcomes.put(backend, DetectionOutcome.skipped(backend, "not requested"));
            }
        }
        return detectors.values().stream()
                .filter(d -> !outcomes.containsKey(d.backend()))
                .toList();
    }

    /**
     * Starts one detector call and returns a slot that always completes
     * normally: with the detector's outcome, or with TIMEOUT once the budget
     * plus grace has passed.
     */
    private CompletableFuture<DetectionOutcome> dispatch(DetectorClient detector, DetectionRequest request) {
        Backend backend = detector.backend();
        Duration hardLimit = detector.timeoutBudget().plus(timeoutGrace);
        CompletableFuture<DetectionOutcome> slot = new CompletableFuture<>();
        Future<?> task;
        try {
            task = detectorExecutor.submit(() -> slot.complete(callDetector(detector, request)));
        } catch (RejectedExecutionException e) {
            log.error("{} detector call rejected by executor: {}", backend.id(), e.getMessage());
            return CompletableFuture.completedFuture(DetectionOutcome.failure(backend, "executor rejected call"));
        }
        return slot
                .orTimeout(hardLimit.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    task.cancel(true);
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        log.warn("{} detector exceeded {}ms, cancelling", backend.id(), hardLimit.toMillis());
                        return DetectionOutcome.timeout(backend, detector.timeoutBudget());
                    }
                    return DetectionOutcome.failure(backend, cause.getMessage());
                });
    }

    private DetectionOutcome callDetector(DetectorClient detector, DetectionRequest request) {
        try {
            DetectionOutcome outcome = detector.detect(request);
            if (outcome == null || outcome.backend() != detector.backend()) {
                return DetectionOutcome.failure(detector.backend(), "detector returned no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("{} detector broke its contract and threw", detector.backend().id(), e);
            return DetectionOutcome.failure(detector.backend(), "unexpected detector error: " + e.getMessage());
        }
    }

    private void recordDetectorCall(DetectionOutcome outcome) {
        if (!outcome.status().wasAttempted()) return;
        meterRegistry.counter("smellscope.detector.calls",
                "backend", outcome.backend().id(),
                "state", outcome.status().state().name()).increment();
    }

    private static String describe(Map<Backend, BackendStatus> statuses) {
        return statuses.entrySet().stream()
                .map(e -> e.getKey().id() + "=" + e.getValue().state())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
