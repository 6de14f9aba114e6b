package dev.smellscope.domain.valueobject;

import dev.smellscope.domain.enums.AnalysisOutcome;
import dev.smellscope.domain.enums.Backend;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciled outcome of one request. Always produced, even when every
 * backend failed; in that case {@code findings} is empty.
 */
public record AnalysisResult(String requestId, AnalysisOutcome outcome, List<NormalizedFinding> findings,
                             Map<Backend, BackendStatus> backendStatus, String reportRef, int droppedFindings) {

    public AnalysisResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
        backendStatus = backendStatus == null || backendStatus.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(backendStatus));
    }

    public AnalysisResult withReportRef(String ref) {
        return new AnalysisResult(requestId, outcome, findings, backendStatus, ref, droppedFindings);
    }

    public BackendStatus statusOf(Backend backend) {
        return backendStatus.get(backend);
    }
}
