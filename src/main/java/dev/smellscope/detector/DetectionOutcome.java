package dev.smellscope.detector;

import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.valueobject.BackendStatus;
import dev.smellscope.domain.valueobject.RawFinding;

import java.time.Duration;
import java.util.List;

/**
 * One detector's fully resolved answer. Only a SUCCESS outcome carries findings.
 */
public record DetectionOutcome(Backend backend, List<RawFinding> findings, BackendStatus status) {

    public DetectionOutcome {
        if (backend == null) throw new IllegalArgumentException("backend required");
        if (status == null) throw new IllegalArgumentException("status required");
        findings = status.isSuccess() && findings != null ? List.copyOf(findings) : List.of();
    }

    public static DetectionOutcome success(Backend backend, List<RawFinding> findings) {
        return new DetectionOutcome(backend, findings, BackendStatus.success());
    }

    public static DetectionOutcome failure(Backend backend, String reason) {
        return new DetectionOutcome(backend, List.of(), BackendStatus.failure(reason));
    }

    public static DetectionOutcome timeout(Backend backend, Duration budget) {
        return new DetectionOutcome(backend, List.of(),
                BackendStatus.timeout("no response within " + budget.toMillis() + "ms"));
    }

    public static DetectionOutcome skipped(Backend backend, String reason) {
        return new DetectionOutcome(backend, List.of(), BackendStatus.skipped(reason));
    }
}
