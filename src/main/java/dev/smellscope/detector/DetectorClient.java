package dev.smellscope.detector;

import dev.smellscope.domain.enums.Backend;

import java.time.Duration;

/**
 * Uniform contract for detection backends.
 * Detectors are auto-discovered via List<DetectorClient> injection.
 * Adding a backend = implement this + @Component; the orchestrator does not change.
 *
 * <p>{@link #detect} never throws. Network errors, error statuses, malformed
 * bodies and timeouts are all reported through the returned outcome's status.
 * Implementations keep no per-call state and may be called concurrently.
 */
public interface DetectorClient {
    Backend backend();

    boolean isEnabled();

    /** Budget for one call, enforced by the implementation and by the orchestrator. */
    Duration timeoutBudget();

    DetectionOutcome detect(DetectionRequest request);
}
