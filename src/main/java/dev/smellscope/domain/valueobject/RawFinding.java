package dev.smellscope.domain.valueobject;

import dev.smellscope.domain.enums.Backend;

/**
 * A finding exactly as one backend reported it. {@code label} is the
 * backend's own smell name; {@code confidence} is null when the backend does
 * not score its findings.
 */
public record RawFinding(Backend backend, SourceLocation location, String label,
                         String description, Double confidence) {
    public RawFinding {
        if (backend == null) throw new IllegalArgumentException("backend required");
        if (location == null) throw new IllegalArgumentException("location required");
    }
}
