package dev.smellscope.domain.valueobject;

import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.enums.SmellCategory;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Set;

/**
 * A finding in canonical form, possibly confirmed by more than one backend.
 */
public record NormalizedFinding(SmellCategory category, SourceLocation location, double confidence,
                                Set<Backend> backends, String description) {

    /**
     * Output order: file, start line, start column, category name, with the
     * end of the range as a final tie breaker.
     */
    public static final Comparator<NormalizedFinding> REPORT_ORDER =
            Comparator.comparing(NormalizedFinding::location, SourceLocation.POSITION_ORDER)
                    .thenComparing(f -> f.category().displayName())
                    .thenComparingInt(f -> f.location().endLine())
                    .thenComparingInt(f -> f.location().endColumn());

    public NormalizedFinding {
        if (category == null) throw new IllegalArgumentException("category required");
        if (location == null) throw new IllegalArgumentException("location required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0)
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        if (backends == null || backends.isEmpty())
            throw new IllegalArgumentException("at least one contributing backend required");
        backends = Collections.unmodifiableSet(EnumSet.copyOf(backends));
    }

    public boolean isCorroborated() {
        return backends.size() > 1;
    }
}
