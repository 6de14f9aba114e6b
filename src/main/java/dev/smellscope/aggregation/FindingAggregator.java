package dev.smellscope.aggregation;

import dev.smellscope.config.AggregationProperties;
import dev.smellscope.detector.DetectionOutcome;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.enums.SmellCategory;
import dev.smellscope.domain.valueobject.AnalysisRequest;
import dev.smellscope.domain.valueobject.NormalizedFinding;
import dev.smellscope.domain.valueobject.RawFinding;
import dev.smellscope.domain.valueobject.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges the raw findings of every detector into one ordered finding set.
 *
 * <pre>
 *  1. Drop findings whose location does not fit the submitted source
 *  2. Normalize label → category and confidence
 *  3. Group same-category findings from different backends whose ranges overlap
 *  4. Merge each group: union of backends, strongest reported confidence,
 *     tightest range
 *  5. Sort by file, start line, start column, category
 * </pre>
 *
 * <p>Input is put into canonical order before grouping, so the output depends
 * only on the findings themselves and never on which backend answered first.
 * Findings of different categories are kept apart even when they overlap.
 * Stateless apart from the read-only category table.
 */
@Component
public class FindingAggregator {

    private static final Logger log = LoggerFactory.getLogger(FindingAggregator.class);

    private static final Comparator<Candidate> CANONICAL_ORDER =
            Comparator.comparing(Candidate::location, SourceLocation.POSITION_ORDER)
                    .thenComparing(c -> c.category().displayName())
                    .thenComparing(Candidate::backend)
                    .thenComparingInt(c -> c.location().endLine())
                    .thenComparingInt(c -> c.location().endColumn())
                    .thenComparing(Candidate::confidence, Comparator.nullsFirst(Comparator.<Double>reverseOrder()))
                    .thenComparing(Candidate::description, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private final CategoryTable categoryTable;
    private final double overlapThreshold;

    public FindingAggregator(CategoryTable categoryTable, AggregationProperties properties) {
        this.categoryTable = categoryTable;
        this.overlapThreshold = properties.overlapThreshold();
    }

    public AggregatedFindings aggregate(AnalysisRequest request, Collection<DetectionOutcome> outcomes) {
        int lineCount = request.sourceLineCount();
        List<Candidate> candidates = new ArrayList<>();
        int dropped = 0;

        for (DetectionOutcome outcome : outcomes) {
            if (!outcome.status().isSuccess()) continue;
            for (RawFinding raw : outcome.findings()) {
                SourceLocation location = raw.location().withDefaultFile(request.fileName());
                if (!location.isWithin(lineCount)) {
                    log.warn("Dropping {} finding '{}' for request {}: lines {}-{} outside source of {} lines",
                            raw.backend().id(), raw.label(), request.requestId(),
                            location.startLine(), location.endLine(), lineCount);
                    dropped++;
                    continue;
                }
                candidates.add(new Candidate(raw.backend(), categoryTable.categorize(raw.label()),
                        location, clamp(raw.confidence()), blankToNull(raw.description())));
            }
        }

        candidates.sort(CANONICAL_ORDER);

        Map<GroupKey, List<Group>> groupsByKey = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            List<Group> open = groupsByKey.computeIfAbsent(
                    new GroupKey(candidate.location().file(), candidate.category()), k -> new ArrayList<>());
            open.stream()
                    .filter(g -> g.accepts(candidate, overlapThreshold))
                    .findFirst()
                    .ifPresentOrElse(g -> g.add(candidate), () -> open.add(new Group(candidate)));
        }

        List<NormalizedFinding> findings = groupsByKey.values().stream()
                .flatMap(List::stream)
                .map(Group::merge)
                .sorted(NormalizedFinding.REPORT_ORDER)
                .toList();

        log.debug("Aggregated {} raw findings into {} for request {} ({} dropped)",
                candidates.size() + dropped, findings.size(), request.requestId(), dropped);
        return new AggregatedFindings(findings, dropped);
    }

    static Double clamp(Double confidence) {
        if (confidence == null) return null;
        if (confidence.isNaN()) return 0.0;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    // ── Internal ───────────────────────────────────────────────────

    /** A validated finding with its category resolved. confidence null = not reported. */
    private record Candidate(Backend backend, SmellCategory category, SourceLocation location,
                             Double confidence, String description) {}

    private record GroupKey(String file, SmellCategory category) {}

    /**
     * Same-category findings judged to be one smell. The first member is the
     * anchor every later candidate is compared against.
     */
    private static final class Group {
        private final List<Candidate> members = new ArrayList<>();
        private final Set<Backend> backends = EnumSet.noneOf(Backend.class);

        Group(Candidate anchor) {
            add(anchor);
        }

        void add(Candidate candidate) {
            members.add(candidate);
            backends.add(candidate.backend());
        }

        boolean accepts(Candidate candidate, double threshold) {
            return !backends.contains(candidate.backend())
                    && members.get(0).location().overlapRatio(candidate.location()) > threshold;
        }

        NormalizedFinding merge() {
            Candidate tightest = members.stream()
                    .min(Comparator.comparing(Candidate::location, SourceLocation.TIGHTNESS_ORDER)
                            .thenComparing(CANONICAL_ORDER))
                    .orElseThrow();
            // Unscored contributors carry no signal; with no scores at all the match is certain.
            double confidence = members.stream()
                    .map(Candidate::confidence)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .max()
                    .orElse(1.0);
            String description = tightest.description() != null
                    ? tightest.description()
                    : members.stream().map(Candidate::description).filter(Objects::nonNull).findFirst().orElse(null);
            return new NormalizedFinding(tightest.category(), tightest.location(), confidence, backends, description);
        }
    }
}
