package dev.smellscope.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.valueobject.AnalysisResult;
import dev.smellscope.domain.valueobject.BackendStatus;
import dev.smellscope.domain.valueobject.NormalizedFinding;
import dev.smellscope.domain.valueobject.SourceLocation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire form of an analysis result, returned to the caller and posted to the
 * report collaborator.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisResponse(String requestId, String outcome, List<FindingView> findings,
                               Map<String, StatusView> backendStatus, String reportRef, int droppedFindings) {

    public static AnalysisResponse from(AnalysisResult result) {
        Map<String, StatusView> statuses = new LinkedHashMap<>();
        for (Backend backend : Backend.values()) {
            BackendStatus status = result.statusOf(backend);
            if (status != null) statuses.put(backend.id(), new StatusView(status.state().name(), status.reason()));
        }
        return new AnalysisResponse(result.requestId(), result.outcome().name(),
                result.findings().stream().map(FindingView::from).toList(),
                statuses, result.reportRef(), result.droppedFindings());
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record FindingView(String category, LocationView location, double confidence,
                              List<String> backends, String description) {
        static FindingView from(NormalizedFinding f) {
            return new FindingView(f.category().displayName(), LocationView.from(f.location()), f.confidence(),
                    f.backends().stream().map(Backend::id).toList(), f.description());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record LocationView(String file, int startLine, int startColumn, int endLine, int endColumn) {
        static LocationView from(SourceLocation l) {
            return new LocationView(l.file(), l.startLine(), l.startColumn(), l.endLine(), l.endColumn());
        }
    }

    public record StatusView(String state, String reason) {}
}
