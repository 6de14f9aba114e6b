package dev.smellscope.detector;

import dev.smellscope.domain.valueobject.AnalysisRequest;

public record DetectionRequest(String code, String language, String fileName) {
    public static DetectionRequest from(AnalysisRequest request) {
        return new DetectionRequest(request.code(), request.language(), request.fileName());
    }
}
