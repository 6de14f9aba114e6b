package dev.smellscope.controller;

import dev.smellscope.dto.request.AnalysisPayload;
import dev.smellscope.dto.response.AnalysisResponse;
import dev.smellscope.infrastructure.web.RequestCorrelationFilter;
import dev.smellscope.service.AnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Synchronous analysis endpoint. Any result, including one where every
 * backend failed, is a 200; only malformed input is a 400.
 */
@RestController
@RequestMapping("/analyses")
public class AnalysisController {
    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping
    public ResponseEntity<AnalysisResponse> analyze(
            @RequestAttribute(name = RequestCorrelationFilter.ATTRIBUTE, required = false) String requestId,
            @RequestBody AnalysisPayload payload) {
        return ResponseEntity.ok(AnalysisResponse.from(analysisService.analyze(payload, requestId)));
    }
}
