package dev.smellscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SmellScope: code-smell analysis gateway.
 *
 * <p>Request flow:
 * <pre>
 * POST /analyses → AnalysisController → AnalysisService (validate)
 *   → AnalysisOrchestrator → [StaticAnalysisAdapter, AiAnalysisAdapter] (parallel)
 *   → FindingAggregator → ReportClient → response
 * </pre>
 *
 * <p>Detector and report locations are configuration; nothing in the
 * orchestration knows where a backend lives.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SmellScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmellScopeApplication.class, args);
    }
}
