package dev.smellscope.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "smellscope.detectors")
public record DetectorProperties(Endpoint staticAnalysis, Endpoint ai) {
    public DetectorProperties {
        if (staticAnalysis == null) staticAnalysis = new Endpoint(true, "http://localhost:8081", null, null);
        if (ai == null) ai = new Endpoint(true, "http://localhost:8082", null, Duration.ofSeconds(30));
    }

    public record Endpoint(Boolean enabled, String baseUrl, String path, Duration timeout) {
        public Endpoint {
            if (enabled == null) enabled = true;
            if (enabled && (baseUrl == null || baseUrl.isBlank()))
                throw new IllegalArgumentException("base-url is required for an enabled detector");
            if (path == null || path.isBlank()) path = "/detect";
            if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(10);
        }
    }
}
