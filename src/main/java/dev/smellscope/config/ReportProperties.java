package dev.smellscope.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "smellscope.report")
public record ReportProperties(Boolean enabled, String baseUrl, String path, Duration timeout) {
    public ReportProperties {
        if (enabled == null) enabled = true;
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8083";
        if (path == null || path.isBlank()) path = "/reports";
        if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(5);
    }
}
