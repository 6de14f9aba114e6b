package dev.smellscope.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Inbound limits. timeoutGrace is added to each detector's own budget before
 * the orchestrator gives up on the slot.
 */
@ConfigurationProperties(prefix = "smellscope.gateway")
public record GatewayProperties(List<String> supportedLanguages, int maxSourceChars, Duration timeoutGrace) {
    public GatewayProperties {
        if (supportedLanguages == null || supportedLanguages.isEmpty())
            supportedLanguages = List.of("java", "kotlin", "python", "javascript", "typescript",
                    "go", "csharp", "cpp", "c", "ruby", "php");
        supportedLanguages = supportedLanguages.stream().map(l -> l.toLowerCase(Locale.ROOT)).toList();
        if (maxSourceChars <= 0) maxSourceChars = 500_000;
        if (timeoutGrace == null || timeoutGrace.isNegative()) timeoutGrace = Duration.ofMillis(500);
    }

    public boolean supports(String language) {
        return language != null && supportedLanguages.contains(language.toLowerCase(Locale.ROOT));
    }
}
