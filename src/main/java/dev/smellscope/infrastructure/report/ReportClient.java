package dev.smellscope.infrastructure.report;

import dev.smellscope.config.ReportProperties;
import dev.smellscope.dto.response.AnalysisResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.Map;
import java.util.Optional;

/**
 * Hands finished results to the report generator.
 * Rendering and persistence are the generator's business; all the gateway
 * keeps is the opaque reference it returns. Never fails the analysis: any
 * problem yields an empty reference.
 */
@Component
public class ReportClient {

    private static final Logger log = LoggerFactory.getLogger(ReportClient.class);
    static final String CIRCUIT_BREAKER = "report";

    private final ReportProperties properties;
    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;

    public ReportClient(ReportProperties properties, WebClient.Builder builder,
                        CircuitBreakerRegistry circuitBreakerRegistry) {
        this.properties = properties;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.timeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        this.webClient = builder.clone()
                .baseUrl(properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public Optional<String> publish(AnalysisResponse result) {
        if (!properties.enabled()) return Optional.empty();
        try {
            Map<String, Object> body = webClient.post()
                    .uri(properties.path())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(result)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .timeout(properties.timeout())
                    .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                    .block();
            Optional<String> ref = extractReference(body);
            if (ref.isEmpty()) {
                log.warn("Report generator accepted request {} but returned no reference", result.requestId());
            } else {
                log.info("Report {} created for request {}", ref.get(), result.requestId());
            }
            return ref;
        } catch (Exception e) {
            log.warn("Could not publish report for request {}: {}", result.requestId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> extractReference(Map<String, Object> body) {
        if (body == null) return Optional.empty();
        Object ref = body.get("report_ref");
        if (ref == null) ref = body.get("id");
        return Optional.ofNullable(ref).map(String::valueOf).filter(s -> !s.isBlank());
    }
}
