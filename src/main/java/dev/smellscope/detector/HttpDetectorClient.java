package dev.smellscope.detector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import dev.smellscope.config.DetectorProperties;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.valueobject.RawFinding;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Base for detectors reached over HTTP. Posts {@code {code, language}} to the
 * configured endpoint, bounded by the detector's timeout and guarded by a
 * circuit breaker, then hands the decoded body to the subclass for mapping.
 *
 * <p>Uses WebClient with .block() on the detector executor thread. When the
 * budget expires the reactive timeout cancels the in-flight exchange, which
 * releases the connection instead of leaving it to finish in the background.
 *
 * @param <R> the backend's response body type
 */
public abstract class HttpDetectorClient<R> implements DetectorClient {

    private static final Logger log = LoggerFactory.getLogger(HttpDetectorClient.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    private final Backend backend;
    private final DetectorProperties.Endpoint endpoint;
    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final Class<R> responseType;

    protected HttpDetectorClient(Backend backend, DetectorProperties.Endpoint endpoint,
                                 WebClient.Builder builder, CircuitBreaker circuitBreaker,
                                 Class<R> responseType) {
        this.backend = backend;
        this.endpoint = endpoint;
        this.circuitBreaker = circuitBreaker;
        this.responseType = responseType;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(endpoint.timeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);
        this.webClient = builder.clone()
                .baseUrl(endpoint.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().jackson2JsonDecoder(
                        new Jackson2JsonDecoder(responseMapper(), MediaType.APPLICATION_JSON)))
                .build();
    }

    /**
     * Mapper for backend responses. Numbers must arrive as JSON numbers: a
     * quoted score such as {@code "0.9"} is rejected instead of coerced.
     */
    static ObjectMapper responseMapper() {
        ObjectMapper mapper = Jackson2ObjectMapperBuilder.json().build();
        mapper.coercionConfigFor(LogicalType.Float)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Converts the decoded body into raw findings.
     *
     * @throws MalformedResponseException if the body breaks the backend contract
     */
    protected abstract List<RawFinding> toRawFindings(R body);

    @Override
    public Backend backend() {
        return backend;
    }

    @Override
    public boolean isEnabled() {
        return endpoint.enabled();
    }

    @Override
    public Duration timeoutBudget() {
        return endpoint.timeout();
    }

    @Override
    public DetectionOutcome detect(DetectionRequest request) {
        Instant start = Instant.now();
        try {
            R body = webClient.post()
                    .uri(endpoint.path())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("code", request.code(), "language", request.language()))
                    .retrieve()
                    .bodyToMono(responseType)
                    .timeout(endpoint.timeout())
                    .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                    .block();
            if (body == null) throw new MalformedResponseException("empty response body");

            List<RawFinding> findings = toRawFindings(body);
            log.debug("{} detector returned {} findings in {}ms", backend.id(), findings.size(),
                    Duration.between(start, Instant.now()).toMillis());
            return DetectionOutcome.success(backend, findings);
        } catch (Exception e) {
            return classify(Exceptions.unwrap(e), start);
        }
    }

    private DetectionOutcome classify(Throwable error, Instant start) {
        long elapsed = Duration.between(start, Instant.now()).toMillis();
        if (error instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return DetectionOutcome.failure(backend, "call interrupted");
        }
        if (error instanceof TimeoutException || hasCause(error, ReadTimeoutException.class)) {
            log.warn("{} detector timed out after {}ms", backend.id(), elapsed);
            return DetectionOutcome.timeout(backend, endpoint.timeout());
        }
        String reason;
        if (error instanceof CallNotPermittedException) {
            reason = "circuit breaker open";
        } else if (error instanceof WebClientResponseException wcre) {
            reason = "HTTP " + wcre.getStatusCode().value() + " from backend";
        } else if (error instanceof WebClientRequestException) {
            reason = "backend unreachable: " + error.getMessage();
        } else if (error instanceof MalformedResponseException || error instanceof CodecException) {
            reason = "malformed response: " + error.getMessage();
        } else {
            reason = error.getClass().getSimpleName() + ": " + error.getMessage();
        }
        log.warn("{} detector failed after {}ms: {}", backend.id(), elapsed, reason);
        return DetectionOutcome.failure(backend, reason);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) return true;
        }
        return false;
    }
}
