package dev.smellscope.detector.staticanalysis;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.smellscope.config.DetectorProperties;
import dev.smellscope.detector.DetectionOutcome;
import dev.smellscope.detector.DetectionRequest;
import dev.smellscope.domain.enums.Backend;
import dev.smellscope.domain.enums.BackendState;
import dev.smellscope.domain.valueobject.RawFinding;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@WireMockTest
class StaticAnalysisAdapterTest {

    private static final DetectionRequest REQUEST =
            new DetectionRequest("class A {\n  void f() {}\n}\n", "java", "A.java");

    private StaticAnalysisAdapter adapter;
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        adapter = adapterFor(wmInfo.getHttpBaseUrl(), Duration.ofMillis(500));
    }

    @Test
    @DisplayName("posts code and language and maps findings without confidence")
    void mapsFindings() {
        stubFor(post(urlEqualTo("/detect")).willReturn(okJson("""
                {"findings": [
                  {"label": "ExcessiveMethodLength",
                   "location": {"file": "A.java", "start_line": 2, "start_column": 3, "end_line": 2, "end_column": 14},
                   "description": "Method f is long"},
                  {"label": "SomethingNew", "location": {"start_line": 1}}
                ], "engine": "rules-1.4"}
                """)));

        DetectionOutcome outcome = adapter.detect(REQUEST);

        assertThat(outcome.backend()).isEqualTo(Backend.STATIC);
        assertThat(outcome.status().state()).isEqualTo(BackendState.SUCCESS);
        assertThat(outcome.findings()).hasSize(2);

        RawFinding first = outcome.findings().get(0);
        assertThat(first.label()).isEqualTo("ExcessiveMethodLength");
        assertThat(first.location().file()).isEqualTo("A.java");
        assertThat(first.location().startColumn()).isEqualTo(3);
        assertThat(first.location().endColumn()).isEqualTo(14);
        assertThat(first.description()).isEqualTo("Method f is long");
        assertThat(first.confidence()).isNull();

        RawFinding second = outcome.findings().get(1);
        assertThat(second.label()).isEqualTo("SomethingNew");
        assertThat(second.location().endLine()).isEqualTo(1);
        assertThat(second.location().file()).isEmpty();

        verify(postRequestedFor(urlEqualTo("/detect"))
                .withRequestBody(matchingJsonPath("$.language", equalTo("java")))
                .withRequestBody(matchingJsonPath("$.code")));
    }

    @Test
    @DisplayName("empty findings array is a successful, empty outcome")
    void emptyFindings() {
        stubFor(post(urlEqualTo("/detect")).willReturn(okJson("{\"findings\": []}")));

        DetectionOutcome outcome = adapter.detect(REQUEST);

        assertThat(outcome.status().isSuccess()).isTrue();
        assertThat(outcome.findings()).isEmpty();
    }

    @Test
    @DisplayName("server error becomes FAILURE, not an exception")
    void serverErrorIsFailure() {
        stubFor(post(urlEqualTo("/detect")).willReturn(serverError()));

        DetectionOutcome outcome = adapter.detect(REQUEST);

        assertThat(outcome.status().state()).isEqualTo(BackendState.FAILURE);
        assertThat(outcome.status().reason()).contains("HTTP 500");
        assertThat(outcome.findings()).isEmpty();
    }

    @Test
    @DisplayName("missing findings array is a malformed response")
    void missingFindingsIsMalformed() {
        stubFor(post(urlEqualTo("/detect")).willReturn(okJson("{\"results\": []}")));

        DetectionOutcome outcome = adapter.detect(REQUEST);

        assertThat(outcome.status().state()).isEqualTo(BackendState.FAILURE);
        assertThat(outcome.status().reason()).contains("malformed");
    }

    @Test
    @DisplayName("finding without a start line is a malformed response")
    void findingWithoutStartLineIsMalformed() {
        stubFor(post(urlEqualTo("/detect")).willReturn(okJson("""
                {"findings": [{"label": "LongMethod", "location": {"file": "A.java"}}]}
                """)));

        DetectionOutcome outcome = adapter.detect(REQUEST);

        assertThat(outcome.status().state()).isEqualTo(BackendState.FAILURE);
        assertThat(outcome.status().reason()).contains("start_line");
    }

    @Test
    @DisplayName("undecodable body is a malformed response")
    void undecodableBodyIsMalformed() {
        stubFor(post(urlEqualTo("/detect")).willReturn(okJson("{not json")));

        DetectionOutcome outcome = adapter.detect(REQUEST);

        assertThat(outcome.status().state()).isEqualTo(BackendState.FAILURE);
        assertThat(outcome.status().reason()).contains("malformed");
    }

    @Test
    @DisplayName("slow backend is reported as TIMEOUT within its budget")
    void slowBackendTimesOut() {
        stubFor(post(urlEqualTo("/detect")).willReturn(okJson("{\"findings\": []}").withFixedDelay(2_000)));

        long start = System.nanoTime();
        DetectionOutcome outcome = adapter.detect(REQUEST);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertThat(outcome.status().state()).isEqualTo(BackendState.TIMEOUT);
        assertThat(elapsedMillis).isLessThan(1_500);
    }

    @Test
    @DisplayName("unreachable backend becomes FAILURE")
    void unreachableBackendIsFailure() {
        StaticAnalysisAdapter unreachable = adapterFor("http://localhost:1", Duration.ofSeconds(2));

        DetectionOutcome outcome = unreachable.detect(REQUEST);

        assertThat(outcome.status().state()).isIn(BackendState.FAILURE, BackendState.TIMEOUT);
        assertThat(outcome.findings()).isEmpty();
    }

    @Test
    @DisplayName("open circuit breaker short-circuits the call")
    void openCircuitBreakerIsFailure() {
        circuitBreakerRegistry.circuitBreaker(StaticAnalysisAdapter.CIRCUIT_BREAKER).transitionToForcedOpenState();

        DetectionOutcome outcome = adapter.detect(REQUEST);

        assertThat(outcome.status().state()).isEqualTo(BackendState.FAILURE);
        assertThat(outcome.status().reason()).isEqualTo("circuit breaker open");
        verify(0, postRequestedFor(urlEqualTo("/detect")));
    }

    private StaticAnalysisAdapter adapterFor(String baseUrl, Duration timeout) {
        DetectorProperties properties = new DetectorProperties(
                new DetectorProperties.Endpoint(true, baseUrl, "/detect", timeout), null);
        return new StaticAnalysisAdapter(properties, WebClient.builder(), circuitBreakerRegistry);
    }
}
