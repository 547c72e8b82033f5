package io.github.samzhu.quotaboard.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import io.github.samzhu.quotaboard.dto.PodSample;
import io.github.samzhu.quotaboard.exception.MetricsBackendException;

class PrometheusMetricsClientTest {

    private static final Instant AT = Instant.parse("2025-06-02T00:00:00Z");

    private MockRestServiceServer server;
    private PrometheusMetricsClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://prometheus:9090");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new PrometheusMetricsClient(builder.build());
    }

    @Test
    void shouldJoinCpuAndMemoryPeaksPerPod() {
        // Given
        server.expect(requestTo(containsString("/api/v1/query")))
            .andExpect(method(HttpMethod.GET))
            .andExpect(queryParam("time", "1748822400"))
            .andRespond(withSuccess("""
                {"status":"success","data":{"resultType":"vector","result":[
                  {"metric":{"pod":"web-0"},"value":[1748822400,"0.75"]},
                  {"metric":{"pod":"web-1"},"value":[1748822400,"0.5"]}
                ]}}
                """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(containsString("/api/v1/query")))
            .andRespond(withSuccess("""
                {"status":"success","data":{"resultType":"vector","result":[
                  {"metric":{"pod":"web-0"},"value":[1748822400,"2147483648"]},
                  {"metric":{"pod":"job-7"},"value":[1748822400,"1073741824"]}
                ]}}
                """, MediaType.APPLICATION_JSON));

        // When
        List<PodSample> samples = client.getPodPeaks("shop", "1d", AT);

        // Then
        server.verify();
        assertThat(samples).extracting(PodSample::podName).containsExactly("web-0", "web-1", "job-7");
        assertThat(samples).allSatisfy(s -> assertThat(s.namespace()).isEqualTo("shop"));

        assertThat(samples.get(0).cpuPeakCores()).isCloseTo(0.75, within(1e-9));
        assertThat(samples.get(0).memoryPeakGib()).isCloseTo(2.0, within(1e-9));
        assertThat(samples.get(1).memoryPeakGib()).isZero();
        assertThat(samples.get(2).cpuPeakCores()).isZero();
        assertThat(samples.get(2).memoryPeakGib()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldTreatNaNSampleAsZero() {
        // Given
        server.expect(requestTo(containsString("/api/v1/query")))
            .andRespond(withSuccess("""
                {"status":"success","data":{"resultType":"vector","result":[
                  {"metric":{"pod":"web-0"},"value":[1748822400,"NaN"]},
                  {"metric":{},"value":[1748822400,"1"]}
                ]}}
                """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(containsString("/api/v1/query")))
            .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"result\":[]}}", MediaType.APPLICATION_JSON));

        // When
        List<PodSample> samples = client.getPodPeaks("shop", "1d", AT);

        // Then
        assertThat(samples).singleElement().satisfies(s -> {
            assertThat(s.podName()).isEqualTo("web-0");
            assertThat(s.cpuPeakCores()).isZero();
        });
    }

    @Test
    void shouldThrowWhenStatusIsNotSuccess() {
        // Given
        server.expect(requestTo(containsString("/api/v1/query")))
            .andRespond(withSuccess("{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}",
                MediaType.APPLICATION_JSON));

        // When & Then
        assertThatThrownBy(() -> client.getPodPeaks("shop", "1d", AT))
            .isInstanceOf(MetricsBackendException.class)
            .hasMessageContaining("parse error")
            .satisfies(e -> assertThat(((MetricsBackendException) e).getQuery()).contains("namespace=\"shop\""));
    }

    @Test
    void shouldThrowOnServerError() {
        // Given
        server.expect(requestTo(containsString("/api/v1/query"))).andRespond(withServerError());

        // When & Then
        assertThatThrownBy(() -> client.getPodPeaks("shop", "1d", AT))
            .isInstanceOf(MetricsBackendException.class)
            .hasCauseInstanceOf(RestClientException.class);
    }
}
