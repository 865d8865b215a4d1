package io.opswatch.anomaly.source;

import io.opswatch.anomaly.exception.SourceUnavailableException;
import io.opswatch.anomaly.model.MetricSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PrometheusMetricSourceTest {

    private static final Instant END = Instant.parse("2026-03-02T11:00:00Z");

    private MockRestServiceServer instantServer;
    private MockRestServiceServer rangeServer;
    private PrometheusMetricSource source;

    @BeforeEach
    void setUp() {
        RestTemplate instantClient = new RestTemplate();
        RestTemplate rangeClient = new RestTemplate();
        instantServer = MockRestServiceServer.bindTo(instantClient).build();
        rangeServer = MockRestServiceServer.bindTo(rangeClient).build();
        source = new PrometheusMetricSource("http://prometheus:9090/", instantClient, rangeClient);
    }

    @Test
    void parsesInstantValue() {
        instantServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query?")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("query", "node_load1"))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"resultType\":\"vector\","
                        + "\"result\":[{\"metric\":{},\"value\":[1772449200.123,\"1.75\"]}]}}", MediaType.APPLICATION_JSON));

        assertThat(source.queryInstant("node_load1")).isEqualTo(1.75);
        instantServer.verify();
    }

    @Test
    void parsesRangeAndSkipsNonFiniteValues() {
        rangeServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query_range?")))
                .andExpect(queryParam("start", String.valueOf(END.minusSeconds(120).getEpochSecond())))
                .andExpect(queryParam("end", String.valueOf(END.getEpochSecond())))
                .andExpect(queryParam("step", "60"))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":["
                        + "{\"metric\":{\"instance\":\"a\"},\"values\":[[1772442000,\"1\"],[1772442060,\"NaN\"],[1772442120,\"3.5\"]]},"
                        + "{\"metric\":{\"instance\":\"b\"},\"values\":[[1772442000,\"9\"]]}]}}", MediaType.APPLICATION_JSON));

        List<MetricSample> samples = source.queryRange("up", END.minusSeconds(120), END, Duration.ofMinutes(1));

        assertThat(samples).extracting(MetricSample::getValue).containsExactly(1.0, 3.5);
        assertThat(samples.get(1).getTimestamp()).isEqualTo(Instant.ofEpochSecond(1772442120));
        assertThat(samples).allMatch(sample -> sample.getMetricName().equals("up"));
    }

    @Test
    void emptyRangeIsEmptyList() {
        rangeServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query_range")))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":[]}}",
                        MediaType.APPLICATION_JSON));

        assertThat(source.queryRange("up", END.minusSeconds(60), END, Duration.ofMinutes(1))).isEmpty();
    }

    @Test
    void emptyInstantResultIsUnavailable() {
        instantServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query")))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> source.queryInstant("missing")).isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    void queryErrorIsUnavailable() {
        instantServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query")))
                .andRespond(withSuccess("{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> source.queryInstant("sum(")).isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("parse error");
    }

    @Test
    void serverErrorIsUnavailable() {
        rangeServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query_range")))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> source.queryRange("up", END.minusSeconds(60), END, Duration.ofMinutes(1)))
                .isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    void timeoutIsUnavailable() {
        instantServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query")))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> source.queryInstant("up"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasCauseInstanceOf(ResourceAccessException.class);
    }

    @Test
    void malformedValueIsUnavailable() {
        instantServer.expect(requestTo(startsWith("http://prometheus:9090/api/v1/query")))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"result\":[{\"value\":[1,\"abc\"]}]}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> source.queryInstant("up")).isInstanceOf(SourceUnavailableException.class);
    }
}
