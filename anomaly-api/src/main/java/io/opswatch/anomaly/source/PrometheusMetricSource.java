package io.opswatch.anomaly.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.opswatch.anomaly.exception.SourceUnavailableException;
import io.opswatch.anomaly.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link MetricSource} backed by the Prometheus HTTP API. Instant and range queries use
 * separate clients so each carries its own read timeout.
 */
@Slf4j
public class PrometheusMetricSource implements MetricSource {

    private final String baseUrl;
    private final RestTemplate instantClient;
    private final RestTemplate rangeClient;

    public PrometheusMetricSource(String baseUrl, RestTemplate instantClient, RestTemplate rangeClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.instantClient = instantClient;
        this.rangeClient = rangeClient;
    }

    // PromQL goes in as a template variable so braces and '+' are encoded strictly
    @Override
    public double queryInstant(String metricName) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/v1/query")
                .queryParam("query", "{query}")
                .encode()
                .buildAndExpand(metricName)
                .toUri();
        JsonNode result = fetchResult(instantClient, uri, metricName);
        if (!result.isArray() || result.isEmpty()) {
            throw new SourceUnavailableException("No current value for " + metricName);
        }
        JsonNode value = result.get(0).path("value");
        return parseValue(value.path(1), metricName);
    }

    @Override
    public List<MetricSample> queryRange(String metricName, Instant start, Instant end, Duration step) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/v1/query_range")
                .queryParam("query", "{query}")
                .queryParam("start", start.getEpochSecond())
                .queryParam("end", end.getEpochSecond())
                .queryParam("step", step.toSeconds())
                .encode()
                .buildAndExpand(metricName)
                .toUri();
        JsonNode result = fetchResult(rangeClient, uri, metricName);
        List<MetricSample> samples = new ArrayList<>();
        if (!result.isArray() || result.isEmpty()) {
            return samples;
        }
        if (result.size() > 1) {
            log.debug("Query {} returned {} series, using the first", metricName, result.size());
        }
        for (JsonNode pair : result.get(0).path("values")) {
            Instant ts = Instant.ofEpochMilli(Math.round(pair.path(0).asDouble() * 1000));
            double value = parseValue(pair.path(1), metricName);
            if (Double.isFinite(value)) {
                samples.add(new MetricSample(metricName, ts, value));
            }
        }
        return samples;
    }

    private JsonNode fetchResult(RestTemplate client, URI uri, String metricName) {
        ResponseEntity<JsonNode> response;
        try {
            response = client.getForEntity(uri, JsonNode.class);
        } catch (RestClientException e) {
            throw new SourceUnavailableException("Metric source request failed for " + metricName, e);
        }
        JsonNode body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null) {
            throw new SourceUnavailableException("Metric source returned " + response.getStatusCode() + " for " + metricName);
        }
        if (!"success".equals(body.path("status").asText())) {
            throw new SourceUnavailableException("Metric source query failed for " + metricName + ": "
                    + body.path("error").asText("unknown error"));
        }
        return body.path("data").path("result");
    }

    private static double parseValue(JsonNode node, String metricName) {
        if (node.isMissingNode() || node.isNull()) {
            throw new SourceUnavailableException("Malformed sample for " + metricName);
        }
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            throw new SourceUnavailableException("Malformed sample value '" + node.asText() + "' for " + metricName, e);
        }
    }
}
