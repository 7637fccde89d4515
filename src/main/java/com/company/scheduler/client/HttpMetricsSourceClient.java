package com.company.scheduler.client;

import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.domain.dataset.MetricEntity;
import com.company.scheduler.domain.dataset.OwnerDataset;
import com.company.scheduler.domain.dataset.RemediationCase;
import com.company.scheduler.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class HttpMetricsSourceClient implements MetricsSourceClient {

    private final RestTemplate restTemplate;
    private final SchedulerProperties properties;

    public HttpMetricsSourceClient(@Qualifier("metricsSourceRestTemplate") RestTemplate restTemplate,
                                   SchedulerProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "metricsSource", fallbackMethod = "loadFallback")
    public OwnerDataset load(String ownerId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getMetricsSource().getBaseUrl())
                .path("/load")
                .queryParam("userId", ownerId)
                .encode()
                .build()
                .toUri();
        try {
            OwnerDataset dataset = restTemplate.getForObject(uri, OwnerDataset.class);
            return dataset != null ? dataset : OwnerDataset.empty();
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("Failed to load data for owner " + ownerId + ": " + e.getMessage(), e);
        }
    }

    @Override
    @CircuitBreaker(name = "metricsSource", fallbackMethod = "consolidateFallback")
    public Optional<OwnerDataset> consolidate(List<String> tags) {
        String url = properties.getMetricsSource().getBaseUrl() + "/consolidate";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ConsolidatedDataset reply = restTemplate.postForObject(
                    url, new HttpEntity<>(Map.of("tags", tags), headers), ConsolidatedDataset.class);
            if (reply == null || !reply.isSuccess()) {
                return Optional.empty();
            }
            return Optional.of(reply.toDataset());
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("Failed to consolidate data for tags " + tags + ": " + e.getMessage(), e);
        }
    }

    private OwnerDataset loadFallback(String ownerId, Throwable t) {
        throw asUpstreamUnavailable("load", t);
    }

    private Optional<OwnerDataset> consolidateFallback(List<String> tags, Throwable t) {
        throw asUpstreamUnavailable("consolidate", t);
    }

    private static UpstreamUnavailableException asUpstreamUnavailable(String operation, Throwable t) {
        if (t instanceof UpstreamUnavailableException) {
            return (UpstreamUnavailableException) t;
        }
        log.warn("Metrics source {} unavailable: {}", operation, t.getMessage());
        return new UpstreamUnavailableException("Metrics source " + operation + " unavailable: " + t.getMessage(), t);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConsolidatedDataset {
        private boolean success;

        @JsonAlias("bowlers")
        private List<MetricEntity> entities = new ArrayList<>();

        @JsonAlias("a3Cases")
        private List<RemediationCase> cases = new ArrayList<>();

        OwnerDataset toDataset() {
            return OwnerDataset.builder()
                    .entities(entities != null ? entities : new ArrayList<>())
                    .cases(cases != null ? cases : new ArrayList<>())
                    .build();
        }
    }
}
