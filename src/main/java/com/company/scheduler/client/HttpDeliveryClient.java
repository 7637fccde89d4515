package com.company.scheduler.client;

import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.exception.DeliveryException;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Sends messages through a Resend-compatible HTTP API.
 */
@Component
@Slf4j
public class HttpDeliveryClient implements DeliveryClient {

    private final RestTemplate restTemplate;
    private final SchedulerProperties properties;
    private final Tracer tracer;

    public HttpDeliveryClient(@Qualifier("deliveryRestTemplate") RestTemplate restTemplate,
                              SchedulerProperties properties,
                              Tracer tracer) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.tracer = tracer;
    }

    @Override
    public void deliver(OutboundMessage message) {
        SchedulerProperties.Delivery delivery = properties.getDelivery();
        if (delivery.getApiKey() == null || delivery.getApiKey().isBlank()) {
            throw new DeliveryException("Delivery API key is not configured");
        }

        Span span = tracer.spanBuilder("delivery.send").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("delivery.recipients", message.getRecipients().size());

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(delivery.getApiKey());

            SendRequest request = new SendRequest(
                    fromHeader(message.getFromName()),
                    message.getRecipients(),
                    message.getSubject(),
                    message.getPlainTextBody(),
                    message.getHtmlBody());

            ResponseEntity<String> response =
                    restTemplate.postForEntity(delivery.getUrl(), new HttpEntity<>(request, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DeliveryException("Delivery rejected: " + response.getStatusCode().value()
                        + " " + response.getBody());
            }
            span.setStatus(StatusCode.OK);
            log.debug("Delivered '{}' to {} recipient(s)", message.getSubject(), message.getRecipients().size());

        } catch (RestClientResponseException e) {
            span.setStatus(StatusCode.ERROR);
            throw new DeliveryException("Delivery rejected: " + e.getStatusCode().value() + " "
                    + e.getStatusText() + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            span.setStatus(StatusCode.ERROR);
            throw new DeliveryException("Delivery request failed: " + e.getMessage(), e);
        } catch (DeliveryException e) {
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Display name honoured only when allow-listed; the address is always the configured one.
     */
    String fromHeader(String requestedName) {
        SchedulerProperties.Delivery delivery = properties.getDelivery();
        String name = requestedName != null && delivery.getAllowedFromNames().contains(requestedName)
                ? requestedName
                : delivery.getDefaultFromName();
        return name + " <" + delivery.getFromAddress() + ">";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class SendRequest {
        private String from;
        private List<String> to;
        private String subject;
        private String text;
        private String html;
    }
}
