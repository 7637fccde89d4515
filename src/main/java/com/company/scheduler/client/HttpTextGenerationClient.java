package com.company.scheduler.client;

import com.company.scheduler.cache.CachedCompletion;
import com.company.scheduler.cache.CompletionCache;
import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.AllArgsConstructor;
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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Client for an OpenAI-compatible chat completion endpoint.
 */
@Component
@Slf4j
public class HttpTextGenerationClient implements TextGenerationClient {

    private final RestTemplate restTemplate;
    private final SchedulerProperties properties;
    private final CompletionCache completionCache;

    public HttpTextGenerationClient(@Qualifier("textGenerationRestTemplate") RestTemplate restTemplate,
                                    SchedulerProperties properties,
                                    CompletionCache completionCache) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.completionCache = completionCache;
    }

    @Override
    @CircuitBreaker(name = "textGeneration", fallbackMethod = "completeFallback")
    public String complete(String model, String systemPrompt, String userPrompt) {
        String cacheKey = CompletionCache.keyOf(model, systemPrompt, userPrompt);
        Optional<CachedCompletion> cached = completionCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Completion cache hit for model {}", model);
            return cached.get().getText();
        }

        ChatRequest request = new ChatRequest(model, List.of(
                new ChatMessage("system", systemPrompt),
                new ChatMessage("user", userPrompt)), false);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        JsonNode reply;
        try {
            reply = restTemplate.postForObject(
                    properties.getTextGeneration().getUrl(),
                    new HttpEntity<>(request, headers),
                    JsonNode.class);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("Text generation request failed: " + e.getMessage(), e);
        }

        Optional<String> text = extractReply(reply);
        if (text.isEmpty()) {
            log.warn("Text generation reply for model {} carried no content", model);
            return properties.getContent().getEmptyReplyText();
        }

        completionCache.put(cacheKey, CachedCompletion.builder()
                .model(model)
                .text(text.get())
                .createdAt(Instant.now())
                .build());
        return text.get();
    }

    /**
     * choices[0].message.content, else choices[0].delta.content.
     */
    static Optional<String> extractReply(JsonNode reply) {
        if (reply == null) {
            return Optional.empty();
        }
        JsonNode choice = reply.path("choices").path(0);
        String content = choice.path("message").path("content").asText("");
        if (content.isEmpty()) {
            content = choice.path("delta").path("content").asText("");
        }
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    private String completeFallback(String model, String systemPrompt, String userPrompt, Throwable t) {
        if (t instanceof UpstreamUnavailableException) {
            throw (UpstreamUnavailableException) t;
        }
        log.warn("Text generation unavailable for model {}: {}", model, t.getMessage());
        throw new UpstreamUnavailableException("Text generation unavailable: " + t.getMessage(), t);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ChatRequest {
        private String model;
        private List<ChatMessage> messages;
        private boolean stream;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ChatMessage {
        private String role;
        private String content;
    }
}
