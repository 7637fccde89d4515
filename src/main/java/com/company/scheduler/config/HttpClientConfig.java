package com.company.scheduler.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One RestTemplate per collaborator, each with its own bounded timeouts.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final SchedulerProperties properties;

    @Bean
    public RestTemplate textGenerationRestTemplate(RestTemplateBuilder builder) {
        return build(builder, properties.getTextGeneration().getTimeout());
    }

    @Bean
    public RestTemplate deliveryRestTemplate(RestTemplateBuilder builder) {
        return build(builder, properties.getDelivery().getTimeout());
    }

    @Bean
    public RestTemplate metricsSourceRestTemplate(RestTemplateBuilder builder) {
        return build(builder, properties.getMetricsSource().getTimeout());
    }

    private static RestTemplate build(RestTemplateBuilder builder, Duration readTimeout) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(readTimeout)
                .build();
    }
}
