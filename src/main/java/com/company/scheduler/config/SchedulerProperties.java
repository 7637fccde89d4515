package com.company.scheduler.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Data
@Validated
public class SchedulerProperties {

    private final Dispatch dispatch = new Dispatch();
    private final Retry retry = new Retry();
    private final TextGeneration textGeneration = new TextGeneration();
    private final Delivery delivery = new Delivery();
    private final MetricsSource metricsSource = new MetricsSource();
    private final Content content = new Content();

    @Data
    public static class Dispatch {
        private boolean enabled = true;
        @Positive
        private long fixedDelayMs = 60000L;
        @Positive
        private int corePoolSize = 4;
        @Positive
        private int maxPoolSize = 16;
        @Positive
        private int queueCapacity = 500;
        @NotNull
        private Duration shutdownAwait = Duration.ofMinutes(2);
    }

    /**
     * Delivery retry policy. maxAttempts = 0 means retry on every pass without limit.
     */
    @Data
    public static class Retry {
        @Min(0)
        private int maxAttempts = 0;
        @NotNull
        private Duration initialBackoff = Duration.ZERO;
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
        @NotNull
        private Duration maxBackoff = Duration.ofHours(6);
    }

    @Data
    public static class TextGeneration {
        @NotBlank
        private String url = "http://localhost:8787/api/chat";
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
        @NotBlank
        private String defaultModel = "deepseek";
        @NotEmpty
        private List<String> allowedModels = new ArrayList<>(List.of("deepseek", "gemini", "kimi", "glm"));
        private final Cache cache = new Cache();

        @Data
        public static class Cache {
            // redis, caffeine or none
            @NotBlank
            private String type = "caffeine";
            @NotNull
            private Duration ttl = Duration.ofMinutes(5);
            @Positive
            private int maximumSize = 500;
        }
    }

    @Data
    public static class Delivery {
        @NotBlank
        private String url = "https://api.resend.com/emails";
        private String apiKey;
        @NotBlank
        private String fromAddress = "no-reply@example.com";
        @NotBlank
        private String defaultFromName = "Summary Scheduler";
        private List<String> allowedFromNames = new ArrayList<>();
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class MetricsSource {
        @NotBlank
        private String baseUrl = "http://localhost:8788";
        @NotNull
        private Duration timeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Content {
        @NotBlank
        private String generationErrorText =
                "Sorry, there was an error generating the summary. Please try again later.";
        @NotBlank
        private String emptyReplyText = "Sorry, I couldn't generate a response.";
        @NotBlank
        private String dataUnavailableText =
                "Performance data was unavailable when this summary was prepared. "
                        + "The next scheduled summary will include the latest figures.";
    }
}
