package com.company.scheduler.service;

import com.company.scheduler.client.TextGenerationClient;
import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.domain.PerformanceRow;
import com.company.scheduler.domain.dataset.MetricEntity;
import com.company.scheduler.domain.dataset.OwnerDataset;
import com.company.scheduler.domain.dataset.RemediationCase;
import com.company.scheduler.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Turns an owner dataset into a rendered summary. Never throws: upstream
 * failures and malformed replies degrade to plain text wrapped in minimal HTML.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentGenerator {

    private final PerformanceAggregator aggregator;
    private final SummaryPromptBuilder promptBuilder;
    private final SummaryResponseParser responseParser;
    private final SummaryRenderer renderer;
    private final TextGenerationClient textGenerationClient;
    private final SchedulerProperties properties;

    public GeneratedContent generate(OwnerDataset dataset, String model) {
        List<MetricEntity> entities = dataset.getEntities() != null ? dataset.getEntities() : List.of();
        List<RemediationCase> cases = dataset.getCases() != null ? dataset.getCases() : List.of();

        List<PerformanceRow> rows = aggregator.aggregate(entities, cases);
        SummaryPrompt prompt = promptBuilder.build(entities, cases, rows);

        String raw;
        try {
            raw = textGenerationClient.complete(model, prompt.getSystemPrompt(), prompt.getUserPrompt());
        } catch (UpstreamUnavailableException e) {
            log.warn("Summary text unavailable from model {}: {}", model, e.getMessage());
            raw = properties.getContent().getGenerationErrorText();
        }

        return render(raw, rows);
    }

    /**
     * Renders an upstream reply against the aggregated rows.
     */
    public GeneratedContent render(String raw, List<PerformanceRow> rows) {
        String text = raw == null ? "" : raw;
        Optional<SummaryResponse> parsed = responseParser.parse(text);
        if (parsed.isEmpty()) {
            log.warn("Upstream summary was not structured, sending raw text ({} chars)", text.length());
            return fallback(text);
        }

        try {
            SummaryResponse summary = parsed.get();
            return new GeneratedContent(
                    renderer.renderText(summary, rows),
                    renderer.renderHtml(summary, rows));
        } catch (RuntimeException e) {
            log.error("Failed to render structured summary, sending raw text", e);
            return fallback(text);
        }
    }

    /**
     * Content used when the owner's data could not be loaded.
     */
    public GeneratedContent dataUnavailable() {
        return fallback(properties.getContent().getDataUnavailableText());
    }

    private GeneratedContent fallback(String text) {
        return new GeneratedContent(text, renderer.renderFallbackHtml(text));
    }
}
