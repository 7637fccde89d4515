package com.company.scheduler.service;

import com.company.scheduler.client.MetricsSourceClient;
import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.domain.ScheduledJob;
import com.company.scheduler.domain.dataset.OwnerDataset;
import com.company.scheduler.domain.dataset.OwnerSettings;
import com.company.scheduler.exception.JobValidationException;
import com.company.scheduler.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Regenerates the body of an autoSummary job from the owner's current data.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AutoSummaryService {

    private final MetricsSourceClient metricsSourceClient;
    private final ContentGenerator contentGenerator;
    private final SchedulerProperties properties;

    /**
     * @return a copy of the job carrying fresh content; the stored job is not changed
     */
    public ScheduledJob prepare(ScheduledJob job) {
        if (!job.hasOwner()) {
            throw new JobValidationException("ownerId is required for autoSummary jobs");
        }

        OwnerDataset dataset;
        try {
            dataset = metricsSourceClient.load(job.getOwnerId());
        } catch (UpstreamUnavailableException e) {
            log.warn("Owner data unavailable for job {}, sending placeholder summary: {}", job.getId(), e.getMessage());
            GeneratedContent content = contentGenerator.dataUnavailable();
            return job.withContent(content.getPlainText(), content.getHtml());
        }

        OwnerDataset effective = consolidateIfEnabled(dataset);
        String model = resolveModel(dataset.getSettings(), job.getAiModel());

        GeneratedContent content = contentGenerator.generate(effective, model);
        log.info("Generated summary for job {} with model {}", job.getId(), model);
        return job.withContent(content.getPlainText(), content.getHtml());
    }

    /**
     * Replaces the owner's data with the merged tag dataset when enabled and non-empty.
     */
    OwnerDataset consolidateIfEnabled(OwnerDataset dataset) {
        OwnerSettings settings = dataset.getSettings();
        if (settings == null || settings.getConsolidation() == null || !settings.getConsolidation().isEnabled()) {
            return dataset;
        }
        List<String> tags = settings.getConsolidation().tagList();
        if (tags.isEmpty()) {
            return dataset;
        }

        try {
            Optional<OwnerDataset> merged = metricsSourceClient.consolidate(tags);
            if (merged.isPresent() && !merged.get().isEmpty()) {
                log.debug("Using consolidated data for tags {}", tags);
                return dataset.toBuilder()
                        .entities(merged.get().getEntities())
                        .cases(merged.get().getCases())
                        .build();
            }
        } catch (UpstreamUnavailableException e) {
            log.warn("Consolidation failed for tags {}, using owner data: {}", tags, e.getMessage());
        }
        return dataset;
    }

    /**
     * First configured candidate (owner settings, then job) if allow-listed, else the default.
     */
    String resolveModel(OwnerSettings settings, String jobModel) {
        String candidate = settings != null && settings.getAiModel() != null && !settings.getAiModel().isBlank()
                ? settings.getAiModel()
                : jobModel;
        SchedulerProperties.TextGeneration textGeneration = properties.getTextGeneration();
        if (candidate != null && textGeneration.getAllowedModels().contains(candidate)) {
            return candidate;
        }
        return textGeneration.getDefaultModel();
    }
}
