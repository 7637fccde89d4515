package com.company.scheduler.service;

import com.company.scheduler.client.DeliveryClient;
import com.company.scheduler.client.OutboundMessage;
import com.company.scheduler.domain.ScheduledJob;
import com.company.scheduler.domain.enums.JobMode;
import com.company.scheduler.domain.enums.JobStatus;
import com.company.scheduler.dto.request.ScheduleJobRequest;
import com.company.scheduler.dto.request.SendNowRequest;
import com.company.scheduler.exception.JobOwnershipException;
import com.company.scheduler.exception.JobValidationException;
import com.company.scheduler.exception.UpstreamUnavailableException;
import com.company.scheduler.repository.ScheduledJobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Caller-facing job operations: enqueue, immediate send, listing and cancellation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobSchedulingService {

    private final ScheduledJobRepository jobRepository;
    private final OwnerScheduleService ownerScheduleService;
    private final DeliveryClient deliveryClient;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ScheduledJob enqueue(ScheduleJobRequest request) {
        List<String> recipients = validRecipients(request.getRecipients());
        if (isBlank(request.getSubject())) {
            throw new JobValidationException("Subject is required");
        }

        JobMode mode = JobMode.fromCode(request.getMode());
        if (mode == JobMode.AUTO_SUMMARY) {
            if (isBlank(request.getOwnerId())) {
                throw new JobValidationException("ownerId is required for autoSummary jobs");
            }
        } else if (isBlank(request.getBody())) {
            throw new JobValidationException("Body is required for manual jobs");
        }

        Instant sendAt = parseSendAt(request.getSendAt());
        if (mode == JobMode.AUTO_SUMMARY) {
            sendAt = initialOccurrence(request.getOwnerId()).orElse(sendAt);
        }
        if (sendAt == null) {
            throw new JobValidationException("sendAt must be a valid date/time string");
        }

        ScheduledJob job = ScheduledJob.builder()
                .id("job_" + UUID.randomUUID())
                .ownerId(isBlank(request.getOwnerId()) ? null : request.getOwnerId().trim())
                .recipients(recipients)
                .subject(request.getSubject())
                .body(request.getBody() != null ? request.getBody() : "")
                .bodyHtml(request.getBodyHtml())
                .sendAt(sendAt)
                .sent(false)
                .mode(mode)
                .recurring(Boolean.TRUE.equals(request.getRecurring()))
                .aiModel(request.getAiModel())
                .fromName(request.getFromName())
                .status(JobStatus.PENDING)
                .build();

        ScheduledJob saved = jobRepository.upsert(job);
        meterRegistry.counter("scheduler.jobs.enqueued", "mode", mode.getCode()).increment();
        log.info("Enqueued {} job {} for {} ({} recipient(s))",
                mode.getCode(), saved.getId(), saved.getSendAt(), recipients.size());
        return saved;
    }

    /**
     * Delivers immediately without storing anything.
     */
    public void sendNow(SendNowRequest request) {
        List<String> recipients = validRecipients(request.getRecipients());
        if (isBlank(request.getSubject()) || isBlank(request.getBody())) {
            throw new JobValidationException("Subject and body are required");
        }

        deliveryClient.deliver(OutboundMessage.builder()
                .fromName(request.getFromName())
                .recipients(recipients)
                .subject(request.getSubject())
                .plainTextBody(request.getBody())
                .htmlBody(request.getBodyHtml())
                .build());
        meterRegistry.counter("scheduler.jobs.sent_now").increment();
        log.info("Sent message '{}' immediately to {} recipient(s)", request.getSubject(), recipients.size());
    }

    /**
     * Unsent jobs of one owner, ordered by send time then id.
     */
    public List<ScheduledJob> listPending(String ownerId) {
        if (isBlank(ownerId)) {
            throw new JobValidationException("ownerId is required");
        }
        return jobRepository.findPendingByOwner(ownerId.trim());
    }

    /**
     * @return false when no such job exists
     * @throws JobOwnershipException when the job belongs to someone else
     */
    public boolean cancel(String ownerId, String jobId) {
        if (isBlank(ownerId) || isBlank(jobId)) {
            throw new JobValidationException("ownerId and id are required");
        }
        String owner = ownerId.trim();
        String id = jobId.trim();

        Optional<ScheduledJob> existing = jobRepository.findById(id);
        if (existing.isEmpty()) {
            return false;
        }
        String storedOwner = existing.get().getOwnerId() != null ? existing.get().getOwnerId().trim() : "";
        if (!storedOwner.equals(owner)) {
            throw new JobOwnershipException(owner, id);
        }

        boolean deleted = jobRepository.deleteByIdAndOwner(id, storedOwner) > 0;
        if (deleted) {
            log.info("Cancelled job {} for owner {}", id, owner);
        }
        return deleted;
    }

    private Optional<Instant> initialOccurrence(String ownerId) {
        try {
            return ownerScheduleService.nextOccurrence(ownerId.trim(), clock.instant());
        } catch (UpstreamUnavailableException e) {
            log.warn("Could not derive initial send time from schedule of owner {}: {}", ownerId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * ISO-8601 instant or offset date-time; null when absent or unparseable.
     */
    static Instant parseSendAt(String value) {
        if (isBlank(value)) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(trimmed).toInstant();
            } catch (DateTimeParseException notOffset) {
                log.debug("Unparseable sendAt '{}'", trimmed);
                return null;
            }
        }
    }

    private static List<String> validRecipients(List<String> recipients) {
        if (recipients == null || recipients.isEmpty()) {
            throw new JobValidationException("At least one recipient is required");
        }
        List<String> cleaned = recipients.stream()
                .filter(r -> r != null && !r.isBlank())
                .map(String::trim)
                .toList();
        if (cleaned.isEmpty()) {
            throw new JobValidationException("At least one recipient is required");
        }
        return cleaned;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
