package com.company.scheduler.domain;

import com.company.scheduler.domain.enums.JobMode;
import com.company.scheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of future delivery work.
 * A job with sent = true is terminal; sendAt is the single instant at which
 * a pending job is next considered due.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {

    private String id;
    private String ownerId;

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private String subject;
    private String body;
    private String bodyHtml;

    // Epoch-millisecond precision
    private Instant sendAt;
    private boolean sent;

    @Builder.Default
    private JobMode mode = JobMode.MANUAL;
    private boolean recurring;

    private String aiModel;
    private String fromName;

    // Delivery bookkeeping
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;
    private int failureCount;
    private String lastError;
    private Instant lastAttemptAt;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isAutoSummary() {
        return mode == JobMode.AUTO_SUMMARY;
    }

    public boolean hasOwner() {
        return ownerId != null && !ownerId.isBlank();
    }

    public boolean isDue(Instant now) {
        return !sent && sendAt != null && !sendAt.isAfter(now);
    }

    /**
     * Copy carrying regenerated content. The stored job is not touched.
     */
    public ScheduledJob withContent(String newBody, String newBodyHtml) {
        return toBuilder()
                .body(newBody)
                .bodyHtml(newBodyHtml)
                .build();
    }
}
