package com.company.scheduler.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to store a job for later delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleJobRequest {

    // Required for autoSummary jobs and recurring manual jobs
    private String ownerId;

    @NotEmpty(message = "At least one recipient is required")
    private List<String> recipients;

    @NotBlank(message = "Subject is required")
    private String subject;

    // Required for manual jobs
    private String body;
    private String bodyHtml;

    // ISO-8601; may be omitted for autoSummary jobs whose owner has a schedule
    private String sendAt;

    // manual (default) or autoSummary
    private String mode;

    private String aiModel;
    private String fromName;
    private Boolean recurring;
}
