package com.company.scheduler.dto.response;

import com.company.scheduler.domain.ScheduledJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingJobSummary {
    private String id;
    private String subject;
    private long sendAt;        // epoch milliseconds
    private String mode;
    private List<String> recipients;
    private boolean recurring;

    public static PendingJobSummary from(ScheduledJob job) {
        return PendingJobSummary.builder()
                .id(job.getId())
                .subject(job.getSubject() != null ? job.getSubject() : "")
                .sendAt(job.getSendAt().toEpochMilli())
                .mode(job.getMode().getCode())
                .recipients(job.getRecipients())
                .recurring(job.isRecurring())
                .build();
    }
}
