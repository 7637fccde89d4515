package com.company.scheduler.domain.enums;

public enum JobStatus {
    PENDING("Job is waiting for its next occurrence"),
    SENT("Job has been delivered and will not fire again"),
    FAILED("Job exceeded its delivery attempt limit");

    private final String description;

    JobStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static JobStatus fromString(String status) {
        if (status == null) {
            return PENDING;
        }
        try {
            return JobStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
