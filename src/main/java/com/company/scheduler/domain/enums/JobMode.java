package com.company.scheduler.domain.enums;

public enum JobMode {
    MANUAL("manual", "Content fixed when the job is created"),
    AUTO_SUMMARY("autoSummary", "Content regenerated from live metric data at each firing");

    private final String code;
    private final String description;

    JobMode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Anything other than "autoSummary" is treated as a manual job.
     */
    public static JobMode fromCode(String code) {
        if (code == null) {
            return MANUAL;
        }
        for (JobMode mode : values()) {
            if (mode.code.equalsIgnoreCase(code.trim()) || mode.name().equalsIgnoreCase(code.trim())) {
                return mode;
            }
        }
        return MANUAL;
    }
}
