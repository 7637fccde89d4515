package com.company.scheduler.domain.enums;

public enum ScheduleFrequency {
    WEEKLY,
    MONTHLY;

    /**
     * Unknown or missing values fall back to WEEKLY.
     */
    public static ScheduleFrequency fromString(String frequency) {
        if (frequency == null) {
            return WEEKLY;
        }
        try {
            return ScheduleFrequency.valueOf(frequency.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return WEEKLY;
        }
    }
}
