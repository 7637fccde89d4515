package com.company.scheduler.domain.enums;

public enum TargetRule {
    GTE("gte", "Actual must be greater than or equal to target"),
    LTE("lte", "Actual must be less than or equal to target"),
    WITHIN_RANGE("within_range", "Actual must fall inside the target range");

    private final String code;
    private final String description;

    TargetRule(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static TargetRule fromCode(String code) {
        if (code == null || code.isBlank()) {
            return GTE;
        }
        for (TargetRule rule : values()) {
            if (rule.code.equalsIgnoreCase(code.trim())) {
                return rule;
            }
        }
        return GTE;
    }
}
