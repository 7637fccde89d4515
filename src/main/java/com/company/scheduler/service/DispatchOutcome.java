package com.company.scheduler.service;

/**
 * What happened to one due job during a pass.
 */
public enum DispatchOutcome {
    SENT,
    RESCHEDULED,
    DELIVERY_FAILED,
    FAILED_TERMINAL,
    CONFLICT,
    STORE_ERROR
}
