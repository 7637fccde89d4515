package com.company.scheduler.exception;

public class JobOwnershipException extends RuntimeException {
    public JobOwnershipException(String ownerId, String jobId) {
        super("Owner " + ownerId + " may not modify scheduled job " + jobId);
    }
}
