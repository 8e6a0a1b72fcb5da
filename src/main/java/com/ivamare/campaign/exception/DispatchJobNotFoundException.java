package com.ivamare.campaign.exception;

import java.util.UUID;

/**
 * Thrown when a dispatch job cannot be found.
 */
public class DispatchJobNotFoundException extends CampaignException {

    private final UUID jobId;

    public DispatchJobNotFoundException(UUID jobId) {
        super("Dispatch job " + jobId + " not found");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
