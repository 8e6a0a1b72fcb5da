package com.ivamare.campaign.dispatch;

import java.util.UUID;

/**
 * Cumulative progress of a job after an advance.
 *
 * @param jobId The job
 * @param sent Total recipients delivered to
 * @param failed Total recipients whose transport call failed
 * @param skipped Total recipients skipped as no longer eligible
 * @param cursor Offset of the next recipient
 * @param total Number of recipients in the job
 * @param status Status after the advance
 * @param done Whether the job is terminal
 */
public record AdvanceResult(
    UUID jobId,
    int sent,
    int failed,
    int skipped,
    int cursor,
    int total,
    DispatchStatus status,
    boolean done
) {
    public static AdvanceResult of(DispatchJob job) {
        return new AdvanceResult(
            job.jobId(), job.sentCount(), job.failedCount(), job.skippedCount(),
            job.cursor(), job.totalCount(), job.status(), job.isTerminal()
        );
    }
}
