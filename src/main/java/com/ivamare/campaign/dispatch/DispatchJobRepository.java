package com.ivamare.campaign.dispatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for dispatch jobs.
 */
public interface DispatchJobRepository {

    void save(DispatchJob job);

    Optional<DispatchJob> findById(UUID jobId);

    /**
     * Persist the outcome of one chunk if nobody else moved the cursor meanwhile.
     * A job cancelled while the chunk was in flight keeps its CANCELLED status but still
     * records the chunk's counts.
     *
     * @param jobId The job
     * @param expectedCursor Cursor the chunk was sliced from
     * @param newCursor Cursor after the chunk
     * @param sentDelta Recipients delivered in this chunk
     * @param failedDelta Recipients failed in this chunk
     * @param skippedDelta Recipients skipped in this chunk
     * @param newStatus Status after the chunk
     * @param now Timestamp of the advance
     * @return false if the cursor was not at {@code expectedCursor}
     */
    boolean advance(UUID jobId, int expectedCursor, int newCursor, int sentDelta, int failedDelta,
                    int skippedDelta, DispatchStatus newStatus, Instant now);

    /**
     * Move a non-terminal job to CANCELLED.
     *
     * @return false if the job is already terminal or unknown
     */
    boolean cancel(UUID jobId, Instant now);

    /**
     * Non-terminal jobs, oldest first.
     */
    List<DispatchJob> findRunnable(int limit);

    /**
     * Jobs with the given status (or all, if null), newest first.
     */
    List<DispatchJob> list(DispatchStatus status, int limit);

    int countByStatus(DispatchStatus status);
}
