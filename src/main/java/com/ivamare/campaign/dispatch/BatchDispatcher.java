package com.ivamare.campaign.dispatch;

import java.util.List;
import java.util.UUID;

/**
 * Chunked, resumable delivery of a payload to a recipient list.
 *
 * <p>Callers submit a job, then invoke {@link #advance} repeatedly (usually from a scheduler)
 * until it reports {@code done}. Each advance processes at most one chunk, so its duration is
 * bounded regardless of the total recipient count. Delivery is at-least-once: a crash between
 * the transport calls of a chunk and the cursor update re-sends that chunk.
 */
public interface BatchDispatcher {

    /**
     * Create a pending job.
     *
     * @param payload message to send
     * @param recipientIds recipient addresses, stored trimmed and lower-cased; duplicates are
     *                     dropped, first occurrence wins
     * @param chunkSize recipients per advance
     * @return the job id
     */
    UUID submit(DispatchPayload payload, List<String> recipientIds, int chunkSize);

    /**
     * Create a pending job with a label.
     */
    UUID submit(String label, DispatchPayload payload, List<String> recipientIds, int chunkSize);

    /**
     * Process the next chunk of a job.
     *
     * <p>Recipients that are no longer eligible are skipped. A failing recipient is counted and
     * does not stop the chunk. On a terminal job this is a no-op returning the final counts.
     *
     * @param jobId the job
     * @return cumulative counts after this advance
     * @throws com.ivamare.campaign.exception.DispatchJobNotFoundException if the job is unknown
     * @throws com.ivamare.campaign.exception.StoreFailureException if eligibility or the cursor
     *         could not be read or written
     */
    AdvanceResult advance(UUID jobId);

    /**
     * Cancel a job. Takes effect at the next advance boundary; a chunk in flight completes.
     *
     * @return true if the job was cancelled, false if it was already terminal
     */
    boolean cancel(UUID jobId);

    DispatchJob getJob(UUID jobId);

    List<DispatchJob> listJobs(DispatchStatus status, int limit);

    /**
     * Non-terminal jobs, oldest first, for schedulers.
     */
    List<DispatchJob> findRunnable(int limit);
}
