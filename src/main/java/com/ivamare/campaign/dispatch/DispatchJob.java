package com.ivamare.campaign.dispatch;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A chunked send of one payload to an ordered list of recipients.
 *
 * <p>{@code cursor} is the offset of the next recipient to process and the resumability
 * contract: everything before it has been attempted and counted.
 *
 * @param jobId Unique identifier
 * @param label Optional human-readable label (nullable)
 * @param payload Message to send
 * @param recipientIds Ordered, de-duplicated recipient addresses
 * @param chunkSize Recipients processed per advance
 * @param cursor Offset of the next recipient
 * @param sentCount Recipients delivered to
 * @param failedCount Recipients whose transport call failed
 * @param skippedCount Recipients no longer eligible when their chunk was sliced
 * @param status Current status
 * @param createdAt Creation timestamp
 * @param updatedAt Last state change
 * @param lastAdvancedAt When the last chunk was persisted (nullable)
 * @param completedAt When the job reached a terminal status (nullable)
 */
public record DispatchJob(
    UUID jobId,
    String label,
    DispatchPayload payload,
    List<String> recipientIds,
    int chunkSize,
    int cursor,
    int sentCount,
    int failedCount,
    int skippedCount,
    DispatchStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant lastAdvancedAt,
    Instant completedAt
) {
    public DispatchJob {
        recipientIds = List.copyOf(recipientIds);
    }

    /**
     * Creates a new pending job.
     */
    public static DispatchJob create(String label, DispatchPayload payload, List<String> recipientIds,
                                     int chunkSize, Instant now) {
        return new DispatchJob(
            UUID.randomUUID(), label, payload, recipientIds, chunkSize,
            0, 0, 0, 0,
            DispatchStatus.PENDING,
            now, now, null, null
        );
    }

    public int totalCount() {
        return recipientIds.size();
    }

    public int remainingCount() {
        return totalCount() - cursor;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
