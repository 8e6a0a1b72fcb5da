package com.ivamare.campaign.dispatch.impl;

import com.ivamare.campaign.dispatch.AdvanceResult;
import com.ivamare.campaign.dispatch.BatchDispatcher;
import com.ivamare.campaign.dispatch.DispatchJob;
import com.ivamare.campaign.dispatch.DispatchJobRepository;
import com.ivamare.campaign.dispatch.DispatchPayload;
import com.ivamare.campaign.dispatch.DispatchStatus;
import com.ivamare.campaign.dispatch.Transport;
import com.ivamare.campaign.exception.DispatchJobNotFoundException;
import com.ivamare.campaign.exception.InvalidOperationException;
import com.ivamare.campaign.exception.StoreGuard;
import com.ivamare.campaign.exception.TransportException;
import com.ivamare.campaign.recipient.RecipientRegistry;
import com.ivamare.campaign.recipient.RecipientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of BatchDispatcher.
 *
 * <p>Within one process a job is advanced by at most one thread at a time. Across processes
 * the cursor guard on the repository rejects the second writer of the same chunk.
 */
public class DefaultBatchDispatcher implements BatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultBatchDispatcher.class);

    private final DispatchJobRepository jobRepository;
    private final RecipientRepository recipientRepository;
    private final Transport transport;
    private final Clock clock;
    private final int maxChunkSize;

    private final Set<UUID> advancing = ConcurrentHashMap.newKeySet();

    public DefaultBatchDispatcher(
            DispatchJobRepository jobRepository,
            RecipientRepository recipientRepository,
            Transport transport,
            Clock clock,
            int maxChunkSize) {
        this.jobRepository = jobRepository;
        this.recipientRepository = recipientRepository;
        this.transport = transport;
        this.clock = clock;
        this.maxChunkSize = maxChunkSize;
    }

    @Override
    public UUID submit(DispatchPayload payload, List<String> recipientIds, int chunkSize) {
        return submit(null, payload, recipientIds, chunkSize);
    }

    @Override
    public UUID submit(String label, DispatchPayload payload, List<String> recipientIds, int chunkSize) {
        if (payload == null) {
            throw new InvalidOperationException("Dispatch payload is required");
        }
        if (chunkSize < 1 || chunkSize > maxChunkSize) {
            throw new InvalidOperationException(
                "Chunk size must be between 1 and " + maxChunkSize + ": " + chunkSize);
        }
        List<String> recipients = deduplicate(recipientIds);

        DispatchJob job = DispatchJob.create(label, payload, recipients, chunkSize, clock.instant());
        StoreGuard.run("create dispatch job", () -> jobRepository.save(job));

        log.info("Submitted dispatch job {} ({} recipients, chunkSize={}{})",
            job.jobId(), recipients.size(), chunkSize, label != null ? ", label=" + label : "");
        return job.jobId();
    }

    @Override
    public AdvanceResult advance(UUID jobId) {
        if (!advancing.add(jobId)) {
            throw new InvalidOperationException("Dispatch job " + jobId + " is already being advanced");
        }
        try {
            return advanceExclusively(jobId);
        } finally {
            advancing.remove(jobId);
        }
    }

    private AdvanceResult advanceExclusively(UUID jobId) {
        DispatchJob job = getJob(jobId);
        if (job.isTerminal()) {
            log.debug("Dispatch job {} is already {}", jobId, job.status());
            return AdvanceResult.of(job);
        }

        int from = job.cursor();
        int to = Math.min(from + job.chunkSize(), job.totalCount());
        List<String> slice = job.recipientIds().subList(from, to);

        // Eligibility is read before any send; a failure here leaves the chunk untouched
        Set<String> eligible = StoreGuard.call("read recipient eligibility",
            () -> recipientRepository.findEligible(slice));

        int sent = 0;
        int failed = 0;
        int skipped = 0;
        for (String address : slice) {
            if (!eligible.contains(address)) {
                skipped++;
                log.debug("Skipping recipient {} of job {}: no longer eligible", address, jobId);
                continue;
            }
            if (deliver(jobId, address, job.payload())) {
                sent++;
            } else {
                failed++;
            }
        }

        DispatchStatus newStatus = nextStatus(job, to, sent, failed);
        Instant now = clock.instant();
        int sentDelta = sent;
        int failedDelta = failed;
        int skippedDelta = skipped;
        boolean persisted = StoreGuard.call("persist dispatch cursor",
            () -> jobRepository.advance(jobId, from, to, sentDelta, failedDelta, skippedDelta, newStatus, now));
        if (!persisted) {
            throw new InvalidOperationException(
                "Dispatch job " + jobId + " cursor moved concurrently (expected " + from + ")");
        }

        DispatchJob updated = getJob(jobId);
        log.debug("Advanced dispatch job {} to {}/{} (sent={}, failed={}, skipped={})",
            jobId, to, job.totalCount(), sent, failed, skipped);
        if (updated.isTerminal()) {
            log.info("Dispatch job {} finished with status {} (sent={}, failed={}, skipped={})",
                jobId, updated.status(), updated.sentCount(), updated.failedCount(), updated.skippedCount());
        }
        return AdvanceResult.of(updated);
    }

    private boolean deliver(UUID jobId, String address, DispatchPayload payload) {
        try {
            boolean delivered = transport.send(address, payload);
            if (!delivered) {
                log.warn("Transport declined recipient {} of job {}", address, jobId);
            }
            return delivered;
        } catch (TransportException e) {
            log.warn("Transport failed for recipient {} of job {}: {}", address, jobId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Unexpected transport error for recipient {} of job {}: {}", address, jobId, e.getMessage(), e);
            return false;
        }
    }

    private static DispatchStatus nextStatus(DispatchJob job, int newCursor, int sent, int failed) {
        if (newCursor < job.totalCount()) {
            return DispatchStatus.RUNNING;
        }
        int totalSent = job.sentCount() + sent;
        int totalFailed = job.failedCount() + failed;
        return totalSent == 0 && totalFailed > 0 ? DispatchStatus.FAILED : DispatchStatus.COMPLETED;
    }

    @Override
    public boolean cancel(UUID jobId) {
        DispatchJob job = getJob(jobId);
        if (job.isTerminal()) {
            log.debug("Dispatch job {} is already {}, nothing to cancel", jobId, job.status());
            return false;
        }
        boolean cancelled = StoreGuard.call("cancel dispatch job " + jobId,
            () -> jobRepository.cancel(jobId, clock.instant()));
        if (cancelled) {
            log.info("Cancelled dispatch job {} at {}/{}", jobId, job.cursor(), job.totalCount());
        }
        return cancelled;
    }

    @Override
    public DispatchJob getJob(UUID jobId) {
        return StoreGuard.call("load dispatch job " + jobId, () -> jobRepository.findById(jobId))
            .orElseThrow(() -> new DispatchJobNotFoundException(jobId));
    }

    @Override
    public List<DispatchJob> listJobs(DispatchStatus status, int limit) {
        if (limit < 1) {
            throw new InvalidOperationException("Limit must be positive: " + limit);
        }
        return StoreGuard.call("list dispatch jobs", () -> jobRepository.list(status, limit));
    }

    @Override
    public List<DispatchJob> findRunnable(int limit) {
        return StoreGuard.call("find runnable dispatch jobs", () -> jobRepository.findRunnable(limit));
    }

    private static List<String> deduplicate(List<String> recipientIds) {
        if (recipientIds == null) {
            throw new InvalidOperationException("Recipient list is required");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String id : recipientIds) {
            unique.add(RecipientRegistry.normalize(id));
        }
        return new ArrayList<>(unique);
    }
}
