package com.ivamare.campaign.support;

import com.ivamare.campaign.dispatch.DispatchJob;
import com.ivamare.campaign.dispatch.DispatchJobRepository;
import com.ivamare.campaign.dispatch.DispatchStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DispatchJobRepository over a map, mirroring the conditional updates of the JDBC one.
 */
public class InMemoryDispatchJobRepository implements DispatchJobRepository {

    private final ConcurrentHashMap<UUID, DispatchJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(DispatchJob job) {
        jobs.put(job.jobId(), job);
    }

    @Override
    public Optional<DispatchJob> findById(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized boolean advance(UUID jobId, int expectedCursor, int newCursor, int sentDelta,
                                        int failedDelta, int skippedDelta, DispatchStatus newStatus, Instant now) {
        DispatchJob job = jobs.get(jobId);
        if (job == null || job.cursor() != expectedCursor) {
            return false;
        }
        DispatchStatus status = job.status() == DispatchStatus.CANCELLED ? job.status() : newStatus;
        Instant completedAt = job.completedAt() != null ? job.completedAt()
            : (newStatus.isTerminal() ? now : null);
        jobs.put(jobId, new DispatchJob(
            job.jobId(), job.label(), job.payload(), job.recipientIds(), job.chunkSize(),
            newCursor,
            job.sentCount() + sentDelta,
            job.failedCount() + failedDelta,
            job.skippedCount() + skippedDelta,
            status, job.createdAt(), now, now, completedAt
        ));
        return true;
    }

    @Override
    public synchronized boolean cancel(UUID jobId, Instant now) {
        DispatchJob job = jobs.get(jobId);
        if (job == null || job.isTerminal()) {
            return false;
        }
        jobs.put(jobId, new DispatchJob(
            job.jobId(), job.label(), job.payload(), job.recipientIds(), job.chunkSize(), job.cursor(),
            job.sentCount(), job.failedCount(), job.skippedCount(),
            DispatchStatus.CANCELLED, job.createdAt(), now, job.lastAdvancedAt(), now
        ));
        return true;
    }

    @Override
    public List<DispatchJob> findRunnable(int limit) {
        return jobs.values().stream()
            .filter(job -> !job.isTerminal())
            .sorted(Comparator.comparing(DispatchJob::createdAt).thenComparing(DispatchJob::jobId))
            .limit(limit)
            .toList();
    }

    @Override
    public List<DispatchJob> list(DispatchStatus status, int limit) {
        return jobs.values().stream()
            .filter(job -> status == null || job.status() == status)
            .sorted(Comparator.comparing(DispatchJob::createdAt).reversed())
            .limit(limit)
            .toList();
    }

    @Override
    public int countByStatus(DispatchStatus status) {
        return (int) jobs.values().stream().filter(job -> job.status() == status).count();
    }

    public int size() {
        return jobs.size();
    }
}
