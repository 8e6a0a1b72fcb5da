package com.ivamare.campaign.splittest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for split tests.
 */
public interface SplitTestRepository {

    void save(SplitTest test);

    Optional<SplitTest> findById(UUID testId);

    /**
     * Record the decision if the test is still sampling.
     *
     * @return false if another caller decided first
     */
    boolean markDecided(UUID testId, Variant winner, double scoreA, double scoreB, UUID remainderJobId,
                        Instant now);

    /**
     * Move a decided test to COMPLETED.
     *
     * @return false if the test is not DECIDED
     */
    boolean markCompleted(UUID testId, Instant now);

    /**
     * Tests in the given outcome, oldest first.
     */
    List<SplitTest> findByOutcome(SplitTestOutcome outcome, int limit);
}
