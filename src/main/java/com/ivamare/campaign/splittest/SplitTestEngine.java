package com.ivamare.campaign.splittest;

import com.ivamare.campaign.dispatch.DispatchPayload;

import java.util.List;
import java.util.UUID;

/**
 * Runs two-variant sends: sample both, pick the better by engagement, send it to the rest.
 */
public interface SplitTestEngine {

    /**
     * Draw two disjoint samples from the eligible recipients and submit one job per variant.
     *
     * @param name test name
     * @param variantA first payload
     * @param variantB second payload
     * @param sampleFraction share of recipients in the two samples together, in (0, 1]
     * @param metric measure deciding the winner
     * @return the test, in SAMPLING
     */
    SplitTest createTest(String name, DispatchPayload variantA, DispatchPayload variantB,
                         double sampleFraction, EngagementMetric metric);

    /**
     * Same as {@link #createTest(String, DispatchPayload, DispatchPayload, double, EngagementMetric)}
     * restricted to recipients carrying a segment tag.
     */
    SplitTest createTest(String name, DispatchPayload variantA, DispatchPayload variantB,
                         double sampleFraction, EngagementMetric metric, String segment);

    /**
     * Choose the winner and submit exactly one remainder job. A sample that ended FAILED or
     * CANCELLED loses to one that COMPLETED whatever the scores.
     *
     * @throws com.ivamare.campaign.exception.NotReadyException if a sample job is still pending or running
     * @throws com.ivamare.campaign.exception.AlreadyDecidedException if a winner was already chosen
     */
    SplitTest decide(UUID testId);

    /**
     * Move a decided test to COMPLETED once its remainder job is terminal.
     *
     * @return true if the test was completed by this call
     */
    boolean reconcile(UUID testId);

    /**
     * Reconcile up to {@code limit} decided tests.
     *
     * @return number of tests completed
     */
    int reconcileDecided(int limit);

    SplitTest getTest(UUID testId);

    List<SplitTest> listTests(SplitTestOutcome outcome, int limit);
}
