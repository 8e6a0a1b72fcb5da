package com.ivamare.campaign.splittest;

import java.util.UUID;

/**
 * Source of engagement figures for the samples of a split test, typically backed by open and
 * click tracking.
 */
@FunctionalInterface
public interface EngagementReporter {

    /**
     * @param testId the split test whose samples have been sent
     * @param variant the variant whose sample is measured
     * @param metric the measure to report
     * @return the aggregate metric value for that variant's sample; higher is better
     */
    double metricValue(UUID testId, Variant variant, EngagementMetric metric);
}
