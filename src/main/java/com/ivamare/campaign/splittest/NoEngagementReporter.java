package com.ivamare.campaign.splittest;

import java.util.UUID;

/**
 * Fallback reporter used when the application supplies none. Reports zero for everything,
 * so every decision is a tie and goes to variant A.
 */
public class NoEngagementReporter implements EngagementReporter {

    @Override
    public double metricValue(UUID testId, Variant variant, EngagementMetric metric) {
        return 0.0;
    }
}
