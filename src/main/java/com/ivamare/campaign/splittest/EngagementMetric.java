package com.ivamare.campaign.splittest;

/**
 * Engagement measure used to pick a split test winner.
 */
public enum EngagementMetric {
    OPEN_RATE,
    CLICK_RATE;

    public static EngagementMetric fromValue(String value) {
        for (EngagementMetric metric : values()) {
            if (metric.name().equals(value)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown EngagementMetric: " + value);
    }
}
