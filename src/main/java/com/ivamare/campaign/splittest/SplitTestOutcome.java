package com.ivamare.campaign.splittest;

/**
 * Lifecycle of a split test.
 */
public enum SplitTestOutcome {
    /** Created, samples not yet submitted */
    PENDING,

    /** Both sample jobs submitted, waiting for them to finish */
    SAMPLING,

    /** Winner chosen and remainder job submitted */
    DECIDED,

    /** Remainder job finished */
    COMPLETED;

    public boolean isDecided() {
        return this == DECIDED || this == COMPLETED;
    }

    public static SplitTestOutcome fromValue(String value) {
        for (SplitTestOutcome outcome : values()) {
            if (outcome.name().equals(value)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown SplitTestOutcome: " + value);
    }
}
