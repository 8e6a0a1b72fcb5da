package com.ivamare.campaign.exception;

import java.util.UUID;

/**
 * Thrown when a split test cannot be found.
 */
public class SplitTestNotFoundException extends CampaignException {

    private final UUID testId;

    public SplitTestNotFoundException(UUID testId) {
        super("Split test " + testId + " not found");
        this.testId = testId;
    }

    public UUID getTestId() {
        return testId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
