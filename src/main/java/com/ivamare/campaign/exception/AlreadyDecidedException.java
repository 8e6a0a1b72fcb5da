package com.ivamare.campaign.exception;

import java.util.UUID;

/**
 * Thrown when a split test is decided a second time.
 */
public class AlreadyDecidedException extends CampaignException {

    private final UUID testId;

    public AlreadyDecidedException(UUID testId) {
        super("Split test " + testId + " has already been decided");
        this.testId = testId;
    }

    public UUID getTestId() {
        return testId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ALREADY_DECIDED;
    }
}
