package com.ivamare.campaign.exception;

/**
 * Thrown when a state machine operation is called before its precondition holds,
 * e.g. deciding a split test whose sample jobs are still running.
 */
public class NotReadyException extends CampaignException {

    public NotReadyException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_READY;
    }
}
