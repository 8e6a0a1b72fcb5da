package com.ivamare.campaign.exception;

/**
 * Thrown when an invalid argument, state transition or operation is attempted.
 */
public class InvalidOperationException extends CampaignException {

    public InvalidOperationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_OPERATION;
    }
}
