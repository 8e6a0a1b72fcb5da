package com.ivamare.campaign.exception;

/**
 * Base exception for all campaign engine errors.
 */
public abstract class CampaignException extends RuntimeException {

    protected CampaignException(String message) {
        super(message);
    }

    protected CampaignException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the error category callers switch on
     */
    public abstract ErrorKind kind();
}
