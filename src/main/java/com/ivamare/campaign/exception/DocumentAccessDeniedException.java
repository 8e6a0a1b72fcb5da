package com.ivamare.campaign.exception;

/**
 * Thrown when the caller's capabilities do not allow reading a document.
 *
 * <p>The message is intentionally identical for every document and never names the tier.
 */
public class DocumentAccessDeniedException extends CampaignException {

    public DocumentAccessDeniedException() {
        super("Access denied");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FORBIDDEN;
    }
}
