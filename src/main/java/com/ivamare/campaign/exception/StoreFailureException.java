package com.ivamare.campaign.exception;

/**
 * Thrown when the durable store could not confirm a write (or a read that guards a write).
 *
 * <p>Always surfaced to the caller. Whether a retry is worthwhile is reported by
 * {@link #isTransient()}, as classified by {@link DatabaseExceptionClassifier}.
 */
public class StoreFailureException extends CampaignException {

    private final boolean transientFailure;

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
        this.transientFailure = DatabaseExceptionClassifier.isTransient(cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORE_FAILURE;
    }
}
