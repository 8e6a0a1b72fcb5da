package com.ivamare.campaign.dispatch;

/**
 * Status of a dispatch job in its lifecycle.
 */
public enum DispatchStatus {
    /** Job created, no chunk sent yet */
    PENDING,

    /** At least one chunk sent, cursor not yet at the end */
    RUNNING,

    /** Cursor reached the end of the recipient list */
    COMPLETED,

    /** Cursor reached the end and every transport call failed */
    FAILED,

    /** Cancelled by an operator; honored at the next advance boundary */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static DispatchStatus fromValue(String value) {
        for (DispatchStatus status : values()) {
            if (status.name().equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown DispatchStatus: " + value);
    }
}
