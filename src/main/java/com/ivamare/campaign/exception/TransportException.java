package com.ivamare.campaign.exception;

/**
 * Thrown by a transport when a single recipient could not be delivered to.
 *
 * <p>Checked, because every caller of a transport has to decide what a per-recipient
 * failure means. The dispatcher records it and carries on with the chunk.
 */
public class TransportException extends Exception {

    private final String address;

    public TransportException(String address, String message) {
        super(message);
        this.address = address;
    }

    public TransportException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    public ErrorKind kind() {
        return ErrorKind.TRANSPORT_FAILURE;
    }
}
