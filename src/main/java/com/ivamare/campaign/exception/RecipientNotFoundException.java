package com.ivamare.campaign.exception;

/**
 * Thrown when a recipient address is not registered.
 */
public class RecipientNotFoundException extends CampaignException {

    private final String address;

    public RecipientNotFoundException(String address) {
        super("Recipient " + address + " not found");
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
