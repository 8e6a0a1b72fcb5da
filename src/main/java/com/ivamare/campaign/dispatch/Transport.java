package com.ivamare.campaign.dispatch;

import com.ivamare.campaign.exception.TransportException;

/**
 * Delivers a payload to a single recipient. Supplied by the mail/notification subsystem.
 *
 * <p>Implementations should tolerate the same recipient being sent the same payload twice:
 * a chunk interrupted before its cursor update is re-sent on the next advance.
 */
@FunctionalInterface
public interface Transport {

    /**
     * @param address recipient address
     * @param payload message to deliver
     * @return true if delivered, false if the transport declined it
     * @throws TransportException if delivery to this recipient failed
     */
    boolean send(String address, DispatchPayload payload) throws TransportException;
}
