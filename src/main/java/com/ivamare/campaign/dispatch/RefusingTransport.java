package com.ivamare.campaign.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback transport used when the application supplies none. Every send is logged and
 * declined, so jobs progress but nothing counts as delivered.
 */
public class RefusingTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(RefusingTransport.class);

    @Override
    public boolean send(String address, DispatchPayload payload) {
        log.warn("No transport configured, declining '{}' for {}", payload.subject(), address);
        return false;
    }
}
