package com.ivamare.campaign.recipient;

import java.time.Instant;
import java.util.Set;

/**
 * A subscriber who can receive dispatches.
 *
 * <p>Eligible for dispatch while {@code verified && !optedOut}. Opt-out is one-way.
 *
 * @param address Normalized address, the recipient's identity
 * @param verified Whether the address was confirmed out of band
 * @param optedOut Whether the recipient unsubscribed (terminal)
 * @param segments Segment tags such as "volunteer"
 * @param subscribedAt When the recipient signed up
 */
public record Recipient(
    String address,
    boolean verified,
    boolean optedOut,
    Set<String> segments,
    Instant subscribedAt
) {
    public Recipient {
        segments = segments != null ? Set.copyOf(segments) : Set.of();
    }

    public static Recipient subscribe(String address, Set<String> segments, Instant now) {
        return new Recipient(address, false, false, segments, now);
    }

    public boolean isEligible() {
        return verified && !optedOut;
    }
}
