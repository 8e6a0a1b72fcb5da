package com.ivamare.campaign.recipient;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for recipients.
 *
 * <p>Opt-out is terminal: no operation clears the opted-out flag.
 */
public interface RecipientRepository {

    /**
     * Insert a recipient unless the address is already registered.
     *
     * @return true if inserted
     */
    boolean insertIfAbsent(Recipient recipient);

    Optional<Recipient> find(String address);

    /**
     * @return false if the address is unknown
     */
    boolean markVerified(String address);

    /**
     * @return false if the address is unknown
     */
    boolean markOptedOut(String address);

    /**
     * Filter addresses down to those currently eligible for dispatch.
     *
     * @param addresses candidate addresses
     * @return the eligible subset
     */
    Set<String> findEligible(Collection<String> addresses);

    /**
     * All eligible addresses, optionally restricted to a segment, oldest subscription first.
     *
     * @param segment segment tag, or null for everyone
     */
    List<String> findEligibleAddresses(String segment);
}
