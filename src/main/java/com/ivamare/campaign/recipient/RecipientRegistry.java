package com.ivamare.campaign.recipient;

import com.ivamare.campaign.exception.InvalidOperationException;
import com.ivamare.campaign.exception.RecipientNotFoundException;
import com.ivamare.campaign.exception.StoreGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Sign-up, verification and opt-out of recipients.
 *
 * <p>{@link #markVerified} and {@link #optOut} are the entry points for the verification and
 * unsubscribe webhooks.
 */
public class RecipientRegistry {

    private static final Logger log = LoggerFactory.getLogger(RecipientRegistry.class);

    private final RecipientRepository recipientRepository;
    private final Clock clock;

    public RecipientRegistry(RecipientRepository recipientRepository, Clock clock) {
        this.recipientRepository = recipientRepository;
        this.clock = clock;
    }

    /**
     * Register an unverified recipient. Subscribing an address that is already known returns
     * the existing recipient unchanged, including its opt-out flag.
     */
    public Recipient subscribe(String address, Set<String> segments) {
        String normalized = normalize(address);
        Recipient candidate = Recipient.subscribe(normalized, segments, clock.instant());
        boolean inserted = StoreGuard.call("subscribe " + normalized,
            () -> recipientRepository.insertIfAbsent(candidate));
        if (inserted) {
            log.info("Subscribed recipient {} (segments={})", normalized, candidate.segments());
            return candidate;
        }
        return find(normalized).orElseThrow(() -> new RecipientNotFoundException(normalized));
    }

    public Optional<Recipient> find(String address) {
        String normalized = normalize(address);
        return StoreGuard.call("load recipient " + normalized, () -> recipientRepository.find(normalized));
    }

    public void markVerified(String address) {
        String normalized = normalize(address);
        if (!StoreGuard.call("verify " + normalized, () -> recipientRepository.markVerified(normalized))) {
            throw new RecipientNotFoundException(normalized);
        }
        log.info("Verified recipient {}", normalized);
    }

    public void optOut(String address) {
        String normalized = normalize(address);
        if (!StoreGuard.call("opt out " + normalized, () -> recipientRepository.markOptedOut(normalized))) {
            throw new RecipientNotFoundException(normalized);
        }
        log.info("Recipient {} opted out", normalized);
    }

    /**
     * @param segment segment tag, or null for every eligible recipient
     */
    public List<String> eligibleRecipients(String segment) {
        return StoreGuard.call("list eligible recipients", () -> recipientRepository.findEligibleAddresses(segment));
    }

    /**
     * Canonical form of an address as stored: trimmed and lower-cased.
     *
     * @throws InvalidOperationException if the address is blank or has no local part
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank() || address.indexOf('@') < 1) {
            throw new InvalidOperationException("Invalid recipient address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
