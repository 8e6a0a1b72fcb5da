package com.ivamare.campaign.access;

import java.util.Set;

/**
 * Decides whether a caller may read a document of a given tier.
 *
 * <p>A caller may read tier {@code T} iff {@code T} is {@link Tier#PUBLIC} or the caller holds a
 * capability whose rank is at least {@code T}'s rank. Only {@link Capability#ADMINISTRATOR}
 * reaches {@link Tier#PRIVATE}; this is not configurable per document.
 *
 * <p>Pure and thread-safe. Never throws: a null or unknown capability set reads public only.
 */
public class AccessPolicy {

    /**
     * @param callerCapabilities capability names held by the caller (nullable)
     * @param documentTier tier of the document (nullable, treated as {@link Tier#PRIVATE})
     * @return true if the caller may read the document
     */
    public boolean canRead(Set<String> callerCapabilities, Tier documentTier) {
        Tier tier = documentTier != null ? documentTier : Tier.PRIVATE;
        if (tier == Tier.PUBLIC) {
            return true;
        }
        if (tier == Tier.PRIVATE) {
            return holds(callerCapabilities, Capability.ADMINISTRATOR);
        }
        return highestRank(callerCapabilities) >= tier.rank();
    }

    /**
     * @param callerCapabilities capability names held by the caller (nullable)
     * @return the most restrictive tier the caller can still read
     */
    public Tier highestReadableTier(Set<String> callerCapabilities) {
        Tier readable = Tier.PUBLIC;
        for (Tier tier : Tier.values()) {
            if (canRead(callerCapabilities, tier)) {
                readable = tier;
            }
        }
        return readable;
    }

    private static int highestRank(Set<String> callerCapabilities) {
        if (callerCapabilities == null) {
            return -1;
        }
        int rank = -1;
        for (String name : callerCapabilities) {
            rank = Math.max(rank, Capability.parse(name).map(Capability::rank).orElse(-1));
        }
        return rank;
    }

    private static boolean holds(Set<String> callerCapabilities, Capability capability) {
        if (callerCapabilities == null) {
            return false;
        }
        for (String name : callerCapabilities) {
            if (Capability.parse(name).filter(c -> c == capability).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
