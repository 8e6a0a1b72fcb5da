package com.ivamare.campaign.access;

/**
 * Access tier of a document. Tiers are totally ordered: {@code PUBLIC < RESTRICTED < PRIVATE}.
 */
public enum Tier {
    /** Readable by anyone */
    PUBLIC(0),

    /** Readable by volunteers and editors */
    RESTRICTED(1),

    /** Readable by administrators only */
    PRIVATE(2);

    private final int rank;

    Tier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * @return true if {@code other} admits fewer readers than this tier
     */
    public boolean isNarrowedBy(Tier other) {
        return other.rank > this.rank;
    }

    public static Tier fromValue(String value) {
        for (Tier tier : values()) {
            if (tier.name().equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown Tier: " + value);
    }
}
