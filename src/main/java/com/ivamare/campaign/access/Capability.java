package com.ivamare.campaign.access;

import java.util.Locale;
import java.util.Optional;

/**
 * Capabilities a caller can hold, each with the rank of the highest tier it unlocks.
 */
public enum Capability {
    SUBSCRIBER("subscriber", 0),
    VOLUNTEER("volunteer", 1),
    EDITOR("editor", 1),
    ADMINISTRATOR("administrator", 2);

    private final String value;
    private final int rank;

    Capability(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String getValue() {
        return value;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parse a capability name as supplied by the caller's session.
     *
     * @param value capability name, case-insensitive
     * @return the capability, or empty for unknown names
     */
    public static Optional<Capability> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Capability capability : values()) {
            if (capability.value.equals(normalized)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
}
