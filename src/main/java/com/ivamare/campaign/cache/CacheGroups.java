package com.ivamare.campaign.cache;

/**
 * Invalidation group names and key builders shared by the components that cache.
 */
public final class CacheGroups {

    /** Every read that aggregates documents (featured lists, counts, stats, per-id reads). */
    public static final String CATALOG = "catalog";

    private CacheGroups() {
    }

    public static String documentKey(Object documentId) {
        return "document:" + documentId;
    }
}
