package com.ivamare.campaign.catalog;

import com.ivamare.campaign.access.Tier;

import java.time.Instant;
import java.util.UUID;

/**
 * Body-less view of a document used by aggregate reads.
 */
public record DocumentSummary(
    UUID documentId,
    String slug,
    String title,
    String category,
    Tier tier,
    boolean featured,
    long downloadCount,
    Instant updatedAt
) {
}
