package com.ivamare.campaign.catalog;

import com.ivamare.campaign.access.Tier;

/**
 * Authoring input for a new document.
 *
 * @param slug URL-safe unique name (required)
 * @param title Display title (required)
 * @param body Content
 * @param category Category name (nullable)
 * @param tier Access tier (defaults to PUBLIC)
 * @param featured Whether the document is featured
 * @param priority Editorial priority (defaults to STANDARD)
 */
public record NewDocument(
    String slug,
    String title,
    String body,
    String category,
    Tier tier,
    boolean featured,
    DocumentPriority priority
) {
}
