package com.ivamare.campaign.catalog;

import java.util.Map;

/**
 * Catalog-wide statistics.
 *
 * @param totalDocuments Number of documents of any tier
 * @param documentsByCategory Count per category (uncategorized documents are omitted)
 * @param featuredDocuments Number of featured documents
 * @param campaignPriorityDocuments Number of documents with {@link DocumentPriority#CAMPAIGN}
 */
public record CatalogStats(
    long totalDocuments,
    Map<String, Long> documentsByCategory,
    long featuredDocuments,
    long campaignPriorityDocuments
) {
}
