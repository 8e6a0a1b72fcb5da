package com.ivamare.campaign.catalog;

import com.ivamare.campaign.access.Tier;

import java.time.Instant;
import java.util.UUID;

/**
 * A policy document or glossary entry.
 *
 * @param documentId Unique identifier
 * @param slug URL-safe unique name
 * @param title Display title
 * @param body Document content
 * @param category Category name (nullable)
 * @param tier Access tier
 * @param featured Whether the document is listed in featured sets
 * @param priority Editorial priority
 * @param version Incremented on every update
 * @param downloadCount Number of recorded retrievals, maintained by the download tracker only
 * @param createdAt Creation timestamp
 * @param updatedAt Last update timestamp
 */
public record Document(
    UUID documentId,
    String slug,
    String title,
    String body,
    String category,
    Tier tier,
    boolean featured,
    DocumentPriority priority,
    long version,
    long downloadCount,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * Creates a new version-1 document from authoring input.
     */
    public static Document create(NewDocument input, Instant now) {
        return new Document(
            UUID.randomUUID(),
            input.slug(),
            input.title(),
            input.body(),
            input.category(),
            input.tier() != null ? input.tier() : Tier.PUBLIC,
            input.featured(),
            input.priority() != null ? input.priority() : DocumentPriority.STANDARD,
            1, 0,
            now, now
        );
    }

    /**
     * Applies a partial update and bumps the version.
     */
    public Document apply(DocumentUpdate update, Instant now) {
        return new Document(
            documentId,
            slug,
            update.title() != null ? update.title() : title,
            update.body() != null ? update.body() : body,
            update.category() != null ? update.category() : category,
            update.tier() != null ? update.tier() : tier,
            update.featured() != null ? update.featured() : featured,
            update.priority() != null ? update.priority() : priority,
            version + 1,
            downloadCount,
            createdAt,
            now
        );
    }

    public DocumentSummary toSummary() {
        return new DocumentSummary(documentId, slug, title, category, tier, featured, downloadCount, updatedAt);
    }
}
