package com.ivamare.campaign.catalog;

import com.ivamare.campaign.access.Tier;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Read and write operations on the document catalog.
 *
 * <p>Reads are gated by the access policy; aggregate reads are cached in the
 * {@code catalog} invalidation group and every write invalidates that group before returning.
 */
public interface DocumentCatalog {

    // --- Reads ---

    /**
     * @param documentId The document
     * @param callerCapabilities Capabilities of the caller
     * @return the document
     * @throws com.ivamare.campaign.exception.DocumentNotFoundException if absent
     * @throws com.ivamare.campaign.exception.DocumentAccessDeniedException if the caller may not read it
     */
    Document getDocument(UUID documentId, Set<String> callerCapabilities);

    /**
     * Same as {@link #getDocument} but looked up by slug.
     */
    Document findBySlug(String slug, Set<String> callerCapabilities);

    /**
     * Featured documents visible to anonymous readers.
     *
     * @param limit Maximum number of documents (at least 1)
     */
    List<DocumentSummary> listFeatured(int limit);

    /**
     * Featured documents visible to the given caller.
     */
    List<DocumentSummary> listFeatured(int limit, Set<String> callerCapabilities);

    /**
     * Documents visible to the given caller, highest download count first.
     */
    List<DocumentSummary> mostDownloaded(int limit, Set<String> callerCapabilities);

    /**
     * @return document count per category
     */
    Map<String, Long> categoryCounts();

    CatalogStats catalogStats();

    /**
     * Access-gated read that also records the download. A failure to record is logged and
     * does not prevent the document from being returned.
     */
    Document retrieveForDownload(UUID documentId, Set<String> callerCapabilities);

    // --- Writes ---

    Document createDocument(NewDocument input);

    /**
     * Apply a partial update. If the update narrows the tier, the document's own cache entry
     * is evicted before this method returns.
     */
    Document updateDocument(UUID documentId, DocumentUpdate update);

    /**
     * Change a document's tier. Setting the current tier again is a no-op.
     */
    Document changeTier(UUID documentId, Tier tier);
}
