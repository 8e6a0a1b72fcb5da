package com.ivamare.campaign.catalog;

import com.ivamare.campaign.access.Tier;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for documents.
 */
public interface DocumentRepository {

    /**
     * Insert a new document.
     *
     * @param document The document to save
     */
    void save(Document document);

    Optional<Document> findById(UUID documentId);

    Optional<Document> findBySlug(String slug);

    /**
     * Replace a document's editable fields if it is still at {@code expectedVersion}.
     * The download counter is never written by this method.
     *
     * @param document The updated document
     * @param expectedVersion Version the update was based on
     * @return true if the row was updated, false if it changed concurrently or is gone
     */
    boolean update(Document document, long expectedVersion);

    /**
     * Atomically add one to a document's download counter.
     *
     * @param documentId The document
     * @return false if no such document exists
     */
    boolean incrementDownloadCount(UUID documentId);

    /**
     * Featured documents readable at {@code maxTier}, most recently updated first.
     */
    List<DocumentSummary> findFeatured(Tier maxTier, int limit);

    /**
     * Documents readable at {@code maxTier}, highest download count first.
     */
    List<DocumentSummary> findMostDownloaded(Tier maxTier, int limit);

    /**
     * @return number of documents per category, uncategorized documents omitted
     */
    Map<String, Long> countByCategory();

    long countAll();

    long countFeatured();

    long countByPriority(DocumentPriority priority);
}
