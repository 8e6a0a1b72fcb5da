package com.ivamare.campaign.download;

import com.ivamare.campaign.cache.CacheGroups;
import com.ivamare.campaign.cache.CacheStore;
import com.ivamare.campaign.catalog.DocumentRepository;
import com.ivamare.campaign.exception.DocumentNotFoundException;
import com.ivamare.campaign.exception.StoreGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Records document retrievals.
 *
 * <p>The counter is incremented by a single arithmetic UPDATE in the store, never by
 * read-modify-write here, so concurrent downloads of the same document are not lost.
 * Every successful increment invalidates the {@link CacheGroups#CATALOG} group because
 * "most downloaded" aggregates depend on the counters.
 */
public class DownloadTracker {

    private static final Logger log = LoggerFactory.getLogger(DownloadTracker.class);

    private final DocumentRepository documentRepository;
    private final CacheStore cacheStore;

    public DownloadTracker(DocumentRepository documentRepository, CacheStore cacheStore) {
        this.documentRepository = documentRepository;
        this.cacheStore = cacheStore;
    }

    /**
     * @param documentId document that was retrieved
     * @throws DocumentNotFoundException if no such document exists
     * @throws com.ivamare.campaign.exception.StoreFailureException if the increment or the
     *         invalidation could not be written
     */
    public void recordDownload(UUID documentId) {
        boolean updated = StoreGuard.call("record download of document " + documentId,
            () -> documentRepository.incrementDownloadCount(documentId));
        if (!updated) {
            throw new DocumentNotFoundException(documentId);
        }
        StoreGuard.run("invalidate catalog after download of " + documentId,
            () -> cacheStore.invalidateGroup(CacheGroups.CATALOG));
        log.debug("Recorded download of document {}", documentId);
    }
}
