package com.ivamare.campaign.catalog.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ivamare.campaign.access.AccessPolicy;
import com.ivamare.campaign.access.Tier;
import com.ivamare.campaign.cache.CacheGroups;
import com.ivamare.campaign.cache.CacheStore;
import com.ivamare.campaign.catalog.CatalogStats;
import com.ivamare.campaign.catalog.Document;
import com.ivamare.campaign.catalog.DocumentCatalog;
import com.ivamare.campaign.catalog.DocumentPriority;
import com.ivamare.campaign.catalog.DocumentRepository;
import com.ivamare.campaign.catalog.DocumentSummary;
import com.ivamare.campaign.catalog.DocumentUpdate;
import com.ivamare.campaign.catalog.NewDocument;
import com.ivamare.campaign.download.DownloadTracker;
import com.ivamare.campaign.exception.CampaignException;
import com.ivamare.campaign.exception.DocumentAccessDeniedException;
import com.ivamare.campaign.exception.DocumentNotFoundException;
import com.ivamare.campaign.exception.InvalidOperationException;
import com.ivamare.campaign.exception.StoreGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Default implementation of DocumentCatalog.
 */
public class DefaultDocumentCatalog implements DocumentCatalog {

    private static final Logger log = LoggerFactory.getLogger(DefaultDocumentCatalog.class);

    static final int MAX_LIST_LIMIT = 100;

    private static final Set<String> CATALOG_GROUP = Set.of(CacheGroups.CATALOG);
    private static final TypeReference<List<DocumentSummary>> SUMMARY_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Long>> COUNT_MAP = new TypeReference<>() {};

    private final DocumentRepository documentRepository;
    private final AccessPolicy accessPolicy;
    private final CacheStore cacheStore;
    private final DownloadTracker downloadTracker;
    private final Clock clock;
    private final Duration documentTtl;
    private final Duration aggregateTtl;

    public DefaultDocumentCatalog(
            DocumentRepository documentRepository,
            AccessPolicy accessPolicy,
            CacheStore cacheStore,
            DownloadTracker downloadTracker,
            Clock clock,
            Duration documentTtl,
            Duration aggregateTtl) {
        this.documentRepository = documentRepository;
        this.accessPolicy = accessPolicy;
        this.cacheStore = cacheStore;
        this.downloadTracker = downloadTracker;
        this.clock = clock;
        this.documentTtl = documentTtl;
        this.aggregateTtl = aggregateTtl;
    }

    // --- Reads ---

    @Override
    public Document getDocument(UUID documentId, Set<String> callerCapabilities) {
        Document document = cacheStore.getOrCompute(
            CacheGroups.documentKey(documentId),
            Document.class,
            documentTtl,
            CATALOG_GROUP,
            () -> StoreGuard.call("load document " + documentId,
                () -> documentRepository.findById(documentId).orElse(null))
        );
        if (document == null) {
            throw new DocumentNotFoundException(documentId);
        }
        return checkReadable(document, callerCapabilities);
    }

    @Override
    public Document findBySlug(String slug, Set<String> callerCapabilities) {
        Document document = StoreGuard.call("load document " + slug,
            () -> documentRepository.findBySlug(slug))
            .orElseThrow(() -> new DocumentNotFoundException(slug));
        return checkReadable(document, callerCapabilities);
    }

    @Override
    public List<DocumentSummary> listFeatured(int limit) {
        return listFeatured(limit, Set.of());
    }

    @Override
    public List<DocumentSummary> listFeatured(int limit, Set<String> callerCapabilities) {
        checkLimit(limit);
        Tier maxTier = accessPolicy.highestReadableTier(callerCapabilities);
        return cacheStore.getOrCompute(
            "featured:" + maxTier.name().toLowerCase(Locale.ROOT) + ":" + limit,
            SUMMARY_LIST,
            aggregateTtl,
            CATALOG_GROUP,
            () -> StoreGuard.call("list featured documents",
                () -> documentRepository.findFeatured(maxTier, limit))
        );
    }

    @Override
    public List<DocumentSummary> mostDownloaded(int limit, Set<String> callerCapabilities) {
        checkLimit(limit);
        Tier maxTier = accessPolicy.highestReadableTier(callerCapabilities);
        return cacheStore.getOrCompute(
            "most-downloaded:" + maxTier.name().toLowerCase(Locale.ROOT) + ":" + limit,
            SUMMARY_LIST,
            aggregateTtl,
            CATALOG_GROUP,
            () -> StoreGuard.call("list most downloaded documents",
                () -> documentRepository.findMostDownloaded(maxTier, limit))
        );
    }

    @Override
    public Map<String, Long> categoryCounts() {
        return cacheStore.getOrCompute(
            "category-counts",
            COUNT_MAP,
            aggregateTtl,
            CATALOG_GROUP,
            () -> StoreGuard.call("count documents by category", documentRepository::countByCategory)
        );
    }

    @Override
    public CatalogStats catalogStats() {
        return cacheStore.getOrCompute(
            "catalog-stats",
            CatalogStats.class,
            aggregateTtl,
            CATALOG_GROUP,
            () -> StoreGuard.call("compute catalog statistics", () -> new CatalogStats(
                documentRepository.countAll(),
                documentRepository.countByCategory(),
                documentRepository.countFeatured(),
                documentRepository.countByPriority(DocumentPriority.CAMPAIGN)
            ))
        );
    }

    @Override
    public Document retrieveForDownload(UUID documentId, Set<String> callerCapabilities) {
        Document document = getDocument(documentId, callerCapabilities);
        try {
            downloadTracker.recordDownload(documentId);
        } catch (CampaignException e) {
            log.error("Failed to record download of document {} ({}): {}",
                documentId, e.kind(), e.getMessage(), e);
        }
        return document;
    }

    // --- Writes ---

    @Override
    public Document createDocument(NewDocument input) {
        if (input.slug() == null || input.slug().isBlank() || input.title() == null || input.title().isBlank()) {
            throw new InvalidOperationException("Document slug and title are required");
        }
        Document document = Document.create(input, clock.instant());
        StoreGuard.run("create document " + input.slug(), () -> documentRepository.save(document));
        invalidateCatalog();
        log.info("Created document {} ({}, tier={})", document.documentId(), document.slug(), document.tier());
        return document;
    }

    @Override
    public Document updateDocument(UUID documentId, DocumentUpdate update) {
        Document current = loadForWrite(documentId);
        if (update.isEmpty()) {
            return current;
        }
        Document updated = current.apply(update, clock.instant());
        boolean written = StoreGuard.call("update document " + documentId,
            () -> documentRepository.update(updated, current.version()));
        if (!written) {
            throw new InvalidOperationException(
                "Document " + documentId + " was modified concurrently (expected version " + current.version() + ")");
        }

        invalidateCatalog();
        if (current.tier().isNarrowedBy(updated.tier())) {
            StoreGuard.run("evict document " + documentId,
                () -> cacheStore.evict(CacheGroups.documentKey(documentId)));
            log.info("Narrowed tier of document {} from {} to {}", documentId, current.tier(), updated.tier());
        }
        log.debug("Updated document {} to version {}", documentId, updated.version());
        return updated;
    }

    @Override
    public Document changeTier(UUID documentId, Tier tier) {
        Document current = loadForWrite(documentId);
        if (current.tier() == tier) {
            log.debug("Document {} already has tier {}", documentId, tier);
            return current;
        }
        return updateDocument(documentId, DocumentUpdate.empty().withTier(tier));
    }

    // --- Internals ---

    private Document checkReadable(Document document, Set<String> callerCapabilities) {
        if (!accessPolicy.canRead(callerCapabilities, document.tier())) {
            throw new DocumentAccessDeniedException();
        }
        return document;
    }

    private Document loadForWrite(UUID documentId) {
        return StoreGuard.call("load document " + documentId, () -> documentRepository.findById(documentId))
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    private void invalidateCatalog() {
        StoreGuard.run("invalidate catalog cache", () -> cacheStore.invalidateGroup(CacheGroups.CATALOG));
    }

    private static void checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new InvalidOperationException("Limit must be between 1 and " + MAX_LIST_LIMIT + ": " + limit);
        }
    }
}
