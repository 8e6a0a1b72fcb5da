package com.ivamare.campaign.catalog.impl;

import com.ivamare.campaign.access.Tier;
import com.ivamare.campaign.catalog.Document;
import com.ivamare.campaign.catalog.DocumentPriority;
import com.ivamare.campaign.catalog.DocumentRepository;
import com.ivamare.campaign.catalog.DocumentSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of DocumentRepository.
 */
public class JdbcDocumentRepository implements DocumentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDocumentRepository.class);

    private static final String SUMMARY_COLUMNS =
        "document_id, slug, title, category, tier, featured, download_count, updated_at";

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Document> documentMapper = (rs, rowNum) -> new Document(
        UUID.fromString(rs.getString("document_id")),
        rs.getString("slug"),
        rs.getString("title"),
        rs.getString("body"),
        rs.getString("category"),
        Tier.fromValue(rs.getString("tier")),
        rs.getBoolean("featured"),
        DocumentPriority.valueOf(rs.getString("priority")),
        rs.getLong("version"),
        rs.getLong("download_count"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant()
    );

    private final RowMapper<DocumentSummary> summaryMapper = (rs, rowNum) -> new DocumentSummary(
        UUID.fromString(rs.getString("document_id")),
        rs.getString("slug"),
        rs.getString("title"),
        rs.getString("category"),
        Tier.fromValue(rs.getString("tier")),
        rs.getBoolean("featured"),
        rs.getLong("download_count"),
        rs.getTimestamp("updated_at").toInstant()
    );

    public JdbcDocumentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(Document document) {
        jdbcTemplate.update("""
            INSERT INTO campaign.document (
                document_id, slug, title, body, category, tier, tier_rank,
                featured, priority, version, download_count, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            document.documentId(),
            document.slug(),
            document.title(),
            document.body(),
            document.category(),
            document.tier().name(),
            document.tier().rank(),
            document.featured(),
            document.priority().name(),
            document.version(),
            document.downloadCount(),
            Timestamp.from(document.createdAt()),
            Timestamp.from(document.updatedAt())
        );
        log.debug("Saved document {} ({})", document.documentId(), document.slug());
    }

    @Override
    public Optional<Document> findById(UUID documentId) {
        List<Document> results = jdbcTemplate.query(
            "SELECT * FROM campaign.document WHERE document_id = ?",
            documentMapper,
            documentId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<Document> findBySlug(String slug) {
        List<Document> results = jdbcTemplate.query(
            "SELECT * FROM campaign.document WHERE slug = ?",
            documentMapper,
            slug
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean update(Document document, long expectedVersion) {
        int rows = jdbcTemplate.update("""
            UPDATE campaign.document SET
                title = ?, body = ?, category = ?, tier = ?, tier_rank = ?,
                featured = ?, priority = ?, version = ?, updated_at = ?
            WHERE document_id = ? AND version = ?
            """,
            document.title(),
            document.body(),
            document.category(),
            document.tier().name(),
            document.tier().rank(),
            document.featured(),
            document.priority().name(),
            document.version(),
            Timestamp.from(document.updatedAt()),
            document.documentId(),
            expectedVersion
        );
        return rows > 0;
    }

    @Override
    public boolean incrementDownloadCount(UUID documentId) {
        int rows = jdbcTemplate.update(
            "UPDATE campaign.document SET download_count = download_count + 1 WHERE document_id = ?",
            documentId
        );
        return rows > 0;
    }

    @Override
    public List<DocumentSummary> findFeatured(Tier maxTier, int limit) {
        return jdbcTemplate.query(
            "SELECT " + SUMMARY_COLUMNS + " FROM campaign.document "
                + "WHERE featured = TRUE AND tier_rank <= ? ORDER BY updated_at DESC, slug LIMIT ?",
            summaryMapper,
            maxTier.rank(), limit
        );
    }

    @Override
    public List<DocumentSummary> findMostDownloaded(Tier maxTier, int limit) {
        return jdbcTemplate.query(
            "SELECT " + SUMMARY_COLUMNS + " FROM campaign.document "
                + "WHERE tier_rank <= ? ORDER BY download_count DESC, slug LIMIT ?",
            summaryMapper,
            maxTier.rank(), limit
        );
    }

    @Override
    public Map<String, Long> countByCategory() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT category, COUNT(*) AS total FROM campaign.document "
                + "WHERE category IS NOT NULL GROUP BY category ORDER BY category",
            (RowCallbackHandler) rs -> {
                counts.put(rs.getString("category"), rs.getLong("total"));
            }
        );
        return counts;
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM campaign.document", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public long countFeatured() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM campaign.document WHERE featured = TRUE", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public long countByPriority(DocumentPriority priority) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM campaign.document WHERE priority = ?", Long.class, priority.name());
        return count != null ? count : 0L;
    }
}
