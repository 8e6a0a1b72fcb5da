package com.ivamare.campaign.recipient.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.recipient.Recipient;
import com.ivamare.campaign.recipient.RecipientRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of RecipientRepository. Segments are stored as a JSONB array.
 */
public class JdbcRecipientRepository implements RecipientRepository {

    private static final TypeReference<Set<String>> SEGMENTS_TYPE = new TypeReference<>() {};
    private static final int IN_CLAUSE_LIMIT = 1000;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Recipient> recipientMapper;

    public JdbcRecipientRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.recipientMapper = (rs, rowNum) -> new Recipient(
            rs.getString("address"),
            rs.getBoolean("verified"),
            rs.getBoolean("opted_out"),
            readSegments(rs.getString("segments")),
            rs.getTimestamp("subscribed_at").toInstant()
        );
    }

    @Override
    public boolean insertIfAbsent(Recipient recipient) {
        int rows = jdbcTemplate.update("""
            INSERT INTO campaign.recipient (address, verified, opted_out, segments, subscribed_at)
            VALUES (?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (address) DO NOTHING
            """,
            recipient.address(),
            recipient.verified(),
            recipient.optedOut(),
            writeSegments(recipient.segments()),
            Timestamp.from(recipient.subscribedAt())
        );
        return rows > 0;
    }

    @Override
    public Optional<Recipient> find(String address) {
        List<Recipient> results = jdbcTemplate.query(
            "SELECT * FROM campaign.recipient WHERE address = ?",
            recipientMapper,
            address
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean markVerified(String address) {
        return jdbcTemplate.update(
            "UPDATE campaign.recipient SET verified = TRUE WHERE address = ?", address) > 0;
    }

    @Override
    public boolean markOptedOut(String address) {
        return jdbcTemplate.update(
            "UPDATE campaign.recipient SET opted_out = TRUE, opted_out_at = COALESCE(opted_out_at, now()) "
                + "WHERE address = ?", address) > 0;
    }

    @Override
    public Set<String> findEligible(Collection<String> addresses) {
        if (addresses.isEmpty()) {
            return Set.of();
        }
        List<String> all = List.copyOf(addresses);
        Set<String> eligible = new HashSet<>();
        for (int i = 0; i < all.size(); i += IN_CLAUSE_LIMIT) {
            List<String> slice = all.subList(i, Math.min(i + IN_CLAUSE_LIMIT, all.size()));
            String placeholders = String.join(", ", Collections.nCopies(slice.size(), "?"));
            eligible.addAll(jdbcTemplate.queryForList(
                "SELECT address FROM campaign.recipient "
                    + "WHERE verified = TRUE AND opted_out = FALSE AND address IN (" + placeholders + ")",
                String.class,
                slice.toArray()
            ));
        }
        return eligible;
    }

    @Override
    public List<String> findEligibleAddresses(String segment) {
        if (segment == null) {
            return jdbcTemplate.queryForList(
                "SELECT address FROM campaign.recipient WHERE verified = TRUE AND opted_out = FALSE "
                    + "ORDER BY subscribed_at, address",
                String.class
            );
        }
        return jdbcTemplate.queryForList(
            "SELECT address FROM campaign.recipient WHERE verified = TRUE AND opted_out = FALSE "
                + "AND segments @> jsonb_build_array(?::text) ORDER BY subscribed_at, address",
            String.class,
            segment
        );
    }

    private Set<String> readSegments(String json) {
        if (json == null) {
            return Set.of();
        }
        try {
            return objectMapper.readValue(json, SEGMENTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable segments column: " + e.getOriginalMessage(), e);
        }
    }

    private String writeSegments(Set<String> segments) {
        try {
            return objectMapper.writeValueAsString(segments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize segments", e);
        }
    }
}
