package com.federation.adapter.out.persistence;

import com.federation.application.port.out.FollowEdgeRepository;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.SiteAddress;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
public class JdbcFollowEdgeRepository implements FollowEdgeRepository {

    // Addresses cannot contain a comma, so the chain is stored as a joined list
    private static final String CHAIN_SEPARATOR = ",";

    private static final RowMapper<FollowEdge> ROW_MAPPER = (rs, rowNum) -> new FollowEdge(
        UUID.fromString(rs.getString("id")),
        SiteAddress.fromTrusted(rs.getString("target_address")),
        rs.getString("display_name"),
        rs.getBoolean("recursive"),
        parseChain(rs.getString("follow_chain")),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcFollowEdgeRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(FollowEdge edge) {
        jdbc.update("""
            INSERT INTO follow_edges (id, target_address, display_name, recursive, follow_chain, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (target_address) DO NOTHING
            """,
            edge.id(),
            edge.targetAddress().value(),
            edge.displayName(),
            edge.recursive(),
            edge.followChain().stream().map(SiteAddress::value).collect(Collectors.joining(CHAIN_SEPARATOR)),
            Timestamp.from(edge.createdAt())
        );
    }

    @Override
    public boolean delete(UUID edgeId) {
        return jdbc.update("DELETE FROM follow_edges WHERE id = ?", edgeId) > 0;
    }

    @Override
    public Optional<FollowEdge> findById(UUID edgeId) {
        return jdbc.query(
            "SELECT id, target_address, display_name, recursive, follow_chain, created_at FROM follow_edges WHERE id = ?",
            ROW_MAPPER,
            edgeId
        ).stream().findFirst();
    }

    @Override
    public boolean existsByTarget(SiteAddress targetAddress) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follow_edges WHERE target_address = ?",
            Integer.class,
            targetAddress.value()
        );
        return count != null && count > 0;
    }

    @Override
    public List<FollowEdge> findPage(String cursor, int limit) {
        if (cursor == null) {
            return jdbc.query("""
                SELECT id, target_address, display_name, recursive, follow_chain, created_at
                FROM follow_edges
                ORDER BY created_at DESC
                LIMIT ?
                """,
                ROW_MAPPER,
                limit
            );
        }
        Timestamp cursorTimestamp = Timestamp.from(Instant.parse(cursor));
        return jdbc.query("""
            SELECT id, target_address, display_name, recursive, follow_chain, created_at
            FROM follow_edges
            WHERE created_at < ?
            ORDER BY created_at DESC
            LIMIT ?
            """,
            ROW_MAPPER,
            cursorTimestamp,
            limit
        );
    }

    @Override
    public List<FollowEdge> findAll() {
        return jdbc.query(
            "SELECT id, target_address, display_name, recursive, follow_chain, created_at FROM follow_edges ORDER BY created_at",
            ROW_MAPPER
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM follow_edges", Long.class);
        return count != null ? count : 0;
    }

    private static List<SiteAddress> parseChain(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(CHAIN_SEPARATOR))
            .map(SiteAddress::fromTrusted)
            .toList();
    }
}
