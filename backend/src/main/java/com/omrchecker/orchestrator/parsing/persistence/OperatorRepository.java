package com.omrchecker.orchestrator.parsing.persistence;

import com.omrchecker.orchestrator.parsing.model.Operator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class OperatorRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public OperatorRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Operator create(Operator operator) {
        Instant createdAt = operator.createdAt() == null ? Instant.now() : operator.createdAt();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", operator.id())
            .addValue("token", operator.token())
            .addValue("callbackUrl", operator.callbackUrl())
            .addValue("createdAt", Timestamp.from(createdAt));
        jdbc.update(
            """
                INSERT INTO operators (id, token, callback_url, created_at)
                VALUES (:id, :token, :callbackUrl, :createdAt)
                """,
            params
        );
        return new Operator(operator.id(), operator.token(), operator.callbackUrl(), createdAt);
    }

    public Optional<Operator> findById(String operatorId) {
        List<Operator> rows = jdbc.query(
            """
                SELECT id, token, callback_url, created_at
                FROM operators
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", operatorId),
            operatorRowMapper()
        );
        return rows.stream().findFirst();
    }

    public Optional<Operator> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        List<Operator> rows = jdbc.query(
            """
                SELECT id, token, callback_url, created_at
                FROM operators
                WHERE token = :token
                """,
            new MapSqlParameterSource().addValue("token", token),
            operatorRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<Operator> findAll() {
        return jdbc.query(
            """
                SELECT id, token, callback_url, created_at
                FROM operators
                ORDER BY created_at DESC, id
                """,
            new MapSqlParameterSource(),
            operatorRowMapper()
        );
    }

    /**
     * Only the callback URL is mutable; id, token and creation time are ignored.
     */
    public boolean update(Operator operator) {
        return updateCallbackUrl(operator.id(), operator.callbackUrl());
    }

    public boolean updateCallbackUrl(String operatorId, String callbackUrl) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", operatorId)
            .addValue("callbackUrl", callbackUrl);
        int updated = jdbc.update(
            """
                UPDATE operators
                SET callback_url = :callbackUrl
                WHERE id = :id
                """,
            params
        );
        return updated > 0;
    }

    public boolean delete(String operatorId) {
        int deleted = jdbc.update(
            "DELETE FROM operators WHERE id = :id",
            new MapSqlParameterSource().addValue("id", operatorId)
        );
        return deleted > 0;
    }

    public boolean exists(String operatorId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM operators WHERE id = :id",
            new MapSqlParameterSource().addValue("id", operatorId),
            Integer.class
        );
        return count != null && count > 0;
    }

    private RowMapper<Operator> operatorRowMapper() {
        return (rs, rowNum) -> new Operator(
            rs.getString("id"),
            rs.getString("token"),
            rs.getString("callback_url"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
