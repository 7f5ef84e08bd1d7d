package com.omrchecker.orchestrator.parsing.persistence;

import com.omrchecker.orchestrator.parsing.model.OmrSheet;
import com.omrchecker.orchestrator.parsing.model.SheetOutcome;
import com.omrchecker.orchestrator.parsing.model.SheetStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class OmrSheetRepository {
    private static final String SHEET_COLUMNS = """
        id, parsing_job_id, item_id, sheet_index, image_url, result_json,
        status, error_message, created_at, parsed_at
        """;
    private static final String INSERT_SQL = """
        INSERT INTO omr_sheets (
            id, parsing_job_id, item_id, sheet_index, image_url, result_json,
            status, error_message, created_at, parsed_at
        )
        VALUES (
            :id, :jobId, :itemId, :position, :imageUrl, :resultJson,
            :status, :errorMessage, :createdAt, :parsedAt
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumnCodec codec;

    public OmrSheetRepository(NamedParameterJdbcTemplate jdbc, JsonColumnCodec codec) {
        this.jdbc = jdbc;
        this.codec = codec;
    }

    public OmrSheet create(OmrSheet sheet) {
        OmrSheet stamped = withCreatedAt(sheet, Instant.now());
        jdbc.update(INSERT_SQL, insertParams(stamped));
        return stamped;
    }

    public List<OmrSheet> createAll(List<OmrSheet> sheets) {
        if (sheets == null || sheets.isEmpty()) {
            return List.of();
        }
        Instant now = Instant.now();
        List<OmrSheet> stamped = new ArrayList<>(sheets.size());
        List<MapSqlParameterSource> batch = new ArrayList<>(sheets.size());
        for (OmrSheet sheet : sheets) {
            OmrSheet row = withCreatedAt(sheet, now);
            stamped.add(row);
            batch.add(insertParams(row));
        }
        jdbc.batchUpdate(INSERT_SQL, batch.toArray(new MapSqlParameterSource[0]));
        return stamped;
    }

    public Optional<OmrSheet> findById(String sheetId) {
        List<OmrSheet> rows = jdbc.query(
            "SELECT " + SHEET_COLUMNS + " FROM omr_sheets WHERE id = :id",
            new MapSqlParameterSource().addValue("id", sheetId),
            sheetRowMapper()
        );
        return rows.stream().findFirst();
    }

    /**
     * Sheets of a job in submission order.
     */
    public List<OmrSheet> findByJob(String jobId) {
        return jdbc.query(
            "SELECT " + SHEET_COLUMNS + """
                FROM omr_sheets
                WHERE parsing_job_id = :jobId
                ORDER BY created_at ASC, sheet_index ASC, id ASC
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            sheetRowMapper()
        );
    }

    public List<OmrSheet> findByJobAndStatus(String jobId, SheetStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", status.name());
        return jdbc.query(
            "SELECT " + SHEET_COLUMNS + """
                FROM omr_sheets
                WHERE parsing_job_id = :jobId
                  AND status = :status
                ORDER BY created_at ASC, sheet_index ASC, id ASC
                """,
            params,
            sheetRowMapper()
        );
    }

    public List<OmrSheet> findPending(int limit) {
        return jdbc.query(
            "SELECT " + SHEET_COLUMNS + """
                FROM omr_sheets
                WHERE status = 'PENDING'
                ORDER BY created_at ASC, sheet_index ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            sheetRowMapper()
        );
    }

    public int countByJobAndStatus(String jobId, SheetStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", status.name());
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM omr_sheets WHERE parsing_job_id = :jobId AND status = :status",
            params,
            Integer.class
        );
        return count == null ? 0 : count;
    }

    /**
     * Sheet counts per status; every status is present, zero when no sheet has it.
     */
    public Map<SheetStatus, Integer> countByJobGroupedByStatus(String jobId) {
        Map<SheetStatus, Integer> counts = new EnumMap<>(SheetStatus.class);
        for (SheetStatus status : SheetStatus.values()) {
            counts.put(status, 0);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS sheet_count
                FROM omr_sheets
                WHERE parsing_job_id = :jobId
                GROUP BY status
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            rs -> {
                counts.put(SheetStatus.fromValue(rs.getString("status")), rs.getInt("sheet_count"));
            }
        );
        return counts;
    }

    public boolean update(OmrSheet sheet) {
        SheetOutcome outcome = sheet.outcome();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", sheet.id())
            .addValue("itemId", sheet.itemId())
            .addValue("position", sheet.position())
            .addValue("imageUrl", sheet.imageLocator())
            .addValue("status", sheet.status().name())
            .addValue("resultJson", codec.writeSuccess(sheet.success()))
            .addValue("errorMessage", outcome instanceof SheetOutcome.Failure failure ? failure.reason() : null)
            .addValue("parsedAt", toTimestamp(sheet.resolvedAt()));
        int updated = jdbc.update(
            """
                UPDATE omr_sheets
                SET item_id = :itemId,
                    sheet_index = :position,
                    image_url = :imageUrl,
                    status = :status,
                    result_json = :resultJson,
                    error_message = :errorMessage,
                    parsed_at = :parsedAt
                WHERE id = :id
                """,
            params
        );
        return updated > 0;
    }

    /**
     * Resolves a pending sheet as parsed. Returns false when the sheet is missing or already resolved.
     */
    public boolean updateParsed(String sheetId, SheetOutcome.Success success, Instant parsedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", sheetId)
            .addValue("resultJson", codec.writeSuccess(success))
            .addValue("parsedAt", Timestamp.from(parsedAt));
        int updated = jdbc.update(
            """
                UPDATE omr_sheets
                SET status = 'PARSED',
                    result_json = :resultJson,
                    error_message = NULL,
                    parsed_at = :parsedAt
                WHERE id = :id
                  AND status = 'PENDING'
                """,
            params
        );
        return updated > 0;
    }

    /**
     * Resolves a pending sheet as failed. Returns false when the sheet is missing or already resolved.
     */
    public boolean updateFailed(String sheetId, SheetOutcome.Failure failure, Instant failedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", sheetId)
            .addValue("errorMessage", failure.reason())
            .addValue("parsedAt", Timestamp.from(failedAt));
        int updated = jdbc.update(
            """
                UPDATE omr_sheets
                SET status = 'FAILED',
                    result_json = NULL,
                    error_message = :errorMessage,
                    parsed_at = :parsedAt
                WHERE id = :id
                  AND status = 'PENDING'
                """,
            params
        );
        return updated > 0;
    }

    public boolean delete(String sheetId) {
        int deleted = jdbc.update(
            "DELETE FROM omr_sheets WHERE id = :id",
            new MapSqlParameterSource().addValue("id", sheetId)
        );
        return deleted > 0;
    }

    public int deleteByJob(String jobId) {
        return jdbc.update(
            "DELETE FROM omr_sheets WHERE parsing_job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId)
        );
    }

    private MapSqlParameterSource insertParams(OmrSheet sheet) {
        SheetOutcome outcome = sheet.outcome();
        return new MapSqlParameterSource()
            .addValue("id", sheet.id())
            .addValue("jobId", sheet.jobId())
            .addValue("itemId", sheet.itemId())
            .addValue("position", sheet.position())
            .addValue("imageUrl", sheet.imageLocator())
            .addValue("resultJson", codec.writeSuccess(sheet.success()))
            .addValue("status", sheet.status().name())
            .addValue("errorMessage", outcome instanceof SheetOutcome.Failure failure ? failure.reason() : null)
            .addValue("createdAt", Timestamp.from(sheet.createdAt()))
            .addValue("parsedAt", toTimestamp(sheet.resolvedAt()));
    }

    private static OmrSheet withCreatedAt(OmrSheet sheet, Instant fallback) {
        if (sheet.createdAt() != null) {
            return sheet;
        }
        return new OmrSheet(
            sheet.id(),
            sheet.jobId(),
            sheet.itemId(),
            sheet.position(),
            sheet.imageLocator(),
            sheet.status(),
            sheet.outcome(),
            fallback,
            sheet.resolvedAt()
        );
    }

    private RowMapper<OmrSheet> sheetRowMapper() {
        return (rs, rowNum) -> {
            SheetStatus status = SheetStatus.fromValue(rs.getString("status"));
            return new OmrSheet(
                rs.getString("id"),
                rs.getString("parsing_job_id"),
                rs.getString("item_id"),
                rs.getInt("sheet_index"),
                rs.getString("image_url"),
                status,
                codec.readOutcome(status, rs.getString("result_json"), rs.getString("error_message")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("parsed_at"))
            );
        };
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
