package com.omrchecker.orchestrator.parsing.persistence;

import com.omrchecker.orchestrator.parsing.model.CallbackStatus;
import com.omrchecker.orchestrator.parsing.model.JobStatus;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ParsingJobRepository {
    private static final String JOB_COLUMNS = """
        id, operator_id, status, total_sheets, processed_sheets,
        callback_status, scan_config, created_at, completed_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumnCodec codec;

    public ParsingJobRepository(NamedParameterJdbcTemplate jdbc, JsonColumnCodec codec) {
        this.jdbc = jdbc;
        this.codec = codec;
    }

    public ParsingJob create(ParsingJob job) {
        Instant createdAt = job.createdAt() == null ? Instant.now() : job.createdAt();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", job.id())
            .addValue("operatorId", job.operatorId())
            .addValue("status", job.status().name())
            .addValue("totalSheets", job.totalSheets())
            .addValue("processedSheets", job.processedSheets())
            .addValue("callbackStatus", job.callbackStatus().name())
            .addValue("scanConfig", codec.writeScanConfig(job.scanConfig()))
            .addValue("createdAt", Timestamp.from(createdAt))
            .addValue("completedAt", toTimestamp(job.completedAt()));
        jdbc.update(
            """
                INSERT INTO parsing_jobs (
                    id, operator_id, status, total_sheets, processed_sheets,
                    callback_status, scan_config, created_at, completed_at
                )
                VALUES (
                    :id, :operatorId, :status, :totalSheets, :processedSheets,
                    :callbackStatus, :scanConfig, :createdAt, :completedAt
                )
                """,
            params
        );
        return new ParsingJob(
            job.id(),
            job.operatorId(),
            job.status(),
            job.totalSheets(),
            job.processedSheets(),
            job.callbackStatus(),
            job.scanConfig(),
            createdAt,
            job.completedAt()
        );
    }

    public Optional<ParsingJob> findById(String jobId) {
        List<ParsingJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM parsing_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", jobId),
            jobRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<ParsingJob> findByOperator(String operatorId) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM parsing_jobs
                WHERE operator_id = :operatorId
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource().addValue("operatorId", operatorId),
            jobRowMapper()
        );
    }

    public List<ParsingJob> findByOperatorAndStatus(String operatorId, JobStatus status, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("operatorId", operatorId)
            .addValue("status", status == null ? null : status.name())
            .addValue("limit", Math.max(1, limit));
        String statusFilter = status == null ? "" : " AND status = :status";
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM parsing_jobs WHERE operator_id = :operatorId" + statusFilter
                + " ORDER BY created_at DESC, id DESC LIMIT :limit",
            params,
            jobRowMapper()
        );
    }

    public List<ParsingJob> findByStatus(JobStatus status) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM parsing_jobs
                WHERE status = :status
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource().addValue("status", status.name()),
            jobRowMapper()
        );
    }

    public List<ParsingJob> findByCallbackStatus(CallbackStatus callbackStatus) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM parsing_jobs
                WHERE callback_status = :callbackStatus
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource().addValue("callbackStatus", callbackStatus.name()),
            jobRowMapper()
        );
    }

    /**
     * Completed jobs whose callback was never attempted, oldest completion first.
     */
    public List<ParsingJob> findPendingCallbacks() {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM parsing_jobs
                WHERE status = 'COMPLETED'
                  AND callback_status = 'NOT_SENT'
                ORDER BY completed_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            jobRowMapper()
        );
    }

    public boolean update(ParsingJob job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", job.id())
            .addValue("operatorId", job.operatorId())
            .addValue("status", job.status().name())
            .addValue("totalSheets", job.totalSheets())
            .addValue("processedSheets", job.processedSheets())
            .addValue("callbackStatus", job.callbackStatus().name())
            .addValue("scanConfig", codec.writeScanConfig(job.scanConfig()))
            .addValue("completedAt", toTimestamp(job.completedAt()));
        int updated = jdbc.update(
            """
                UPDATE parsing_jobs
                SET operator_id = :operatorId,
                    status = :status,
                    total_sheets = :totalSheets,
                    processed_sheets = :processedSheets,
                    callback_status = :callbackStatus,
                    scan_config = :scanConfig,
                    completed_at = :completedAt
                WHERE id = :id
                """,
            params
        );
        return updated > 0;
    }

    /**
     * Moves a non-terminal job to {@code PROCESSING}. Re-applying to a job that is already processing
     * matches the row again; terminal jobs are left untouched.
     */
    public boolean markProcessing(String jobId) {
        int updated = jdbc.update(
            """
                UPDATE parsing_jobs
                SET status = 'PROCESSING'
                WHERE id = :id
                  AND status IN ('PENDING', 'PROCESSING')
                """,
            new MapSqlParameterSource().addValue("id", jobId)
        );
        return updated > 0;
    }

    /**
     * Writes the terminal status and completion time in one statement. Only the first call for a job
     * matches; later calls see a terminal row and update nothing. {@code processed_sheets} is raised to the
     * number of resolved sheets, so a progress bump lost by an aborted run is made up here.
     */
    public boolean markTerminal(String jobId, JobStatus status, Instant completedAt) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal job status: " + status);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("status", status.name())
            .addValue("completedAt", Timestamp.from(completedAt));
        int updated = jdbc.update(
            """
                UPDATE parsing_jobs
                SET status = :status,
                    completed_at = :completedAt,
                    processed_sheets = GREATEST(
                        processed_sheets,
                        (SELECT COUNT(*) FROM omr_sheets s WHERE s.parsing_job_id = parsing_jobs.id AND s.status <> 'PENDING')
                    )
                WHERE id = :id
                  AND status IN ('PENDING', 'PROCESSING')
                """,
            params
        );
        return updated > 0;
    }

    public boolean updateStatus(String jobId, JobStatus status, Instant completedAt) {
        if (status.isTerminal()) {
            return markTerminal(jobId, status, completedAt == null ? Instant.now() : completedAt);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("status", status.name());
        int updated = jdbc.update(
            """
                UPDATE parsing_jobs
                SET status = :status,
                    completed_at = NULL
                WHERE id = :id
                  AND status IN ('PENDING', 'PROCESSING')
                """,
            params
        );
        return updated > 0;
    }

    /**
     * Atomic {@code processed_sheets + 1}, never past {@code total_sheets}. Returns the count after the
     * update, or -1 when the job does not exist.
     */
    public int incrementProcessed(String jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", jobId);
        jdbc.update(
            """
                UPDATE parsing_jobs
                SET processed_sheets = processed_sheets + 1
                WHERE id = :id
                  AND processed_sheets < total_sheets
                """,
            params
        );
        List<Integer> counts = jdbc.query(
            "SELECT processed_sheets FROM parsing_jobs WHERE id = :id",
            params,
            (rs, rowNum) -> rs.getInt("processed_sheets")
        );
        return counts.isEmpty() ? -1 : counts.get(0);
    }

    public boolean updateCallbackStatus(String jobId, CallbackStatus callbackStatus) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("callbackStatus", callbackStatus.name());
        int updated = jdbc.update(
            """
                UPDATE parsing_jobs
                SET callback_status = :callbackStatus
                WHERE id = :id
                """,
            params
        );
        return updated > 0;
    }

    public boolean delete(String jobId) {
        int deleted = jdbc.update(
            "DELETE FROM parsing_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", jobId)
        );
        return deleted > 0;
    }

    private RowMapper<ParsingJob> jobRowMapper() {
        return (rs, rowNum) -> new ParsingJob(
            rs.getString("id"),
            rs.getString("operator_id"),
            JobStatus.fromValue(rs.getString("status")),
            rs.getInt("total_sheets"),
            rs.getInt("processed_sheets"),
            CallbackStatus.fromValue(rs.getString("callback_status")),
            codec.readScanConfig(rs.getString("scan_config")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
