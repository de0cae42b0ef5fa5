package com.fleetmind.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.model.ModelUsage;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputType;
import com.fleetmind.core.model.PromptRecord;
import com.fleetmind.core.model.RunQuery;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStats;
import com.fleetmind.core.model.RunStatus;
import com.fleetmind.core.model.WorkerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * JDBC-backed {@link RunStore}.
 * <p>
 * Runs, prompts and outputs live in three tables created by {@link #createTables()}.
 * Timestamps are stored as epoch milliseconds and the per-model usage breakdown as a
 * JSON document, so the same SQL runs on PostgreSQL and on H2.
 */
public class JdbcRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunStore.class);

    private static final String RUNS_TABLE = "fleet_runs";
    private static final String PROMPTS_TABLE = "fleet_prompts";
    private static final String OUTPUTS_TABLE = "fleet_outputs";

    private static final String CREATE_RUNS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                 BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                worker_id          VARCHAR(64) NOT NULL UNIQUE,
                session_id         VARCHAR(128),
                working_dir        VARCHAR(1024) NOT NULL,
                source             VARCHAR(32) NOT NULL,
                pipeline_id        VARCHAR(64),
                status             VARCHAR(32) NOT NULL,
                started_at         BIGINT NOT NULL,
                ended_at           BIGINT,
                last_activity      BIGINT NOT NULL,
                initial_prompt     TEXT,
                error_message      TEXT,
                total_prompts      BIGINT NOT NULL DEFAULT 0,
                total_tool_calls   BIGINT NOT NULL DEFAULT 0,
                total_output_bytes BIGINT NOT NULL DEFAULT 0,
                total_tokens_used  BIGINT,
                total_cost_usd     DOUBLE PRECISION,
                model_usage        TEXT,
                can_resume         BOOLEAN NOT NULL DEFAULT FALSE,
                resume_data        TEXT
            )
            """.formatted(RUNS_TABLE);

    private static final String CREATE_PROMPTS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                worker_id  VARCHAR(64) NOT NULL,
                prompt     TEXT NOT NULL,
                created_at BIGINT NOT NULL
            )
            """.formatted(PROMPTS_TABLE);

    private static final String CREATE_OUTPUTS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                worker_id   VARCHAR(64) NOT NULL,
                output_type VARCHAR(32) NOT NULL,
                content     TEXT NOT NULL,
                session_id  VARCHAR(128),
                byte_size   BIGINT NOT NULL,
                created_at  BIGINT NOT NULL
            )
            """.formatted(OUTPUTS_TABLE);

    private static final String RUN_COLUMNS = """
            id, worker_id, session_id, working_dir, source, pipeline_id, status, started_at, ended_at,
            last_activity, initial_prompt, error_message, total_prompts, total_tool_calls,
            total_output_bytes, total_tokens_used, total_cost_usd, model_usage, can_resume, resume_data""";

    private static final String INSERT_RUN_SQL = """
            INSERT INTO %s (worker_id, session_id, working_dir, source, pipeline_id, status, started_at,
                ended_at, last_activity, initial_prompt, error_message, total_prompts, total_tool_calls,
                total_output_bytes, total_tokens_used, total_cost_usd, model_usage, can_resume, resume_data)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(RUNS_TABLE);

    private static final String UPDATE_RUN_SQL = """
            UPDATE %s SET session_id = ?, working_dir = ?, source = ?, pipeline_id = ?, status = ?,
                started_at = ?, ended_at = ?, last_activity = ?, initial_prompt = ?, error_message = ?,
                total_prompts = ?, total_tool_calls = ?, total_output_bytes = ?, total_tokens_used = ?,
                total_cost_usd = ?, model_usage = ?, can_resume = ?, resume_data = ?
            WHERE worker_id = ?
            """.formatted(RUNS_TABLE);

    private static final String SELECT_RUN_SQL = """
            SELECT %s FROM %s WHERE worker_id = ?
            """.formatted(RUN_COLUMNS, RUNS_TABLE);

    private static final String INSERT_PROMPT_SQL = """
            INSERT INTO %s (worker_id, prompt, created_at) VALUES (?, ?, ?)
            """.formatted(PROMPTS_TABLE);

    private static final String SELECT_PROMPTS_SQL = """
            SELECT worker_id, prompt, created_at FROM %s WHERE worker_id = ? ORDER BY id ASC
            """.formatted(PROMPTS_TABLE);

    private static final String INSERT_OUTPUT_SQL = """
            INSERT INTO %s (worker_id, output_type, content, session_id, byte_size, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(OUTPUTS_TABLE);

    private static final String SELECT_OUTPUTS_SQL = """
            SELECT worker_id, output_type, content, session_id, byte_size, created_at
            FROM %s WHERE worker_id = ? ORDER BY id DESC LIMIT ?
            """.formatted(OUTPUTS_TABLE);

    private static final String SELECT_STALE_RUN_IDS_SQL = """
            SELECT worker_id FROM %s
            WHERE started_at < ? AND status <> 'running' AND status <> 'waiting_input'
            """.formatted(RUNS_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcRunStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the run, prompt and output tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_RUNS_SQL);
            stmt.execute(CREATE_PROMPTS_SQL);
            stmt.execute(CREATE_OUTPUTS_SQL);
            log.info("Run store tables '{}', '{}', '{}' ensured", RUNS_TABLE, PROMPTS_TABLE, OUTPUTS_TABLE);
        }
    }

    @Override
    public long createRun(RunRecord run) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_RUN_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, run.getWorkerId());
            bindRunFields(stmt, 2, run);
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                long id = keys.next() ? keys.getLong(1) : -1L;
                log.debug("Created run {} for worker {}", id, run.getWorkerId());
                return id;
            }
        } catch (SQLException e) {
            throw new RunStoreException("Failed to create run for worker " + run.getWorkerId(), e);
        }
    }

    @Override
    public void updateRun(RunRecord run) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_RUN_SQL)) {
            int i = bindRunFields(stmt, 1, run);
            stmt.setString(i, run.getWorkerId());
            int updated = stmt.executeUpdate();
            if (updated == 0) {
                log.warn("Update for unknown run of worker {}", run.getWorkerId());
            }
        } catch (SQLException e) {
            throw new RunStoreException("Failed to update run for worker " + run.getWorkerId(), e);
        }
    }

    @Override
    public Optional<RunRecord> getRun(String workerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RUN_SQL)) {
            stmt.setString(1, workerId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to get run for worker '{}'", workerId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<RunRecord> queryRuns(RunQuery query) {
        var sql = new StringBuilder("SELECT ").append(RUN_COLUMNS).append(" FROM ").append(RUNS_TABLE)
                .append(" WHERE 1 = 1");
        var params = new ArrayList<Object>();
        if (query.status() != null) {
            sql.append(" AND status = ?");
            params.add(query.status().wireName());
        }
        if (query.workingDir() != null) {
            sql.append(" AND working_dir = ?");
            params.add(query.workingDir());
        }
        if (query.source() != null) {
            sql.append(" AND source = ?");
            params.add(query.source().wireName());
        }
        if (query.startedAfter() != null) {
            sql.append(" AND started_at >= ?");
            params.add(query.startedAfter().toEpochMilli());
        }
        if (query.startedBefore() != null) {
            sql.append(" AND started_at <= ?");
            params.add(query.startedBefore().toEpochMilli());
        }
        sql.append(" ORDER BY started_at DESC");
        if (query.limit() != null) {
            sql.append(" LIMIT ?");
            params.add(query.limit());
        }
        if (query.offset() != null) {
            sql.append(" OFFSET ?");
            params.add(query.offset());
        }

        List<RunRecord> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query runs with {}", query, e);
        }
        return results;
    }

    @Override
    public void recordPrompt(String workerId, String prompt, Instant at) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_PROMPT_SQL)) {
            stmt.setString(1, workerId);
            stmt.setString(2, prompt);
            stmt.setLong(3, at.toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new RunStoreException("Failed to record prompt for worker " + workerId, e);
        }
    }

    @Override
    public List<PromptRecord> getPrompts(String workerId) {
        List<PromptRecord> prompts = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PROMPTS_SQL)) {
            stmt.setString(1, workerId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    prompts.add(new PromptRecord(rs.getString("worker_id"), rs.getString("prompt"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read prompts for worker '{}'", workerId, e);
        }
        return prompts;
    }

    @Override
    public void recordOutput(OutputEvent event) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_OUTPUT_SQL)) {
            stmt.setString(1, event.workerId());
            stmt.setString(2, event.outputType().wireName());
            stmt.setString(3, event.content());
            stmt.setString(4, event.sessionId());
            stmt.setLong(5, event.byteSize());
            stmt.setLong(6, event.timestamp().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new RunStoreException("Failed to record output for worker " + event.workerId(), e);
        }
    }

    @Override
    public List<OutputEvent> getOutputs(String workerId, int limit) {
        List<OutputEvent> outputs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_OUTPUTS_SQL)) {
            stmt.setString(1, workerId);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String content = rs.getString("content");
                    outputs.add(new OutputEvent(rs.getString("worker_id"),
                            OutputType.fromWireName(rs.getString("output_type")), content, null,
                            rs.getString("session_id"), null, null, null,
                            rs.getLong("byte_size"), Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read outputs for worker '{}'", workerId, e);
        }
        Collections.reverse(outputs);
        return outputs;
    }

    @Override
    public int cleanupRunsBefore(Instant cutoff) {
        try (Connection conn = dataSource.getConnection()) {
            List<String> workerIds = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_STALE_RUN_IDS_SQL)) {
                stmt.setLong(1, cutoff.toEpochMilli());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        workerIds.add(rs.getString(1));
                    }
                }
            }
            for (String workerId : workerIds) {
                for (String table : List.of(OUTPUTS_TABLE, PROMPTS_TABLE, RUNS_TABLE)) {
                    try (PreparedStatement stmt = conn.prepareStatement(
                            "DELETE FROM " + table + " WHERE worker_id = ?")) {
                        stmt.setString(1, workerId);
                        stmt.executeUpdate();
                    }
                }
            }
            log.info("Cleaned up {} runs started before {}", workerIds.size(), cutoff);
            return workerIds.size();
        } catch (SQLException e) {
            throw new RunStoreException("Failed to clean up runs before " + cutoff, e);
        }
    }

    @Override
    public RunStats getStats() {
        try (Connection conn = dataSource.getConnection()) {
            long total = singleLong(conn, "SELECT COUNT(*) FROM " + RUNS_TABLE);
            Map<String, Long> byStatus = groupCounts(conn, "status");
            Map<String, Long> bySource = groupCounts(conn, "source");
            double cost;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT COALESCE(SUM(total_cost_usd), 0.0) FROM " + RUNS_TABLE);
                 ResultSet rs = stmt.executeQuery()) {
                cost = rs.next() ? rs.getDouble(1) : 0.0;
            }
            long resumable = singleLong(conn, "SELECT COUNT(*) FROM " + RUNS_TABLE
                    + " WHERE can_resume = TRUE AND status = 'crashed'");
            return new RunStats(total, byStatus, bySource, cost, resumable);
        } catch (SQLException e) {
            throw new RunStoreException("Failed to compute run statistics", e);
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private int bindRunFields(PreparedStatement stmt, int i, RunRecord run) throws SQLException {
        stmt.setString(i++, run.getSessionId());
        stmt.setString(i++, run.getWorkingDir());
        stmt.setString(i++, run.getSource().wireName());
        stmt.setString(i++, run.getPipelineId());
        stmt.setString(i++, run.getStatus().wireName());
        stmt.setLong(i++, run.getStartedAt().toEpochMilli());
        setNullableLong(stmt, i++, run.getEndedAt() != null ? run.getEndedAt().toEpochMilli() : null);
        Instant lastActivity = run.getLastActivity() != null ? run.getLastActivity() : run.getStartedAt();
        stmt.setLong(i++, lastActivity.toEpochMilli());
        stmt.setString(i++, run.getInitialPrompt());
        stmt.setString(i++, run.getErrorMessage());
        stmt.setLong(i++, run.getTotalPrompts());
        stmt.setLong(i++, run.getTotalToolCalls());
        stmt.setLong(i++, run.getTotalOutputBytes());
        setNullableLong(stmt, i++, run.getTotalTokensUsed());
        if (run.getTotalCostUsd() != null) {
            stmt.setDouble(i++, run.getTotalCostUsd());
        } else {
            stmt.setNull(i++, Types.DOUBLE);
        }
        stmt.setString(i++, serializeModelUsage(run.getModelUsage()));
        stmt.setBoolean(i++, run.isCanResume());
        stmt.setString(i++, run.getResumeData());
        return i;
    }

    private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value != null) {
            stmt.setLong(index, value);
        } else {
            stmt.setNull(index, Types.BIGINT);
        }
    }

    private RunRecord fromResultSet(ResultSet rs) throws SQLException {
        var run = new RunRecord();
        run.setId(rs.getLong("id"));
        run.setWorkerId(rs.getString("worker_id"));
        run.setSessionId(rs.getString("session_id"));
        run.setWorkingDir(rs.getString("working_dir"));
        run.setSource(WorkerSource.fromWireName(rs.getString("source")));
        run.setPipelineId(rs.getString("pipeline_id"));
        run.setStatus(RunStatus.fromWireName(rs.getString("status")));
        run.setStartedAt(Instant.ofEpochMilli(rs.getLong("started_at")));
        long endedAt = rs.getLong("ended_at");
        run.setEndedAt(rs.wasNull() ? null : Instant.ofEpochMilli(endedAt));
        run.setLastActivity(Instant.ofEpochMilli(rs.getLong("last_activity")));
        run.setInitialPrompt(rs.getString("initial_prompt"));
        run.setErrorMessage(rs.getString("error_message"));
        run.setTotalPrompts(rs.getLong("total_prompts"));
        run.setTotalToolCalls(rs.getLong("total_tool_calls"));
        run.setTotalOutputBytes(rs.getLong("total_output_bytes"));
        long tokens = rs.getLong("total_tokens_used");
        run.setTotalTokensUsed(rs.wasNull() ? null : tokens);
        double cost = rs.getDouble("total_cost_usd");
        run.setTotalCostUsd(rs.wasNull() ? null : cost);
        run.setModelUsage(deserializeModelUsage(rs.getString("model_usage")));
        run.setCanResume(rs.getBoolean("can_resume"));
        run.setResumeData(rs.getString("resume_data"));
        return run;
    }

    private String serializeModelUsage(Map<String, ModelUsage> usage) {
        if (usage == null || usage.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(usage);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize model usage: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, ModelUsage> deserializeModelUsage(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, ModelUsage>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Could not deserialize model usage: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private static long singleLong(Connection conn, String sql) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static Map<String, Long> groupCounts(Connection conn, String column) throws SQLException {
        Map<String, Long> counts = new TreeMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT " + column + ", COUNT(*) FROM " + RUNS_TABLE + " GROUP BY " + column);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString(1), rs.getLong(2));
            }
        }
        return counts;
    }
}
