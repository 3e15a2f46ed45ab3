package com.ecvi.riskengine.verify.persistence;

import com.ecvi.riskengine.verify.model.Discrepancy;
import com.ecvi.riskengine.verify.model.RiskAssessment;
import com.ecvi.riskengine.verify.model.RiskCategory;
import com.ecvi.riskengine.verify.model.RiskContribution;
import com.ecvi.riskengine.verify.model.RiskFactor;
import com.ecvi.riskengine.verify.model.ScoredRecord;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceOutcome;
import com.ecvi.riskengine.verify.model.SourceResult;
import com.ecvi.riskengine.verify.model.VerificationRecord;
import com.ecvi.riskengine.verify.model.VerificationStatus;
import com.ecvi.riskengine.verify.model.VerificationStatusView;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Verification records, their per-category source results and the per-company lock rows.
 * Records are never deleted; a terminal record only ever gains a tombstone timestamp.
 */
@Repository
public class VerificationJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(VerificationJdbcRepository.class);
    private static final TypeReference<Map<String, String>> MAP_STRING = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> MAP_DOUBLE = new TypeReference<>() {};
    private static final TypeReference<Map<RiskFactor, RiskContribution>> BREAKDOWN = new TypeReference<>() {};
    private static final TypeReference<List<Discrepancy>> DISCREPANCIES = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

    private static final String RECORD_COLUMNS = """
        id, company_id, status, risk_score, risk_category, trigger_reason, overrides_json,
        breakdown_json, failure_reason, created_at, started_at, completed_at, tombstoned_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public VerificationJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = detectPostgres(jdbc);
    }

    /**
     * Claims the company lock and inserts a PENDING record in one transaction.
     *
     * @return the new record id, or {@code null} when another record already holds the lock
     */
    @Transactional
    public Long createPendingRecord(long companyId, String triggerReason, Map<String, String> overrides, Instant createdAt) {
        if (!tryAcquireLock(companyId, createdAt)) {
            return null;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("status", VerificationStatus.PENDING.name())
            .addValue("triggerReason", triggerReason)
            .addValue("overridesJson", writeJson(overrides == null || overrides.isEmpty() ? null : overrides))
            .addValue("createdAt", toTimestamp(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO verification_records (
                    company_id, status, trigger_reason, overrides_json, created_at
                )
                VALUES (
                    :companyId, :status, :triggerReason, :overridesJson, :createdAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert verification record");
        }
        long recordId = key.longValue();
        jdbc.update(
            """
                UPDATE verification_locks
                SET record_id = :recordId
                WHERE company_id = :companyId
                """,
            new MapSqlParameterSource()
                .addValue("recordId", recordId)
                .addValue("companyId", companyId)
        );
        return recordId;
    }

    private boolean tryAcquireLock(long companyId, Instant acquiredAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("acquiredAt", toTimestamp(acquiredAt));
        try {
            int inserted;
            if (postgres) {
                inserted = jdbc.update(
                    """
                        INSERT INTO verification_locks (company_id, acquired_at)
                        VALUES (:companyId, :acquiredAt)
                        ON CONFLICT (company_id) DO NOTHING
                        """,
                    params
                );
            } else {
                inserted = jdbc.update(
                    """
                        INSERT INTO verification_locks (company_id, acquired_at)
                        VALUES (:companyId, :acquiredAt)
                        """,
                    params
                );
            }
            return inserted == 1;
        } catch (DataIntegrityViolationException e) {
            log.debug("Lock for company {} taken concurrently", companyId);
            return false;
        }
    }

    public Long findLockedRecordId(long companyId) {
        List<Long> rows = jdbc.query(
            "SELECT record_id FROM verification_locks WHERE company_id = :companyId",
            new MapSqlParameterSource("companyId", companyId),
            (rs, rowNum) -> {
                long value = rs.getLong("record_id");
                return rs.wasNull() ? null : value;
            }
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** PENDING to IN_PROGRESS; false when the record already moved on (for example, cancelled). */
    public boolean markInProgress(long recordId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("recordId", recordId)
            .addValue("startedAt", toTimestamp(startedAt));
        return jdbc.update(
            """
                UPDATE verification_records
                SET status = 'IN_PROGRESS',
                    started_at = :startedAt
                WHERE id = :recordId
                  AND status = 'PENDING'
                """,
            params
        ) == 1;
    }

    /**
     * Writes the scored result, its source results and releases the company lock, all or nothing.
     * Returns false, writing nothing, when the record is no longer IN_PROGRESS.
     */
    @Transactional
    public boolean completeRecord(
        long recordId,
        long companyId,
        RiskAssessment assessment,
        Collection<SourceResult> sourceResults,
        Instant completedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("recordId", recordId)
            .addValue("riskScore", assessment.riskScore())
            .addValue("riskCategory", assessment.riskCategory().name())
            .addValue("breakdownJson", writeJson(assessment.breakdown()))
            .addValue("completedAt", toTimestamp(completedAt));
        int updated = jdbc.update(
            """
                UPDATE verification_records
                SET status = 'COMPLETED',
                    risk_score = :riskScore,
                    risk_category = :riskCategory,
                    breakdown_json = :breakdownJson,
                    completed_at = :completedAt
                WHERE id = :recordId
                  AND status = 'IN_PROGRESS'
                """,
            params
        );
        if (updated != 1) {
            return false;
        }
        insertSourceResults(recordId, sourceResults);
        releaseLock(companyId, recordId);
        return true;
    }

    /**
     * Finalizes a non-terminal record as FAILED, keeping whatever source results were gathered,
     * and releases the company lock. Returns false when the record was already terminal.
     */
    @Transactional
    public boolean failRecord(
        long recordId,
        long companyId,
        String failureReason,
        Collection<SourceResult> sourceResults,
        Instant completedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("recordId", recordId)
            .addValue("failureReason", failureReason)
            .addValue("completedAt", toTimestamp(completedAt));
        int updated = jdbc.update(
            """
                UPDATE verification_records
                SET status = 'FAILED',
                    risk_score = NULL,
                    risk_category = NULL,
                    failure_reason = :failureReason,
                    completed_at = :completedAt
                WHERE id = :recordId
                  AND status IN ('PENDING', 'IN_PROGRESS')
                """,
            params
        );
        if (updated != 1) {
            return false;
        }
        if (sourceResults != null && !sourceResults.isEmpty()) {
            insertSourceResults(recordId, sourceResults);
        }
        releaseLock(companyId, recordId);
        return true;
    }

    private void insertSourceResults(long recordId, Collection<SourceResult> results) {
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (SourceResult result : results) {
            batch.add(new MapSqlParameterSource()
                .addValue("recordId", recordId)
                .addValue("category", result.category().name())
                .addValue("outcome", result.outcome().name())
                .addValue("signal", result.signal())
                .addValue("corroboratingSources", result.corroboratingSources())
                .addValue("confidence", result.confidence())
                .addValue("fieldsJson", writeJson(result.fields()))
                .addValue("fieldConfidenceJson", writeJson(result.fieldConfidence()))
                .addValue("discrepanciesJson", writeJson(result.discrepancies()))
                .addValue("notesJson", writeJson(result.notes())));
        }
        if (batch.isEmpty()) {
            return;
        }
        jdbc.batchUpdate(
            """
                INSERT INTO verification_source_results (
                    record_id, category, outcome, source_signal, corroborating_sources, confidence,
                    fields_json, field_confidence_json, discrepancies_json, notes_json
                )
                VALUES (
                    :recordId, :category, :outcome, :signal, :corroboratingSources, :confidence,
                    :fieldsJson, :fieldConfidenceJson, :discrepanciesJson, :notesJson
                )
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
    }

    private void releaseLock(long companyId, long recordId) {
        jdbc.update(
            """
                DELETE FROM verification_locks
                WHERE company_id = :companyId
                  AND (record_id = :recordId OR record_id IS NULL)
                """,
            new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("recordId", recordId)
        );
    }

    /** Drops lock rows whose record is already terminal; returns how many were removed. */
    public int releaseLocksOfTerminalRecords() {
        return jdbc.update(
            """
                DELETE FROM verification_locks
                WHERE record_id IS NULL
                   OR record_id IN (
                       SELECT id FROM verification_records WHERE status IN ('COMPLETED', 'FAILED')
                   )
                """,
            new MapSqlParameterSource()
        );
    }

    public boolean tombstone(long recordId, Instant tombstonedAt) {
        return jdbc.update(
            """
                UPDATE verification_records
                SET tombstoned_at = :tombstonedAt
                WHERE id = :recordId
                  AND tombstoned_at IS NULL
                """,
            new MapSqlParameterSource()
                .addValue("recordId", recordId)
                .addValue("tombstonedAt", toTimestamp(tombstonedAt))
        ) == 1;
    }

    public VerificationRecord findRecord(long recordId) {
        List<VerificationRecord> rows = jdbc.query(
            "SELECT " + RECORD_COLUMNS + " FROM verification_records WHERE id = :recordId",
            new MapSqlParameterSource("recordId", recordId),
            (rs, rowNum) -> mapRecord(rs, Map.of())
        );
        if (rows.isEmpty()) {
            return null;
        }
        return withSourceResults(rows).get(0);
    }

    public VerificationStatusView findStatusView(long recordId) {
        List<VerificationStatusView> rows = jdbc.query(
            """
                SELECT id, company_id, status, risk_score, risk_category, started_at, completed_at, failure_reason
                FROM verification_records
                WHERE id = :recordId
                """,
            new MapSqlParameterSource("recordId", recordId),
            (rs, rowNum) -> mapStatusView(rs)
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Newest first by creation time; id breaks ties so the later trigger wins. */
    public List<VerificationRecord> findRecords(long companyId, int limit, boolean includeTombstoned) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("limit", limit);
        String tombstoneFilter = includeTombstoned ? "" : "AND tombstoned_at IS NULL";
        List<VerificationRecord> rows = jdbc.query(
            """
                SELECT %s
                FROM verification_records
                WHERE company_id = :companyId
                  %s
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """.formatted(RECORD_COLUMNS, tombstoneFilter),
            params,
            (rs, rowNum) -> mapRecord(rs, Map.of())
        );
        return withSourceResults(rows);
    }

    public VerificationRecord findLatestRecord(long companyId, boolean includeTombstoned) {
        List<VerificationRecord> rows = findRecords(companyId, 1, includeTombstoned);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Scores of the most recent COMPLETED, non-tombstoned records, newest first. */
    /** Newest first. */
    public List<ScoredRecord> findRecentCompletedScores(long companyId, int limit) {
        return jdbc.query(
            """
                SELECT id, risk_score, created_at
                FROM verification_records
                WHERE company_id = :companyId
                  AND status = 'COMPLETED'
                  AND tombstoned_at IS NULL
                  AND risk_score IS NOT NULL
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("limit", limit),
            (rs, rowNum) -> new ScoredRecord(
                rs.getLong("id"),
                rs.getInt("risk_score"),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }

    public List<VerificationStatusView> findNonTerminalCreatedBefore(Instant cutoff) {
        return jdbc.query(
            """
                SELECT id, company_id, status, risk_score, risk_category, started_at, completed_at, failure_reason
                FROM verification_records
                WHERE status IN ('PENDING', 'IN_PROGRESS')
                  AND created_at < :cutoff
                ORDER BY id
                """,
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff)),
            (rs, rowNum) -> mapStatusView(rs)
        );
    }

    private List<VerificationRecord> withSourceResults(List<VerificationRecord> records) {
        if (records.isEmpty()) {
            return records;
        }
        List<Long> ids = new ArrayList<>();
        for (VerificationRecord record : records) {
            ids.add(record.id());
        }
        Map<Long, Map<SourceCategory, SourceResult>> byRecord = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT record_id, category, outcome, source_signal, corroborating_sources, confidence,
                       fields_json, field_confidence_json, discrepancies_json, notes_json
                FROM verification_source_results
                WHERE record_id IN (:ids)
                """,
            new MapSqlParameterSource("ids", ids),
            rs -> {
                SourceResult result = mapSourceResult(rs);
                byRecord.computeIfAbsent(rs.getLong("record_id"), ignored -> new EnumMap<>(SourceCategory.class))
                    .put(result.category(), result);
            }
        );
        List<VerificationRecord> enriched = new ArrayList<>(records.size());
        for (VerificationRecord record : records) {
            Map<SourceCategory, SourceResult> results = byRecord.get(record.id());
            enriched.add(new VerificationRecord(
                record.id(),
                record.companyId(),
                record.status(),
                record.riskScore(),
                record.riskCategory(),
                record.triggerReason(),
                record.overrides(),
                record.createdAt(),
                record.startedAt(),
                record.completedAt(),
                record.failureReason(),
                results == null ? Map.of() : results,
                record.breakdown(),
                record.tombstonedAt()
            ));
        }
        return enriched;
    }

    private VerificationRecord mapRecord(ResultSet rs, Map<SourceCategory, SourceResult> sourceResults)
        throws SQLException {
        int score = rs.getInt("risk_score");
        Integer riskScore = rs.wasNull() ? null : score;
        String category = rs.getString("risk_category");
        Map<RiskFactor, RiskContribution> breakdown = readJson(rs.getString("breakdown_json"), BREAKDOWN);
        Map<String, String> overrides = readJson(rs.getString("overrides_json"), MAP_STRING);
        return new VerificationRecord(
            rs.getLong("id"),
            rs.getLong("company_id"),
            VerificationStatus.valueOf(rs.getString("status")),
            riskScore,
            category == null ? null : RiskCategory.valueOf(category),
            rs.getString("trigger_reason"),
            overrides == null ? Map.of() : overrides,
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getString("failure_reason"),
            sourceResults,
            breakdown == null ? Map.of() : new EnumMap<>(breakdown),
            toInstant(rs.getTimestamp("tombstoned_at"))
        );
    }

    private VerificationStatusView mapStatusView(ResultSet rs) throws SQLException {
        int score = rs.getInt("risk_score");
        Integer riskScore = rs.wasNull() ? null : score;
        String category = rs.getString("risk_category");
        return new VerificationStatusView(
            rs.getLong("id"),
            rs.getLong("company_id"),
            VerificationStatus.valueOf(rs.getString("status")),
            riskScore,
            category == null ? null : RiskCategory.valueOf(category),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getString("failure_reason")
        );
    }

    private SourceResult mapSourceResult(ResultSet rs) throws SQLException {
        return new SourceResult(
            SourceCategory.valueOf(rs.getString("category")),
            SourceOutcome.valueOf(rs.getString("outcome")),
            readJson(rs.getString("fields_json"), MAP_STRING),
            readJson(rs.getString("field_confidence_json"), MAP_DOUBLE),
            rs.getDouble("source_signal"),
            rs.getInt("corroborating_sources"),
            rs.getDouble("confidence"),
            readJson(rs.getString("discrepancies_json"), DISCREPANCIES),
            readJson(rs.getString("notes_json"), STRINGS)
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.warn("Unreadable JSON column value; treating as empty", e);
            return null;
        }
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable lock insert", e);
            return false;
        }
    }
}
