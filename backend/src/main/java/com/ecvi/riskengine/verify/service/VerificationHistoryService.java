package com.ecvi.riskengine.verify.service;

import com.ecvi.riskengine.config.VerificationProperties;
import com.ecvi.riskengine.verify.model.RiskScoreChange;
import com.ecvi.riskengine.verify.model.RiskTrend;
import com.ecvi.riskengine.verify.model.ScoredRecord;
import com.ecvi.riskengine.verify.model.VerificationRecord;
import com.ecvi.riskengine.verify.persistence.CompanyJdbcRepository;
import com.ecvi.riskengine.verify.persistence.VerificationJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.springframework.http.HttpStatus.NOT_FOUND;

/**
 * Read side of the append-only verification history. The only write is the tombstone flag.
 */
@Service
public class VerificationHistoryService {
    private static final Logger log = LoggerFactory.getLogger(VerificationHistoryService.class);

    static final double TREND_THRESHOLD = 0.5;
    public static final String TREND_IMPROVING = "improving";
    public static final String TREND_WORSENING = "worsening";
    public static final String TREND_STABLE = "stable";
    public static final String TREND_INSUFFICIENT = "insufficient_data";

    private final VerificationJdbcRepository repository;
    private final CompanyJdbcRepository companyRepository;
    private final VerificationProperties properties;

    public VerificationHistoryService(
        VerificationJdbcRepository repository,
        CompanyJdbcRepository companyRepository,
        VerificationProperties properties
    ) {
        this.repository = repository;
        this.companyRepository = companyRepository;
        this.properties = properties;
    }

    /** The current record: the most recently created one, whatever its status. */
    public VerificationRecord latest(long companyId, boolean includeTombstoned) {
        requireCompany(companyId);
        VerificationRecord record = repository.findLatestRecord(companyId, includeTombstoned);
        if (record == null) {
            throw new ResponseStatusException(NOT_FOUND, "No verification records for company " + companyId);
        }
        return record;
    }

    public List<VerificationRecord> list(long companyId, Integer limit, boolean includeTombstoned) {
        requireCompany(companyId);
        VerificationProperties.History history = properties.getHistory();
        int safeLimit = limit == null ? history.getDefaultLimit() : Math.max(1, Math.min(limit, history.getMaxLimit()));
        return repository.findRecords(companyId, safeLimit, includeTombstoned);
    }

    /**
     * Least-squares slope of risk_score across the last N completed records, oldest first,
     * with min/max/latest and the step-by-step changes. Negative slope means risk is going down.
     */
    public RiskTrend trend(long companyId) {
        requireCompany(companyId);
        List<ScoredRecord> samples = new ArrayList<>(
            repository.findRecentCompletedScores(companyId, properties.getHistory().getTrendWindow())
        );
        Collections.reverse(samples);
        int n = samples.size();
        if (n == 0) {
            return new RiskTrend(companyId, 0, null, TREND_INSUFFICIENT, null, null, null, null, List.of());
        }
        double sum = 0.0;
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (ScoredRecord sample : samples) {
            sum += sample.riskScore();
            min = Math.min(min, sample.riskScore());
            max = Math.max(max, sample.riskScore());
        }
        double average = sum / n;
        int latestScore = samples.get(n - 1).riskScore();
        List<RiskScoreChange> changes = scoreChanges(samples);
        if (n < 2) {
            return new RiskTrend(companyId, n, null, TREND_INSUFFICIENT, latestScore, average, min, max, changes);
        }
        double meanX = (n - 1) / 2.0;
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            numerator += dx * (samples.get(i).riskScore() - average);
            denominator += dx * dx;
        }
        double slope = numerator / denominator;
        String direction;
        if (slope < -TREND_THRESHOLD) {
            direction = TREND_IMPROVING;
        } else if (slope > TREND_THRESHOLD) {
            direction = TREND_WORSENING;
        } else {
            direction = TREND_STABLE;
        }
        return new RiskTrend(companyId, n, slope, direction, latestScore, average, min, max, changes);
    }

    private static List<RiskScoreChange> scoreChanges(List<ScoredRecord> oldestFirst) {
        List<RiskScoreChange> changes = new ArrayList<>();
        for (int i = 1; i < oldestFirst.size(); i++) {
            ScoredRecord from = oldestFirst.get(i - 1);
            ScoredRecord to = oldestFirst.get(i);
            int change = to.riskScore() - from.riskScore();
            double percentage = from.riskScore() > 0
                ? Math.round(change * 10_000.0 / from.riskScore()) / 100.0
                : 0.0;
            changes.add(new RiskScoreChange(
                from.recordId(),
                to.recordId(),
                from.riskScore(),
                to.riskScore(),
                change,
                percentage,
                to.createdAt()
            ));
        }
        return changes;
    }

    /**
     * Hides a terminal record from default history views. Nothing is removed; repeated calls are no-ops.
     *
     * @throws ActiveVerificationException when the record is still PENDING or IN_PROGRESS
     */
    public VerificationRecord tombstone(long recordId) {
        VerificationRecord record = repository.findRecord(recordId);
        if (record == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown verification record: " + recordId);
        }
        if (!record.status().isTerminal()) {
            throw new ActiveVerificationException(
                record.companyId(),
                record.id(),
                "Verification record " + recordId + " is still " + record.status()
            );
        }
        if (repository.tombstone(recordId, Instant.now())) {
            log.info("Tombstoned verification {} for company {}", recordId, record.companyId());
        }
        return repository.findRecord(recordId);
    }

    private void requireCompany(long companyId) {
        if (companyRepository.findCompany(companyId) == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown company: " + companyId);
        }
    }
}
