package com.ecvi.riskengine.verify.service;

import com.ecvi.riskengine.config.VerificationProperties;
import com.ecvi.riskengine.verify.adapter.SourceAdapter;
import com.ecvi.riskengine.verify.model.ApprovedCorrection;
import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.ConfidenceSummary;
import com.ecvi.riskengine.verify.model.RiskAssessment;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;
import com.ecvi.riskengine.verify.model.VerificationStatus;
import com.ecvi.riskengine.verify.model.VerificationStatusChangedEvent;
import com.ecvi.riskengine.verify.model.VerificationStatusView;
import com.ecvi.riskengine.verify.model.VerificationTriggerResult;
import com.ecvi.riskengine.verify.persistence.CompanyJdbcRepository;
import com.ecvi.riskengine.verify.persistence.VerificationJdbcRepository;
import com.ecvi.riskengine.verify.scoring.ConfidenceScorer;
import com.ecvi.riskengine.verify.scoring.DiscrepancyDetector;
import com.ecvi.riskengine.verify.scoring.RiskCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

/**
 * Drives one verification record from PENDING to a terminal state. Triggers return as soon as the
 * record exists; the run itself happens on the {@code verificationRunExecutor}, with the adapters
 * fanned out on the bounded {@code adapterExecutor}.
 */
@Service
public class VerificationOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestratorService.class);

    static final String RE_TRIGGER_REASON = "re_trigger";

    private final VerificationJdbcRepository repository;
    private final CompanyJdbcRepository companyRepository;
    private final List<SourceAdapter> adapters;
    private final DiscrepancyDetector discrepancyDetector;
    private final ConfidenceScorer confidenceScorer;
    private final RiskCalculator riskCalculator;
    private final ExecutorService adapterExecutor;
    private final ExecutorService verificationRunExecutor;
    private final VerificationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<Long, Future<?>> activeRuns = new ConcurrentHashMap<>();

    public VerificationOrchestratorService(
        VerificationJdbcRepository repository,
        CompanyJdbcRepository companyRepository,
        List<SourceAdapter> adapters,
        DiscrepancyDetector discrepancyDetector,
        ConfidenceScorer confidenceScorer,
        RiskCalculator riskCalculator,
        @Qualifier("adapterExecutor") ExecutorService adapterExecutor,
        @Qualifier("verificationRunExecutor") ExecutorService verificationRunExecutor,
        VerificationProperties properties,
        ApplicationEventPublisher eventPublisher
    ) {
        this.repository = repository;
        this.companyRepository = companyRepository;
        this.adapters = List.copyOf(adapters);
        this.discrepancyDetector = discrepancyDetector;
        this.confidenceScorer = confidenceScorer;
        this.riskCalculator = riskCalculator;
        this.adapterExecutor = adapterExecutor;
        this.verificationRunExecutor = verificationRunExecutor;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Creates a PENDING record for the company and schedules its run.
     *
     * @param overrides field values (keyed by {@link CompanyField} key) replacing the stored ones
     * @throws ActiveVerificationException when the company already has a non-terminal record
     */
    public VerificationTriggerResult trigger(long companyId, Map<String, String> overrides, String reason) {
        CompanySnapshot company = companyRepository.findCompany(companyId);
        if (company == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown company: " + companyId);
        }
        Map<String, String> normalizedOverrides = normalizeOverrides(overrides);
        CompanySnapshot snapshot = company.withOverrides(normalizedOverrides);
        String triggerReason = reason == null || reason.isBlank() ? null : reason.trim();

        Long recordId = repository.createPendingRecord(companyId, triggerReason, normalizedOverrides, Instant.now());
        if (recordId == null) {
            Long activeRecordId = repository.findLockedRecordId(companyId);
            throw new ActiveVerificationException(
                companyId,
                activeRecordId,
                "Company " + companyId + " already has an active verification"
                    + (activeRecordId == null ? "" : " (record " + activeRecordId + ")")
            );
        }
        log.info("Verification {} created for company {} reason={}", recordId, companyId, triggerReason);

        try {
            Future<?> future = verificationRunExecutor.submit(() -> runVerification(recordId, snapshot));
            activeRuns.put(recordId, future);
            if (future.isDone()) {
                activeRuns.remove(recordId, future);
            }
        } catch (RejectedExecutionException e) {
            log.warn("Verification {} could not be scheduled", recordId, e);
            finalizeFailed(recordId, companyId, VerificationStatus.PENDING, "exception=" + e.getClass().getSimpleName(), List.of());
            throw e;
        }
        return new VerificationTriggerResult(recordId, companyId, VerificationStatus.PENDING);
    }

    /**
     * Triggers again from the current company data with every approved correction applied in
     * approval order. Earlier records are left untouched.
     */
    public VerificationTriggerResult reTrigger(long companyId, String reason) {
        Map<String, String> corrections = new LinkedHashMap<>();
        for (ApprovedCorrection correction : companyRepository.findApprovedCorrections(companyId)) {
            corrections.put(correction.field(), correction.newValue() == null ? "" : correction.newValue());
        }
        String triggerReason = reason == null || reason.isBlank() ? RE_TRIGGER_REASON : reason;
        return trigger(companyId, corrections, triggerReason);
    }

    /**
     * Marks a non-terminal record FAILED and interrupts its run. Returns the resulting status; a
     * record that was already terminal is returned unchanged.
     */
    public VerificationStatusView cancel(long recordId, String reason) {
        VerificationStatusView view = repository.findStatusView(recordId);
        if (view == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown verification record: " + recordId);
        }
        if (view.status().isTerminal()) {
            return view;
        }
        String failureReason = reason == null || reason.isBlank() ? "cancelled" : "cancelled: " + reason.trim();
        finalizeFailed(recordId, view.companyId(), view.status(), failureReason, List.of());
        Future<?> run = activeRuns.remove(recordId);
        if (run != null) {
            run.cancel(true);
        }
        return repository.findStatusView(recordId);
    }

    void runVerification(long recordId, CompanySnapshot snapshot) {
        long companyId = snapshot.companyId();
        Map<SourceCategory, SourceResult> results = Map.of();
        try {
            Instant startedAt = Instant.now();
            if (!repository.markInProgress(recordId, startedAt)) {
                log.info("Verification {} is no longer PENDING; skipping run", recordId);
                return;
            }
            publish(companyId, recordId, VerificationStatus.PENDING, VerificationStatus.IN_PROGRESS);

            Instant deadline = startedAt.plus(properties.timeout());
            results = dispatchAdapters(recordId, snapshot, startedAt, deadline);

            if (results.values().stream().noneMatch(SourceResult::hasEvidence)) {
                log.warn("Verification {} for company {} produced no evidence", recordId, companyId);
                finalizeFailed(recordId, companyId, VerificationStatus.IN_PROGRESS, "no_evidence: " + describeOutcomes(results), results.values());
                return;
            }

            Map<SourceCategory, SourceResult> checked = discrepancyDetector.detect(results);
            Map<SourceCategory, SourceResult> scored = confidenceScorer.assignConfidence(checked);
            ConfidenceSummary summary = confidenceScorer.summarize(scored);
            RiskAssessment assessment = riskCalculator.score(summary);
            results = scored;

            if (repository.completeRecord(recordId, companyId, assessment, scored.values(), Instant.now())) {
                log.info(
                    "Verification {} for company {} completed: score={} category={} outcomes={}",
                    recordId,
                    companyId,
                    assessment.riskScore(),
                    assessment.riskCategory(),
                    describeOutcomes(scored)
                );
                publish(companyId, recordId, VerificationStatus.IN_PROGRESS, VerificationStatus.COMPLETED);
            } else {
                log.info("Verification {} was finalized elsewhere; discarding computed result", recordId);
            }
        } catch (InterruptedException e) {
            log.info("Verification {} interrupted", recordId);
            finalizeFailed(recordId, companyId, VerificationStatus.IN_PROGRESS, "interrupted", results.values());
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Verification {} for company {} failed", recordId, companyId, e);
            finalizeFailed(recordId, companyId, VerificationStatus.IN_PROGRESS, "exception=" + e.getClass().getSimpleName(), results.values());
        } finally {
            activeRuns.remove(recordId);
        }
    }

    /**
     * Runs every applicable adapter concurrently and waits for each until its own deadline.
     * Adapters still running at their deadline are cancelled and recorded as TIMED_OUT.
     */
    Map<SourceCategory, SourceResult> dispatchAdapters(
        long recordId,
        CompanySnapshot snapshot,
        Instant startedAt,
        Instant deadline
    ) throws InterruptedException {
        Map<SourceCategory, SourceResult> results = new EnumMap<>(SourceCategory.class);
        Map<SourceCategory, Future<SourceResult>> futures = new EnumMap<>(SourceCategory.class);
        Map<SourceCategory, Instant> adapterDeadlines = new EnumMap<>(SourceCategory.class);
        Duration adapterTimeout = properties.adapterTimeout();

        for (SourceAdapter adapter : adapters) {
            SourceCategory category = adapter.category();
            if (!adapter.isApplicable(snapshot)) {
                results.put(category, SourceResult.notEvaluated(category));
                continue;
            }
            Instant adapterDeadline = deadline;
            if (adapterTimeout != null && startedAt.plus(adapterTimeout).isBefore(deadline)) {
                adapterDeadline = startedAt.plus(adapterTimeout);
            }
            Instant effectiveDeadline = adapterDeadline;
            adapterDeadlines.put(category, effectiveDeadline);
            futures.put(category, adapterExecutor.submit(() -> adapter.evaluate(snapshot, effectiveDeadline)));
        }

        try {
            for (Map.Entry<SourceCategory, Future<SourceResult>> entry : futures.entrySet()) {
                SourceCategory category = entry.getKey();
                Future<SourceResult> future = entry.getValue();
                Instant adapterDeadline = adapterDeadlines.get(category);
                long waitMs = Math.max(0, Duration.between(Instant.now(), adapterDeadline).toMillis());
                try {
                    SourceResult result = future.get(waitMs, TimeUnit.MILLISECONDS);
                    results.put(category, result == null ? SourceResult.unavailable(category, "adapter_returned_nothing") : result);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    String note = adapterDeadline.equals(deadline) ? "orchestration_timeout" : "adapter_timeout";
                    log.warn("Verification {} {} adapter timed out ({})", recordId, category, note);
                    results.put(category, SourceResult.timedOut(category, note));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("Verification {} {} adapter failed", recordId, category, cause);
                    results.put(category, SourceResult.unavailable(category, "adapter_error=" + cause.getClass().getSimpleName()));
                }
            }
        } finally {
            for (Future<SourceResult> future : futures.values()) {
                if (!future.isDone()) {
                    future.cancel(true);
                }
            }
        }

        for (SourceCategory category : SourceCategory.values()) {
            results.putIfAbsent(category, SourceResult.notEvaluated(category));
        }
        return results;
    }

    private void finalizeFailed(
        long recordId,
        long companyId,
        VerificationStatus fromStatus,
        String failureReason,
        Collection<SourceResult> results
    ) {
        if (repository.failRecord(recordId, companyId, failureReason, results, Instant.now())) {
            log.info("Verification {} for company {} failed: {}", recordId, companyId, failureReason);
            publish(companyId, recordId, fromStatus, VerificationStatus.FAILED);
        }
    }

    private void publish(long companyId, long recordId, VerificationStatus from, VerificationStatus to) {
        eventPublisher.publishEvent(new VerificationStatusChangedEvent(companyId, recordId, from, to));
    }

    private Map<String, String> normalizeOverrides(Map<String, String> overrides) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (overrides == null) {
            return normalized;
        }
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            CompanyField field = CompanyField.fromKey(entry.getKey());
            String value = entry.getValue() == null ? "" : entry.getValue().trim();
            normalized.put(field.key(), value);
        }
        return normalized;
    }

    private String describeOutcomes(Map<SourceCategory, SourceResult> results) {
        List<String> parts = new ArrayList<>();
        for (SourceCategory category : SourceCategory.values()) {
            SourceResult result = results.get(category);
            String outcome = result == null ? "not_evaluated" : result.outcome().name();
            parts.add(category.name().toLowerCase(Locale.ROOT) + "=" + outcome.toLowerCase(Locale.ROOT));
        }
        return String.join(",", parts);
    }
}
