package com.ecvi.riskengine.verify.service;

import com.ecvi.riskengine.config.VerificationProperties;
import com.ecvi.riskengine.verify.adapter.ReportedFields;
import com.ecvi.riskengine.verify.adapter.SourceAdapter;
import com.ecvi.riskengine.verify.model.ApprovedCorrection;
import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.RiskAssessment;
import com.ecvi.riskengine.verify.model.RiskCategory;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceOutcome;
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationOrchestratorServiceTest {
    private static final long COMPANY_ID = 1L;
    private static final long RECORD_ID = 10L;

    @Mock
    private VerificationJdbcRepository repository;

    @Mock
    private CompanyJdbcRepository companyRepository;

    @Mock
    private ExecutorService runExecutor;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<Collection<SourceResult>> resultsCaptor;

    @Captor
    private ArgumentCaptor<Map<String, String>> overridesCaptor;

    private ExecutorService adapterExecutor;
    private VerificationProperties properties;

    @BeforeEach
    void setUp() {
        adapterExecutor = Executors.newFixedThreadPool(4);
        properties = new VerificationProperties();
        properties.setTimeoutSeconds(30);
        properties.setAdapterTimeoutSeconds(10);
    }

    @AfterEach
    void tearDown() {
        adapterExecutor.shutdownNow();
    }

    @Test
    void triggerCreatesPendingRecordAndSchedulesRun() {
        when(companyRepository.findCompany(COMPANY_ID)).thenReturn(company());
        when(repository.createPendingRecord(eq(COMPANY_ID), eq("onboarding"), anyMap(), any())).thenReturn(RECORD_ID);
        doReturn(new CompletableFuture<Void>()).when(runExecutor).submit(any(Runnable.class));

        VerificationTriggerResult result = service(List.of()).trigger(COMPANY_ID, Map.of("Domain", " acme.io "), " onboarding ");

        assertThat(result.recordId()).isEqualTo(RECORD_ID);
        assertThat(result.status()).isEqualTo(VerificationStatus.PENDING);
        verify(repository).createPendingRecord(eq(COMPANY_ID), eq("onboarding"), overridesCaptor.capture(), any());
        assertThat(overridesCaptor.getValue()).containsExactly(Map.entry("domain", "acme.io"));
        verify(runExecutor).submit(any(Runnable.class));
    }

    @Test
    void triggerWhileActiveIsRejected() {
        when(companyRepository.findCompany(COMPANY_ID)).thenReturn(company());
        when(repository.createPendingRecord(eq(COMPANY_ID), any(), anyMap(), any())).thenReturn(null);
        when(repository.findLockedRecordId(COMPANY_ID)).thenReturn(7L);

        assertThatThrownBy(() -> service(List.of()).trigger(COMPANY_ID, null, null))
            .isInstanceOfSatisfying(ActiveVerificationException.class, e -> {
                assertThat(e.getCompanyId()).isEqualTo(COMPANY_ID);
                assertThat(e.getActiveRecordId()).isEqualTo(7L);
            });
        verify(runExecutor, never()).submit(any(Runnable.class));
    }

    @Test
    void triggerForUnknownCompanyIsNotFound() {
        when(companyRepository.findCompany(99L)).thenReturn(null);

        assertThatThrownBy(() -> service(List.of()).trigger(99L, null, null))
            .isInstanceOfSatisfying(ResponseStatusException.class,
                e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void unknownOverrideFieldIsRejectedBeforeAnyWrite() {
        when(companyRepository.findCompany(COMPANY_ID)).thenReturn(company());

        assertThatThrownBy(() -> service(List.of()).trigger(COMPANY_ID, Map.of("ceo", "Jane"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ceo");
        verify(repository, never()).createPendingRecord(anyLong(), any(), anyMap(), any());
    }

    @Test
    void reTriggerAppliesApprovedCorrectionsInOrder() {
        when(companyRepository.findCompany(COMPANY_ID)).thenReturn(company());
        when(companyRepository.findApprovedCorrections(COMPANY_ID)).thenReturn(List.of(
            new ApprovedCorrection(COMPANY_ID, "domain", "old-acme.com", Instant.parse("2026-01-01T00:00:00Z")),
            new ApprovedCorrection(COMPANY_ID, "email", "ops@acme.io", Instant.parse("2026-01-02T00:00:00Z")),
            new ApprovedCorrection(COMPANY_ID, "domain", "acme.io", Instant.parse("2026-01-03T00:00:00Z"))
        ));
        when(repository.createPendingRecord(eq(COMPANY_ID), eq("re_trigger"), anyMap(), any())).thenReturn(RECORD_ID);
        doReturn(new CompletableFuture<Void>()).when(runExecutor).submit(any(Runnable.class));

        service(List.of()).reTrigger(COMPANY_ID, null);

        verify(repository).createPendingRecord(eq(COMPANY_ID), eq("re_trigger"), overridesCaptor.capture(), any());
        assertThat(overridesCaptor.getValue())
            .containsEntry("domain", "acme.io")
            .containsEntry("email", "ops@acme.io")
            .hasSize(2);
    }

    @Test
    void resolvingDomainWithUnverifiedRegistrationScoresMedium() {
        stubRunStart();
        when(repository.completeRecord(eq(RECORD_ID), eq(COMPANY_ID), any(), anyCollection(), any())).thenReturn(true);

        service(List.of(
            adapter(SourceCategory.DNS, CompanyField.DOMAIN, snapshot -> SourceResult.evaluated(
                SourceCategory.DNS,
                Map.of(ReportedFields.DOMAIN, "acme.com", ReportedFields.DOMAIN_MATCHES_NAME, "true"),
                Map.of(), 1.0, 2, List.of(), List.of()
            )),
            adapter(SourceCategory.REGISTRATION, CompanyField.REGISTRATION_NUMBER, snapshot -> SourceResult.evaluated(
                SourceCategory.REGISTRATION,
                Map.of(ReportedFields.REGISTRATION_NUMBER, "01234567"),
                Map.of(), 0.3, 1, List.of(), List.of("registry_unavailable: not configured")
            )),
            adapter(SourceCategory.CONTACT, CompanyField.EMAIL, snapshot -> SourceResult.evaluated(
                SourceCategory.CONTACT,
                Map.of(ReportedFields.DOMAIN, "acme.com"),
                Map.of(), 0.65, 2, List.of(), List.of()
            )),
            adapter(SourceCategory.ADDRESS, CompanyField.ADDRESS_STREET, snapshot -> {
                throw new AssertionError("address adapter must not run without address input");
            })
        )).runVerification(RECORD_ID, company());

        ArgumentCaptor<RiskAssessment> assessment = ArgumentCaptor.forClass(RiskAssessment.class);
        verify(repository).completeRecord(eq(RECORD_ID), eq(COMPANY_ID), assessment.capture(), resultsCaptor.capture(), any());
        assertThat(assessment.getValue().riskScore()).isEqualTo(37);
        assertThat(assessment.getValue().riskCategory()).isEqualTo(RiskCategory.MEDIUM);

        Map<SourceCategory, SourceResult> stored = byCategory(resultsCaptor.getValue());
        assertThat(stored).containsOnlyKeys(SourceCategory.values());
        assertThat(stored.get(SourceCategory.ADDRESS).outcome()).isEqualTo(SourceOutcome.NOT_EVALUATED);
        assertThat(stored.get(SourceCategory.DNS).confidence()).isEqualTo(0.9);

        ArgumentCaptor<VerificationStatusChangedEvent> events = ArgumentCaptor.forClass(VerificationStatusChangedEvent.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        assertThat(events.getAllValues())
            .extracting(VerificationStatusChangedEvent::newStatus)
            .containsExactly(VerificationStatus.IN_PROGRESS, VerificationStatus.COMPLETED);
        verify(repository, never()).failRecord(anyLong(), anyLong(), anyString(), anyCollection(), any());
    }

    @Test
    void unresolvableDomainWithoutRegistrationScoresHigh() {
        stubRunStart();
        when(repository.completeRecord(eq(RECORD_ID), eq(COMPANY_ID), any(), anyCollection(), any())).thenReturn(true);
        CompanySnapshot snapshot = new CompanySnapshot(
            COMPANY_ID, "Acme Widgets Ltd", null, null, "acme-nonexistent.com", "not-an-email",
            null, null, null, null, null, null
        );

        service(List.of(
            adapter(SourceCategory.DNS, CompanyField.DOMAIN, s -> SourceResult.evaluated(
                SourceCategory.DNS,
                Map.of(ReportedFields.DOMAIN, "acme-nonexistent.com", ReportedFields.DOMAIN_MATCHES_NAME, "true"),
                Map.of(), 0.0, 0, List.of(), List.of("domain_unresolvable")
            )),
            adapter(SourceCategory.REGISTRATION, CompanyField.REGISTRATION_NUMBER, s -> {
                throw new AssertionError("registration adapter must not run without a number");
            }),
            adapter(SourceCategory.CONTACT, CompanyField.EMAIL, s -> SourceResult.evaluated(
                SourceCategory.CONTACT, Map.of(), Map.of(), 0.0, 0, List.of(), List.of("invalid_email_format")
            ))
        )).runVerification(RECORD_ID, snapshot);

        ArgumentCaptor<RiskAssessment> assessment = ArgumentCaptor.forClass(RiskAssessment.class);
        verify(repository).completeRecord(eq(RECORD_ID), eq(COMPANY_ID), assessment.capture(), resultsCaptor.capture(), any());
        assertThat(assessment.getValue().riskScore()).isEqualTo(85);
        assertThat(assessment.getValue().riskCategory()).isEqualTo(RiskCategory.HIGH);
        assertThat(byCategory(resultsCaptor.getValue()).get(SourceCategory.REGISTRATION).outcome())
            .isEqualTo(SourceOutcome.NOT_EVALUATED);
    }

    @Test
    void noEvidenceFailsTheRecord() {
        stubRunStart();
        when(repository.failRecord(eq(RECORD_ID), eq(COMPANY_ID), startsWith("no_evidence"), anyCollection(), any()))
            .thenReturn(true);
        CompanySnapshot nameOnly = new CompanySnapshot(
            COMPANY_ID, "Acme Widgets Ltd", null, null, null, null, null, null, null, null, null, null
        );

        service(List.of(
            adapter(SourceCategory.DNS, CompanyField.DOMAIN, s -> SourceResult.unavailable(SourceCategory.DNS, "x")),
            adapter(SourceCategory.CONTACT, CompanyField.EMAIL, s -> SourceResult.unavailable(SourceCategory.CONTACT, "x"))
        )).runVerification(RECORD_ID, nameOnly);

        verify(repository).failRecord(
            eq(RECORD_ID),
            eq(COMPANY_ID),
            eq("no_evidence: dns=not_evaluated,registration=not_evaluated,contact=not_evaluated,address=not_evaluated"),
            anyCollection(),
            any()
        );
        verify(repository, never()).completeRecord(anyLong(), anyLong(), any(), anyCollection(), any());
    }

    @Test
    void hungAdapterTimesOutAndRunStillCompletes() throws Exception {
        properties.setTimeoutSeconds(30);
        properties.setAdapterTimeoutSeconds(1);
        stubRunStart();
        when(repository.completeRecord(eq(RECORD_ID), eq(COMPANY_ID), any(), anyCollection(), any())).thenReturn(true);
        CountDownLatch interrupted = new CountDownLatch(1);
        SourceAdapter hung = adapter(SourceCategory.REGISTRATION, CompanyField.REGISTRATION_NUMBER, s -> {
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return SourceResult.evaluated(SourceCategory.REGISTRATION, Map.of(), Map.of(), 1.0, 2, List.of(), List.of());
        });
        SourceAdapter dns = adapter(SourceCategory.DNS, CompanyField.DOMAIN, s -> SourceResult.evaluated(
            SourceCategory.DNS, Map.of(ReportedFields.DOMAIN, "acme.com"), Map.of(), 1.0, 2, List.of(), List.of()
        ));

        service(List.of(dns, hung)).runVerification(RECORD_ID, company());

        verify(repository).completeRecord(eq(RECORD_ID), eq(COMPANY_ID), any(), resultsCaptor.capture(), any());
        Map<SourceCategory, SourceResult> stored = byCategory(resultsCaptor.getValue());
        assertThat(stored.get(SourceCategory.REGISTRATION).outcome()).isEqualTo(SourceOutcome.TIMED_OUT);
        assertThat(stored.get(SourceCategory.REGISTRATION).notes()).containsExactly("adapter_timeout");
        assertThat(stored.get(SourceCategory.REGISTRATION).confidence()).isZero();
        assertThat(stored.get(SourceCategory.DNS).outcome()).isEqualTo(SourceOutcome.EVALUATED);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void overallDeadlineTimesOutWhenAdapterBudgetsAreDisabled() throws Exception {
        properties.setTimeoutSeconds(1);
        properties.setAdapterTimeoutSeconds(0);
        SourceAdapter hung = adapter(SourceCategory.DNS, CompanyField.DOMAIN, s -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return SourceResult.notEvaluated(SourceCategory.DNS);
        });

        Instant startedAt = Instant.now();
        Map<SourceCategory, SourceResult> results = service(List.of(hung))
            .dispatchAdapters(RECORD_ID, company(), startedAt, startedAt.plus(properties.timeout()));

        assertThat(results.get(SourceCategory.DNS).outcome()).isEqualTo(SourceOutcome.TIMED_OUT);
        assertThat(results.get(SourceCategory.DNS).notes()).containsExactly("orchestration_timeout");
    }

    @Test
    void throwingAdapterIsRecordedAsUnavailable() throws Exception {
        SourceAdapter broken = adapter(SourceCategory.CONTACT, CompanyField.EMAIL, s -> {
            throw new IllegalStateException("boom");
        });

        Instant startedAt = Instant.now();
        Map<SourceCategory, SourceResult> results = service(List.of(broken))
            .dispatchAdapters(RECORD_ID, company(), startedAt, startedAt.plusSeconds(30));

        assertThat(results.get(SourceCategory.CONTACT).outcome()).isEqualTo(SourceOutcome.UNAVAILABLE);
        assertThat(results.get(SourceCategory.CONTACT).notes()).containsExactly("adapter_error=IllegalStateException");
        assertThat(results.get(SourceCategory.DNS).outcome()).isEqualTo(SourceOutcome.NOT_EVALUATED);
    }

    @Test
    void runIsSkippedWhenRecordIsNoLongerPending() {
        when(repository.markInProgress(eq(RECORD_ID), any())).thenReturn(false);

        service(List.of(adapter(SourceCategory.DNS, CompanyField.DOMAIN, s -> {
            throw new AssertionError("adapters must not run");
        }))).runVerification(RECORD_ID, company());

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        verify(repository, never()).completeRecord(anyLong(), anyLong(), any(), anyCollection(), any());
    }

    @Test
    void resultComputedAfterCancellationIsDiscarded() {
        stubRunStart();
        when(repository.completeRecord(eq(RECORD_ID), eq(COMPANY_ID), any(), anyCollection(), any())).thenReturn(false);

        service(List.of(adapter(SourceCategory.DNS, CompanyField.DOMAIN, s -> SourceResult.evaluated(
            SourceCategory.DNS, Map.of(), Map.of(), 1.0, 2, List.of(), List.of()
        )))).runVerification(RECORD_ID, company());

        ArgumentCaptor<VerificationStatusChangedEvent> events = ArgumentCaptor.forClass(VerificationStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(events.capture());
        assertThat(events.getValue().newStatus()).isEqualTo(VerificationStatus.IN_PROGRESS);
    }

    @Test
    void cancelFailsActiveRecordAndInterruptsRun() {
        CompletableFuture<Void> run = new CompletableFuture<>();
        when(companyRepository.findCompany(COMPANY_ID)).thenReturn(company());
        when(repository.createPendingRecord(eq(COMPANY_ID), any(), anyMap(), any())).thenReturn(RECORD_ID);
        doReturn(run).when(runExecutor).submit(any(Runnable.class));
        when(repository.findStatusView(RECORD_ID)).thenReturn(
            view(VerificationStatus.IN_PROGRESS, null),
            view(VerificationStatus.FAILED, "cancelled: operator")
        );
        when(repository.failRecord(eq(RECORD_ID), eq(COMPANY_ID), eq("cancelled: operator"), anyCollection(), any()))
            .thenReturn(true);

        VerificationOrchestratorService service = service(List.of());
        service.trigger(COMPANY_ID, null, null);
        VerificationStatusView cancelled = service.cancel(RECORD_ID, "operator");

        assertThat(cancelled.status()).isEqualTo(VerificationStatus.FAILED);
        assertThat(cancelled.failureReason()).isEqualTo("cancelled: operator");
        assertThat(run.isCancelled()).isTrue();
        ArgumentCaptor<VerificationStatusChangedEvent> events = ArgumentCaptor.forClass(VerificationStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(events.capture());
        assertThat(events.getValue().oldStatus()).isEqualTo(VerificationStatus.IN_PROGRESS);
        assertThat(events.getValue().newStatus()).isEqualTo(VerificationStatus.FAILED);
    }

    @Test
    void cancellingTerminalRecordChangesNothing() {
        VerificationStatusView completed = view(VerificationStatus.COMPLETED, null);
        when(repository.findStatusView(RECORD_ID)).thenReturn(completed);

        assertThat(service(List.of()).cancel(RECORD_ID, null)).isEqualTo(completed);
        verify(repository, never()).failRecord(anyLong(), anyLong(), anyString(), anyCollection(), any());
    }

    private void stubRunStart() {
        when(repository.markInProgress(eq(RECORD_ID), any())).thenReturn(true);
    }

    private VerificationOrchestratorService service(List<SourceAdapter> adapters) {
        return new VerificationOrchestratorService(
            repository,
            companyRepository,
            adapters,
            new DiscrepancyDetector(),
            new ConfidenceScorer(),
            new RiskCalculator(),
            adapterExecutor,
            runExecutor,
            properties,
            eventPublisher
        );
    }

    private static SourceAdapter adapter(
        SourceCategory category,
        CompanyField input,
        Function<CompanySnapshot, SourceResult> body
    ) {
        return new SourceAdapter() {
            @Override
            public SourceCategory category() {
                return category;
            }

            @Override
            public Set<CompanyField> inputFields() {
                return Set.of(input);
            }

            @Override
            public SourceResult evaluate(CompanySnapshot snapshot, Instant deadline) {
                return body.apply(snapshot);
            }
        };
    }

    private static CompanySnapshot company() {
        return new CompanySnapshot(
            COMPANY_ID, "Acme Widgets Ltd", "01234567", "gb", "acme.com", "info@acme.com",
            null, null, null, null, null, null
        );
    }

    private static VerificationStatusView view(VerificationStatus status, String failureReason) {
        return new VerificationStatusView(RECORD_ID, COMPANY_ID, status, null, null, Instant.now(), null, failureReason);
    }

    private static Map<SourceCategory, SourceResult> byCategory(Collection<SourceResult> results) {
        Map<SourceCategory, SourceResult> map = new EnumMap<>(SourceCategory.class);
        for (SourceResult result : results) {
            map.put(result.category(), result);
        }
        return map;
    }
}
