package com.ecvi.riskengine.verify.persistence;

import com.ecvi.riskengine.verify.adapter.ReportedFields;
import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.Discrepancy;
import com.ecvi.riskengine.verify.model.DiscrepancySeverity;
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
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class VerificationJdbcRepositoryTest {

    @Autowired
    private VerificationJdbcRepository repository;

    @Autowired
    private CompanyJdbcRepository companyRepository;

    @Test
    void secondPendingRecordIsRefusedWhileLockIsHeld() {
        long companyId = insertCompany();
        Instant now = Instant.now();

        Long first = repository.createPendingRecord(companyId, "manual", Map.of(), now);
        Long second = repository.createPendingRecord(companyId, "manual", Map.of(), now.plusSeconds(1));

        assertThat(first).isNotNull();
        assertThat(second).isNull();
        assertThat(repository.findLockedRecordId(companyId)).isEqualTo(first);
        assertThat(repository.findStatusView(first).status()).isEqualTo(VerificationStatus.PENDING);
    }

    @Test
    void completingStoresScoreAndSourceResultsAndReleasesLock() {
        long companyId = insertCompany();
        Instant createdAt = Instant.parse("2026-03-01T10:00:00Z");
        long recordId = repository.createPendingRecord(companyId, "onboarding", Map.of("domain", "acme.io"), createdAt);

        assertThat(repository.markInProgress(recordId, createdAt.plusSeconds(1))).isTrue();
        assertThat(repository.markInProgress(recordId, createdAt.plusSeconds(2))).isFalse();

        SourceResult dns = SourceResult.evaluated(
            SourceCategory.DNS,
            Map.of(ReportedFields.DOMAIN, "acme.io"),
            Map.of(ReportedFields.DOMAIN, 1.0),
            1.0,
            2,
            List.of(),
            List.of()
        ).withConfidence(0.9);
        SourceResult contact = SourceResult.evaluated(
            SourceCategory.CONTACT,
            Map.of(ReportedFields.DOMAIN, "gmail.com"),
            Map.of(),
            0.7,
            2,
            List.of(new Discrepancy("domain", "acme.io", "gmail.com", "contact", DiscrepancySeverity.HIGH)),
            List.of("email_host_no_mx")
        ).withConfidence(0.38);
        boolean completed = repository.completeRecord(
            recordId,
            companyId,
            assessment(55, RiskCategory.MEDIUM),
            List.of(dns, contact, SourceResult.notEvaluated(SourceCategory.REGISTRATION)),
            createdAt.plusSeconds(5)
        );

        assertThat(completed).isTrue();
        assertThat(repository.findLockedRecordId(companyId)).isNull();

        VerificationRecord record = repository.findRecord(recordId);
        assertThat(record.status()).isEqualTo(VerificationStatus.COMPLETED);
        assertThat(record.riskScore()).isEqualTo(55);
        assertThat(record.riskCategory()).isEqualTo(RiskCategory.MEDIUM);
        assertThat(record.triggerReason()).isEqualTo("onboarding");
        assertThat(record.overrides()).containsEntry("domain", "acme.io");
        assertThat(record.createdAt()).isEqualTo(createdAt);
        assertThat(record.breakdown()).containsOnlyKeys(RiskFactor.values());
        assertThat(record.sourceResults()).containsOnlyKeys(
            SourceCategory.DNS, SourceCategory.CONTACT, SourceCategory.REGISTRATION
        );
        SourceResult storedContact = record.sourceResults().get(SourceCategory.CONTACT);
        assertThat(storedContact.confidence()).isEqualTo(0.38);
        assertThat(storedContact.discrepancies()).hasSize(1);
        assertThat(storedContact.discrepancies().get(0).severity()).isEqualTo(DiscrepancySeverity.HIGH);
        assertThat(storedContact.notes()).containsExactly("email_host_no_mx");
        assertThat(record.sourceResults().get(SourceCategory.REGISTRATION).outcome())
            .isEqualTo(SourceOutcome.NOT_EVALUATED);

        Long next = repository.createPendingRecord(companyId, "re_trigger", Map.of(), createdAt.plusSeconds(60));
        assertThat(next).isNotNull();
    }

    @Test
    void terminalRecordsCannotBeReopened() {
        long companyId = insertCompany();
        long recordId = repository.createPendingRecord(companyId, null, null, Instant.now());

        assertThat(repository.completeRecord(recordId, companyId, assessment(10, RiskCategory.LOW), List.of(), Instant.now()))
            .as("PENDING cannot jump to COMPLETED")
            .isFalse();
        assertThat(repository.failRecord(recordId, companyId, "cancelled", List.of(), Instant.now())).isTrue();
        assertThat(repository.failRecord(recordId, companyId, "again", List.of(), Instant.now())).isFalse();
        assertThat(repository.markInProgress(recordId, Instant.now())).isFalse();

        VerificationStatusView view = repository.findStatusView(recordId);
        assertThat(view.status()).isEqualTo(VerificationStatus.FAILED);
        assertThat(view.failureReason()).isEqualTo("cancelled");
        assertThat(view.riskScore()).isNull();
        assertThat(repository.findLockedRecordId(companyId)).isNull();
    }

    @Test
    void historyIsNewestFirstAndTombstonesAreHiddenByDefault() {
        long companyId = insertCompany();
        Instant base = Instant.parse("2026-02-01T00:00:00Z");
        long first = completedRecord(companyId, base, 80);
        long second = completedRecord(companyId, base.plusSeconds(3600), 50);
        long third = completedRecord(companyId, base.plusSeconds(7200), 20);

        assertThat(repository.findRecords(companyId, 10, false))
            .extracting(VerificationRecord::id)
            .containsExactly(third, second, first);
        assertThat(repository.findRecentCompletedScores(companyId, 2))
            .extracting(ScoredRecord::recordId, ScoredRecord::riskScore)
            .containsExactly(tuple(third, 20), tuple(second, 50));

        assertThat(repository.tombstone(third, Instant.now())).isTrue();
        assertThat(repository.tombstone(third, Instant.now())).isFalse();

        assertThat(repository.findRecords(companyId, 10, false))
            .extracting(VerificationRecord::id)
            .containsExactly(second, first);
        assertThat(repository.findRecords(companyId, 10, true)).hasSize(3);
        assertThat(repository.findLatestRecord(companyId, false).id()).isEqualTo(second);
        assertThat(repository.findLatestRecord(companyId, true).isTombstoned()).isTrue();
        assertThat(repository.findRecentCompletedScores(companyId, 10))
            .extracting(ScoredRecord::riskScore)
            .containsExactly(50, 80);
        assertThat(repository.findRecord(third).riskScore()).isEqualTo(20);
    }

    @Test
    void approvedCorrectionsComeBackInApprovalOrder() {
        long companyId = insertCompany();
        companyRepository.insertApprovedCorrection(companyId, CompanyField.DOMAIN, "acme.io", Instant.parse("2026-01-02T00:00:00Z"));
        companyRepository.insertApprovedCorrection(companyId, CompanyField.EMAIL, "ops@acme.io", Instant.parse("2026-01-01T00:00:00Z"));

        assertThat(companyRepository.findApprovedCorrections(companyId))
            .extracting(correction -> correction.field())
            .containsExactly("email", "domain");
    }

    private long completedRecord(long companyId, Instant createdAt, int score) {
        long recordId = repository.createPendingRecord(companyId, null, null, createdAt);
        repository.markInProgress(recordId, createdAt.plusSeconds(1));
        repository.completeRecord(recordId, companyId, assessment(score, RiskCategory.fromScore(score)), List.of(), createdAt.plusSeconds(2));
        return recordId;
    }

    private long insertCompany() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return companyRepository.insertCompany(new CompanySnapshot(
            0L, "Acme " + suffix + " Ltd", "01234567", "gb", "acme.com", "info@acme.com",
            null, null, null, null, null, null
        ));
    }

    private static RiskAssessment assessment(int score, RiskCategory category) {
        Map<RiskFactor, RiskContribution> breakdown = new EnumMap<>(RiskFactor.class);
        for (RiskFactor factor : RiskFactor.values()) {
            breakdown.put(factor, new RiskContribution(factor.weight(), 0.5, factor.weightPercent() * 0.5));
        }
        return new RiskAssessment(score, category, breakdown);
    }
}
