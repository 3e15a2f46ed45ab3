package com.ecvi.riskengine.verify.service;

import com.ecvi.riskengine.config.VerificationProperties;
import com.ecvi.riskengine.verify.model.VerificationStatus;
import com.ecvi.riskengine.verify.model.VerificationStatusChangedEvent;
import com.ecvi.riskengine.verify.model.VerificationStatusView;
import com.ecvi.riskengine.verify.persistence.VerificationJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Finalizes records whose run did not survive a restart, so no company stays locked and no
 * record stays non-terminal past the timeout.
 */
@Component
public class VerificationLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(VerificationLifecycleRunner.class);

    static final String ABANDONED_REASON = "abandoned_on_startup";

    private final VerificationJdbcRepository repository;
    private final VerificationProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    public VerificationLifecycleRunner(
        VerificationJdbcRepository repository,
        VerificationProperties properties,
        ApplicationEventPublisher eventPublisher
    ) {
        this.repository = repository;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void run(ApplicationArguments args) {
        recoverStaleRecords(Instant.now());
    }

    public int recoverStaleRecords(Instant now) {
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        List<VerificationStatusView> stale = repository.findNonTerminalCreatedBefore(cutoff);
        int finalized = 0;
        for (VerificationStatusView record : stale) {
            if (repository.failRecord(record.recordId(), record.companyId(), ABANDONED_REASON, List.of(), now)) {
                finalized++;
                log.warn("Finalized stale verification {} for company {} (was {})", record.recordId(), record.companyId(), record.status());
                eventPublisher.publishEvent(new VerificationStatusChangedEvent(
                    record.companyId(),
                    record.recordId(),
                    record.status(),
                    VerificationStatus.FAILED
                ));
            }
        }
        int released = repository.releaseLocksOfTerminalRecords();
        if (released > 0) {
            log.warn("Released {} verification locks held by terminal records", released);
        }
        return finalized;
    }
}
