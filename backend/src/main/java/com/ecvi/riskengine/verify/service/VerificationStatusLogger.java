package com.ecvi.riskengine.verify.service;

import com.ecvi.riskengine.verify.model.VerificationStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class VerificationStatusLogger {
    private static final Logger log = LoggerFactory.getLogger(VerificationStatusLogger.class);

    @EventListener
    public void onStatusChanged(VerificationStatusChangedEvent event) {
        log.info(
            "Verification {} for company {}: {} -> {}",
            event.recordId(),
            event.companyId(),
            event.oldStatus(),
            event.newStatus()
        );
    }
}
