package com.ecvi.riskengine.verify.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** A company already has a PENDING or IN_PROGRESS verification record. */
@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveVerificationException extends RuntimeException {
    private final long companyId;
    private final Long activeRecordId;

    public ActiveVerificationException(long companyId, Long activeRecordId, String message) {
        super(message);
        this.companyId = companyId;
        this.activeRecordId = activeRecordId;
    }

    public long getCompanyId() {
        return companyId;
    }

    public Long getActiveRecordId() {
        return activeRecordId;
    }
}
