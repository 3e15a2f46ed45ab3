package com.ecvi.riskengine.verify.service;

import com.ecvi.riskengine.verify.model.VerificationRecord;
import com.ecvi.riskengine.verify.model.VerificationStatusView;
import com.ecvi.riskengine.verify.persistence.VerificationJdbcRepository;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class VerificationStatusService {
    private final VerificationJdbcRepository repository;

    public VerificationStatusService(VerificationJdbcRepository repository) {
        this.repository = repository;
    }

    public VerificationStatusView getStatus(long recordId) {
        VerificationStatusView view = repository.findStatusView(recordId);
        if (view == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown verification record: " + recordId);
        }
        return view;
    }

    public VerificationRecord getRecord(long recordId) {
        VerificationRecord record = repository.findRecord(recordId);
        if (record == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown verification record: " + recordId);
        }
        return record;
    }
}
