package com.ecvi.riskengine.verify.api;

import com.ecvi.riskengine.verify.model.RiskTrend;
import com.ecvi.riskengine.verify.model.VerificationRecord;
import com.ecvi.riskengine.verify.model.VerificationStatusView;
import com.ecvi.riskengine.verify.model.VerificationTriggerResult;
import com.ecvi.riskengine.verify.service.VerificationHistoryService;
import com.ecvi.riskengine.verify.service.VerificationOrchestratorService;
import com.ecvi.riskengine.verify.service.VerificationStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class VerificationController {
    private final VerificationOrchestratorService orchestratorService;
    private final VerificationStatusService statusService;
    private final VerificationHistoryService historyService;

    public VerificationController(
        VerificationOrchestratorService orchestratorService,
        VerificationStatusService statusService,
        VerificationHistoryService historyService
    ) {
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
        this.historyService = historyService;
    }

    @PostMapping("/companies/{companyId}/verifications")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public VerificationTriggerResult trigger(
        @PathVariable("companyId") long companyId,
        @RequestBody(required = false) VerificationTriggerRequest request
    ) {
        return orchestratorService.trigger(
            companyId,
            request == null ? null : request.overrides(),
            request == null ? null : request.reason()
        );
    }

    @PostMapping("/companies/{companyId}/verifications/retrigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public VerificationTriggerResult reTrigger(
        @PathVariable("companyId") long companyId,
        @RequestBody(required = false) VerificationTriggerRequest request
    ) {
        return orchestratorService.reTrigger(companyId, request == null ? null : request.reason());
    }

    @GetMapping("/companies/{companyId}/verifications")
    public List<VerificationRecord> history(
        @PathVariable("companyId") long companyId,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "includeTombstoned", required = false, defaultValue = "false") boolean includeTombstoned
    ) {
        return historyService.list(companyId, limit, includeTombstoned);
    }

    @GetMapping("/companies/{companyId}/verifications/latest")
    public VerificationRecord latest(
        @PathVariable("companyId") long companyId,
        @RequestParam(name = "includeTombstoned", required = false, defaultValue = "false") boolean includeTombstoned
    ) {
        return historyService.latest(companyId, includeTombstoned);
    }

    @GetMapping("/companies/{companyId}/verifications/trend")
    public RiskTrend trend(@PathVariable("companyId") long companyId) {
        return historyService.trend(companyId);
    }

    @GetMapping("/verifications/{recordId}/status")
    public VerificationStatusView status(@PathVariable("recordId") long recordId) {
        return statusService.getStatus(recordId);
    }

    @GetMapping("/verifications/{recordId}")
    public VerificationRecord record(@PathVariable("recordId") long recordId) {
        return statusService.getRecord(recordId);
    }

    @PostMapping("/verifications/{recordId}/cancel")
    public VerificationStatusView cancel(
        @PathVariable("recordId") long recordId,
        @RequestBody(required = false) VerificationCancelRequest request
    ) {
        return orchestratorService.cancel(recordId, request == null ? null : request.reason());
    }

    @DeleteMapping("/verifications/{recordId}")
    public VerificationRecord tombstone(@PathVariable("recordId") long recordId) {
        return historyService.tombstone(recordId);
    }
}
