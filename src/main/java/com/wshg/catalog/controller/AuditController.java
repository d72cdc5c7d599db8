package com.wshg.catalog.controller;

import com.wshg.catalog.model.ChainVerification;
import com.wshg.catalog.model.ChangeRecord;
import com.wshg.catalog.service.ResourceLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Audit trail and chain verification. A broken chain answers 409 with the failing index.
 */
@Slf4j
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final ResourceLifecycleService lifecycleService;

    @GetMapping("/{resourceId}")
    public List<ChangeRecord> trail(@PathVariable String resourceId) {
        return lifecycleService.getAuditTrail(resourceId);
    }

    @GetMapping("/{resourceId}/verify")
    public ChainVerification verify(@PathVariable String resourceId) {
        log.info("[API] GET /api/audit/{}/verify", resourceId);
        return lifecycleService.verifyChain(resourceId);
    }

    @GetMapping("/verify")
    public ChainVerification verifyAll() {
        log.info("[API] GET /api/audit/verify");
        ChainVerification result = lifecycleService.verifyAllChains();
        log.info("[API] /audit/verify chains={}, records={}", result.getChainsVerified(), result.getRecordsVerified());
        return result;
    }
}
