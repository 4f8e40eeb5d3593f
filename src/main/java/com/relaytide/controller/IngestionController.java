package com.relaytide.controller;

import com.relaytide.dto.IngestionRecordResponse;
import com.relaytide.dto.IngestionStatistics;
import com.relaytide.model.IngestionState;
import com.relaytide.service.AccountAccessPolicy;
import com.relaytide.service.IngestionLedger;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-account view of the ingestion ledger.
 *
 * GET    /api/accounts/{accountId}/ingestions?state=FAILED&limit=50
 * GET    /api/accounts/{accountId}/ingestions/stats?hoursBack=24
 * DELETE /api/accounts/{accountId}/ingestions?daysToKeep=7
 */
@RestController
@RequestMapping("/api/accounts/{accountId}/ingestions")
@RequiredArgsConstructor
@Validated
public class IngestionController {

    static final String CALLER_HEADER = "X-Account-Id";

    private final IngestionLedger ledger;
    private final AccountAccessPolicy accessPolicy;

    @GetMapping
    public ResponseEntity<List<IngestionRecordResponse>> list(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @PathVariable String accountId,
            @RequestParam(required = false) IngestionState state,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        accessPolicy.requireAccess(caller, accountId);
        List<IngestionRecordResponse> records = ledger.findByAccount(accountId, state, limit).stream()
                .map(IngestionRecordResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(records);
    }

    @GetMapping("/stats")
    public ResponseEntity<IngestionStatistics> stats(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @PathVariable String accountId,
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hoursBack) {
        accessPolicy.requireAccess(caller, accountId);
        return ResponseEntity.ok(ledger.statistics(accountId, hoursBack));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> purge(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @PathVariable String accountId,
            @RequestParam(defaultValue = "7") @Min(1) @Max(30) int daysToKeep) {
        accessPolicy.requireAccess(caller, accountId);
        int deleted = ledger.purge(accountId, daysToKeep);
        return ResponseEntity.ok(Map.of("deleted", deleted, "daysToKeep", daysToKeep));
    }
}
