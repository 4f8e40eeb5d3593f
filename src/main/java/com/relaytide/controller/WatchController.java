package com.relaytide.controller;

import com.relaytide.dto.WatchResponse;
import com.relaytide.model.IngestionSource;
import com.relaytide.service.AccountAccessPolicy;
import com.relaytide.service.WatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * POST   /api/accounts/{accountId}/watches/MAIL_PUSH      → start (or replace) the subscription
 * DELETE /api/accounts/{accountId}/watches/CALENDAR_PUSH  → stop every active channel
 */
@RestController
@RequestMapping("/api/accounts/{accountId}/watches")
@RequiredArgsConstructor
public class WatchController {

    private final WatchService watchService;
    private final AccountAccessPolicy accessPolicy;

    @PostMapping("/{source}")
    public ResponseEntity<WatchResponse> start(
            @RequestHeader(value = IngestionController.CALLER_HEADER, required = false) String caller,
            @PathVariable String accountId,
            @PathVariable IngestionSource source) {
        accessPolicy.requireAccess(caller, accountId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(WatchResponse.from(watchService.startWatch(accountId, source)));
    }

    @DeleteMapping("/{source}")
    public ResponseEntity<Map<String, Object>> stop(
            @RequestHeader(value = IngestionController.CALLER_HEADER, required = false) String caller,
            @PathVariable String accountId,
            @PathVariable IngestionSource source) {
        accessPolicy.requireAccess(caller, accountId);
        int stopped = watchService.stopWatch(accountId, source);
        return ResponseEntity.ok(Map.of("stopped", stopped));
    }
}
