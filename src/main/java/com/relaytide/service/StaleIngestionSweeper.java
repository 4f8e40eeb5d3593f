package com.relaytide.service;

import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.IngestionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports records stuck in PROCESSING past the staleness threshold
 * (crash mid-ingestion, shutdown during a retry wait). Reclaiming them is left
 * to an external supervisor; this only makes them visible.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleIngestionSweeper {

    private final IngestionLedger ledger;
    private final RelaytideProperties properties;

    @Scheduled(fixedDelayString = "${relaytide.ingestion.stale-sweep-interval-ms:300000}")
    public int sweep() {
        List<IngestionRecord> stale = ledger.findStaleProcessing(properties.getIngestion().getStaleProcessingThreshold());
        for (IngestionRecord record : stale) {
            log.warn("Stale ingestion: record={}, account={}, source={}, key={}, startedAt={}",
                    record.getId(), record.getAccountId(), record.getSource(),
                    record.getExternalKey(), record.getStartedAt());
        }
        if (!stale.isEmpty()) {
            log.warn("{} ingestion record(s) stuck in PROCESSING", stale.size());
        }
        return stale.size();
    }
}
