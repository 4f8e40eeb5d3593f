package com.relaytide.service;

import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.IngestionRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StaleIngestionSweeperTest {

    @Mock private IngestionLedger ledger;

    @Test
    void sweep_reportsRecordsPastThreshold() {
        RelaytideProperties properties = new RelaytideProperties();
        properties.getIngestion().setStaleProcessingThreshold(Duration.ofMinutes(5));
        when(ledger.findStaleProcessing(Duration.ofMinutes(5)))
                .thenReturn(List.of(new IngestionRecord(), new IngestionRecord()));

        assertEquals(2, new StaleIngestionSweeper(ledger, properties).sweep());
    }
}
