package com.relaytide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.IngestionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tells out-of-band jobs that an account needs attention this pipeline cannot give:
 *   - resync-required: the stored cursor expired, a full sync must run
 *   - reauth-required: the credential is missing, revoked or rejected
 *
 * Messages are JSON keyed by accountId. A publish failure is logged and never
 * fails the ingestion that triggered it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionAlertPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final RelaytideProperties properties;
    private final Clock clock;

    public void publishResyncRequired(String accountId, IngestionSource source, String cursor, UUID recordId) {
        Map<String, Object> alert = baseAlert(accountId, source, recordId);
        alert.put("expiredCursor", cursor);
        send(properties.getTopics().getResyncRequired(), accountId, alert);
    }

    public void publishReauthRequired(String accountId, IngestionSource source, String reason, UUID recordId) {
        Map<String, Object> alert = baseAlert(accountId, source, recordId);
        alert.put("reason", reason);
        send(properties.getTopics().getReauthRequired(), accountId, alert);
    }

    private Map<String, Object> baseAlert(String accountId, IngestionSource source, UUID recordId) {
        Map<String, Object> alert = new HashMap<>();
        alert.put("accountId", accountId);
        alert.put("source", source.name());
        alert.put("ingestionRecordId", recordId != null ? recordId.toString() : null);
        alert.put("timestamp", clock.millis());
        return alert;
    }

    private void send(String topic, String accountId, Map<String, Object> alert) {
        try {
            String message = objectMapper.writeValueAsString(alert);
            kafkaTemplate.send(topic, accountId, message);
            log.info("Alert sent: topic={}, account={}", topic, accountId);
        } catch (Exception e) {
            log.error("Failed to publish alert to {} for account {}: {}", topic, accountId, e.getMessage(), e);
        }
    }
}
