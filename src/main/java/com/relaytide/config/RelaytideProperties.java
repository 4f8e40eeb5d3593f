package com.relaytide.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Centralizes topic, retry, ingestion and provider configuration.
 *
 * Bound from application.yml under the "relaytide" prefix:
 *   relaytide:
 *     topics:
 *       resync-required: relaytide.resync-required
 *     retry:
 *       max-retries: 3
 *       initial-delay-ms: 1000
 *     ingestion:
 *       timeout: 60s
 *
 * Components inject this instead of hardcoding endpoints, budgets or topic names.
 */
@ConfigurationProperties(prefix = "relaytide")
@Getter
@Setter
public class RelaytideProperties {

    private Topics topics = new Topics();
    private Retry retry = new Retry();
    private Ingestion ingestion = new Ingestion();
    private Google google = new Google();
    private Webhook webhook = new Webhook();

    @Getter
    @Setter
    public static class Topics {
        private String resyncRequired = "relaytide.resync-required";
        private String reauthRequired = "relaytide.reauth-required";
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        private long initialDelayMs = 1000;
        private long maxDelayMs = 10000;
        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Ingestion {
        // Overall budget for one notification, independent of the retry budget
        private Duration timeout = Duration.ofSeconds(60);
        private Duration calendarWindow = Duration.ofHours(1);
        private int calendarMaxResults = 50;
        private int calendarMaxPages = 10;
        private Duration staleProcessingThreshold = Duration.ofMinutes(15);
        private Duration claimRetention = Duration.ofDays(31);
        private long staleSweepIntervalMs = 300_000;
        private String defaultClassification = "business";
    }

    @Getter
    @Setter
    public static class Google {
        private String gmailBaseUrl = "https://gmail.googleapis.com/gmail/v1";
        private String calendarBaseUrl = "https://www.googleapis.com/calendar/v3";
        private String tokenUrl = "https://oauth2.googleapis.com/token";
        private String clientId;
        private String clientSecret;
        private String pubsubTopic;
        private String calendarWebhookUrl;
        private long watchTtlSeconds = 604_800;
        private Duration tokenRefreshSkew = Duration.ofMinutes(5);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Webhook {
        // Shared secret appended as ?token= to the Pub/Sub push endpoint; blank disables the check
        private String mailVerificationToken;
    }
}
