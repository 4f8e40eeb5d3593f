package com.relaytide.config;

import com.relaytide.client.CalendarClient;
import com.relaytide.client.GmailClient;
import com.relaytide.client.MailSnapshot;
import com.relaytide.client.MeetingSnapshot;
import com.relaytide.client.ResilientEventSource;
import com.relaytide.client.RetryableUpstreamException;
import com.relaytide.retry.BackoffRetryExecutor;
import com.relaytide.retry.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the provider clients behind the retry executor.
 *
 * Only RetryableUpstreamException is retried; cursor expiry, authorization and
 * fatal errors surface on the first attempt.
 */
@Configuration
public class EventSourceConfig {

    @Bean
    public RetryPolicy upstreamRetryPolicy(RelaytideProperties properties) {
        return RetryPolicy.from(properties.getRetry(), error -> error instanceof RetryableUpstreamException);
    }

    @Bean
    public ResilientEventSource<MailSnapshot> mailEventSource(GmailClient gmailClient,
                                                              BackoffRetryExecutor retryExecutor,
                                                              RetryPolicy upstreamRetryPolicy) {
        return new ResilientEventSource<>(gmailClient, retryExecutor, upstreamRetryPolicy);
    }

    @Bean
    public ResilientEventSource<MeetingSnapshot> calendarEventSource(CalendarClient calendarClient,
                                                                     BackoffRetryExecutor retryExecutor,
                                                                     RetryPolicy upstreamRetryPolicy) {
        return new ResilientEventSource<>(calendarClient, retryExecutor, upstreamRetryPolicy);
    }
}
