package com.relaytide.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared RestTemplate for all provider calls.
 *
 * Connect/read timeouts come from relaytide.google.*; they bound a single HTTP
 * attempt, while the retry executor and the per-notification budget bound the whole call.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final RelaytideProperties properties;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        RelaytideProperties.Google google = properties.getGoogle();
        return builder
                .setConnectTimeout(google.getConnectTimeout())
                .setReadTimeout(google.getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
