package com.relaytide.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.relaytide.client.AccessCredential;
import com.relaytide.client.RetryableUpstreamException;
import com.relaytide.client.UpstreamAuthorizationException;
import com.relaytide.client.UpstreamErrorClassifier;
import com.relaytide.client.UpstreamException;
import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.ProviderCredential;
import com.relaytide.repository.ProviderCredentialRepository;
import com.relaytide.retry.BackoffRetryExecutor;
import com.relaytide.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Credential provider backed by the provider_credentials table.
 *
 * FLOW:
 *   no row / disconnected            → empty
 *   token valid past now + skew      → stored token
 *   otherwise                        → refresh_token grant against the OAuth token endpoint
 *       ok                           → persist new token + expiry
 *       rejected (401/403/400)       → mark disconnected, empty
 *       5xx / network                → retried with backoff; once exhausted, RetryableUpstreamException
 *                                      (the attempt fails, the connection stays)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoredCredentialProvider implements CredentialProvider {

    private static final String OPERATION = "oauth.refresh";

    private final ProviderCredentialRepository credentialRepository;
    private final RestTemplate restTemplate;
    private final UpstreamErrorClassifier errorClassifier;
    private final BackoffRetryExecutor retryExecutor;
    private final RetryPolicy upstreamRetryPolicy;
    private final RelaytideProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<AccessCredential> credentialFor(String accountId) {
        Optional<ProviderCredential> stored = credentialRepository.findByAccountId(accountId);
        if (stored.isEmpty() || !stored.get().isConnected()) {
            log.warn("No connected provider credential for account {}", accountId);
            return Optional.empty();
        }

        ProviderCredential credential = stored.get();
        Instant refreshAfter = clock.instant().plus(properties.getGoogle().getTokenRefreshSkew());
        if (credential.getAccessTokenExpiresAt().isAfter(refreshAfter)) {
            return Optional.of(toAccessCredential(credential));
        }

        if (credential.getRefreshToken() == null || credential.getRefreshToken().isBlank()) {
            log.warn("Access token expiring for account {} and no refresh token stored", accountId);
            disconnect(credential);
            return Optional.empty();
        }

        Instant deadline = clock.instant().plus(properties.getIngestion().getTimeout());
        try {
            retryExecutor.execute(OPERATION, upstreamRetryPolicy, deadline, () -> {
                refresh(credential);
                return null;
            });
        } catch (UpstreamException e) {
            if (!isRejection(e)) {
                throw e;
            }
            log.warn("Token refresh rejected for account {}: {}", accountId, e.getMessage());
            disconnect(credential);
            return Optional.empty();
        }
        return Optional.of(toAccessCredential(credential));
    }

    private void refresh(ProviderCredential credential) {
        RelaytideProperties.Google google = properties.getGoogle();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("client_id", google.getClientId());
        form.add("client_secret", google.getClientSecret());
        form.add("refresh_token", credential.getRefreshToken());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        JsonNode response;
        try {
            response = restTemplate.postForObject(google.getTokenUrl(), new HttpEntity<>(form, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw errorClassifier.classify(OPERATION, e);
        }
        if (response == null || !response.hasNonNull("access_token")) {
            throw new UpstreamAuthorizationException(OPERATION, "Token endpoint returned no access_token");
        }

        credential.setAccessToken(response.get("access_token").asText());
        credential.setAccessTokenExpiresAt(clock.instant().plusSeconds(response.path("expires_in").asLong(3600)));
        if (response.hasNonNull("refresh_token")) {
            credential.setRefreshToken(response.get("refresh_token").asText());
        }
        credentialRepository.save(credential);
        log.info("Access token refreshed for account {}", credential.getAccountId());
    }

    // invalid_grant comes back as 400; the classifier reports it as fatal
    private boolean isRejection(UpstreamException e) {
        if (e instanceof RetryableUpstreamException) {
            return false;
        }
        return e instanceof UpstreamAuthorizationException || (e.getStatus() >= 400 && e.getStatus() < 500);
    }

    private void disconnect(ProviderCredential credential) {
        credential.setConnected(false);
        credentialRepository.save(credential);
    }

    private static AccessCredential toAccessCredential(ProviderCredential credential) {
        return AccessCredential.builder()
                .accountId(credential.getAccountId())
                .accountEmail(credential.getProviderEmail())
                .accessToken(credential.getAccessToken())
                .build();
    }
}
