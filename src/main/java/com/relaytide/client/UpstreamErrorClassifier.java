package com.relaytide.client;

import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Locale;

/**
 * Turns a RestTemplate failure into one of the UpstreamException subtypes.
 *
 * Rules:
 *   429, 5xx                          → retryable
 *   403 mentioning quota / rate limit → retryable
 *   401, other 403                    → authorization (not retried)
 *   404 / 410 on a cursor read        → cursor expired (not retried)
 *   404, other 4xx                    → fatal (not retried)
 *   connection reset, timeout, DNS    → retryable (RestTemplate wraps these as ResourceAccessException)
 */
@Component
public class UpstreamErrorClassifier {

    private static final List<String> QUOTA_MARKERS = List.of(
            "quota", "ratelimitexceeded", "rate limit", "ratelimit");

    public UpstreamException classify(String operation, RestClientException error) {
        return classify(operation, error, null);
    }

    /**
     * @param cursor the cursor the request was reading from, or null when the call is not cursor-based
     */
    public UpstreamException classify(String operation, RestClientException error, String cursor) {
        if (error instanceof ResourceAccessException) {
            return new RetryableUpstreamException(operation, 0,
                    "Network error calling " + operation + ": " + error.getMessage(), error);
        }
        if (!(error instanceof RestClientResponseException)) {
            return new FatalUpstreamException(operation, 0,
                    "Unexpected client error calling " + operation + ": " + error.getMessage(), error);
        }

        RestClientResponseException response = (RestClientResponseException) error;
        int status = response.getStatusCode().value();
        String detail = operation + " returned HTTP " + status;

        if (status == 429 || (status >= 500 && status < 600)) {
            return new RetryableUpstreamException(operation, status, detail, error);
        }
        if (status == 403 && isQuotaExceeded(response)) {
            return new RetryableUpstreamException(operation, status, detail + " (quota exceeded)", error);
        }
        if (status == 401 || status == 403) {
            return new UpstreamAuthorizationException(operation, status, detail, error);
        }
        if (cursor != null && (status == 404 || status == 410)) {
            return new CursorExpiredException(operation, status, cursor, error);
        }
        return new FatalUpstreamException(operation, status, detail, error);
    }

    private boolean isQuotaExceeded(RestClientResponseException response) {
        String text = (response.getStatusText() + " " + response.getResponseBodyAsString())
                .toLowerCase(Locale.ROOT);
        return QUOTA_MARKERS.stream().anyMatch(text::contains);
    }
}
