package com.relaytide.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamErrorClassifierTest {

    private final UpstreamErrorClassifier classifier = new UpstreamErrorClassifier();

    private static HttpClientErrorException clientError(HttpStatus status, String body) {
        return HttpClientErrorException.create(status, status.getReasonPhrase(), HttpHeaders.EMPTY,
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Retryable")
    class Retryable {

        @Test
        @DisplayName("429 Too Many Requests")
        void tooManyRequests() {
            UpstreamException e = classifier.classify("op", clientError(HttpStatus.TOO_MANY_REQUESTS, ""));
            assertInstanceOf(RetryableUpstreamException.class, e);
            assertEquals(429, e.getStatus());
        }

        @Test
        @DisplayName("5xx")
        void serverError() {
            HttpServerErrorException error = HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE,
                    "Service Unavailable", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
            assertInstanceOf(RetryableUpstreamException.class, classifier.classify("op", error));
        }

        @Test
        @DisplayName("Network failure without a response")
        void networkFailure() {
            ResourceAccessException error = new ResourceAccessException("Read timed out",
                    new SocketTimeoutException("Read timed out"));
            UpstreamException e = classifier.classify("op", error);
            assertInstanceOf(RetryableUpstreamException.class, e);
            assertEquals(0, e.getStatus());
        }

        @Test
        @DisplayName("403 reporting a quota or rate limit")
        void quotaForbidden() {
            String body = "{\"error\":{\"errors\":[{\"reason\":\"rateLimitExceeded\"}],\"message\":\"Rate Limit Exceeded\"}}";
            assertInstanceOf(RetryableUpstreamException.class,
                    classifier.classify("op", clientError(HttpStatus.FORBIDDEN, body)));
        }
    }

    @Nested
    @DisplayName("Not retryable")
    class NotRetryable {

        @Test
        @DisplayName("401 and plain 403 are authorization failures")
        void authorization() {
            assertInstanceOf(UpstreamAuthorizationException.class,
                    classifier.classify("op", clientError(HttpStatus.UNAUTHORIZED, "")));
            assertInstanceOf(UpstreamAuthorizationException.class,
                    classifier.classify("op", clientError(HttpStatus.FORBIDDEN, "{\"error\":\"insufficientPermissions\"}")));
        }

        @Test
        @DisplayName("404 on a cursor read means the cursor expired")
        void notFoundWithCursor() {
            UpstreamException e = classifier.classify("gmail.history", clientError(HttpStatus.NOT_FOUND, ""), "4711");
            CursorExpiredException expired = assertInstanceOf(CursorExpiredException.class, e);
            assertEquals("4711", expired.getCursor());
        }

        @Test
        @DisplayName("410 Gone on a cursor read means the cursor expired")
        void goneWithCursor() {
            assertInstanceOf(CursorExpiredException.class,
                    classifier.classify("calendar.events", clientError(HttpStatus.GONE, ""), "2024-05-01T09:00:00Z"));
        }

        @Test
        @DisplayName("404 without a cursor and other 4xx are fatal")
        void fatal() {
            assertInstanceOf(FatalUpstreamException.class,
                    classifier.classify("op", clientError(HttpStatus.NOT_FOUND, "")));
            assertInstanceOf(FatalUpstreamException.class,
                    classifier.classify("op", clientError(HttpStatus.BAD_REQUEST, "")));
            assertInstanceOf(FatalUpstreamException.class,
                    classifier.classify("op", new RestClientException("no converter")));
        }
    }
}
