package com.relaytide.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.IngestionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Gmail REST adapter.
 *
 *   fetchIncrementalChanges(historyId) → GET users/me/history?startHistoryId=…&historyTypes=messageAdded
 *   fetchEntityDetail(messageId)       → GET users/me/messages/{id}?format=metadata
 *   startWatch / stopWatch             → POST users/me/watch, POST users/me/stop
 *
 * A 404 on the history call means the historyId fell out of Gmail's retention
 * window and is reported as CursorExpiredException.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GmailClient implements RemoteEventSource<MailSnapshot>, PushSubscriptionClient {

    private static final List<String> METADATA_HEADERS = List.of("From", "To", "Subject", "Date");

    private final RestTemplate restTemplate;
    private final UpstreamErrorClassifier errorClassifier;
    private final RelaytideProperties properties;

    @Override
    public IngestionSource source() {
        return IngestionSource.MAIL_PUSH;
    }

    @Override
    public ChangeSet<MailSnapshot> fetchIncrementalChanges(AccessCredential credential, String cursor) {
        Set<String> messageIds = new LinkedHashSet<>();
        String latestHistoryId = null;
        String pageToken = null;

        do {
            UriComponentsBuilder uri = UriComponentsBuilder
                    .fromHttpUrl(baseUrl() + "/users/me/history")
                    .queryParam("startHistoryId", cursor)
                    .queryParam("historyTypes", "messageAdded");
            if (pageToken != null) {
                uri.queryParam("pageToken", pageToken);
            }

            JsonNode page = get("gmail.history", uri.build().encode().toUri(), credential, cursor);
            for (JsonNode history : page.path("history")) {
                for (JsonNode added : history.path("messagesAdded")) {
                    String id = added.path("message").path("id").asText(null);
                    if (id != null && !id.isBlank()) {
                        messageIds.add(id);
                    }
                }
            }
            if (page.hasNonNull("historyId")) {
                latestHistoryId = page.get("historyId").asText();
            }
            pageToken = page.path("nextPageToken").asText(null);
        } while (pageToken != null && !pageToken.isBlank());

        List<ChangeRecord<MailSnapshot>> changes = new ArrayList<>();
        for (String id : messageIds) {
            changes.add(new ChangeRecord<>(id, null));
        }
        log.debug("Gmail history from {} → {} added message(s), latest historyId={}",
                cursor, changes.size(), latestHistoryId);
        return new ChangeSet<>(changes, latestHistoryId);
    }

    @Override
    public MailSnapshot fetchEntityDetail(AccessCredential credential, String messageId) {
        UriComponentsBuilder uri = UriComponentsBuilder
                .fromHttpUrl(baseUrl() + "/users/me/messages/{id}")
                .queryParam("format", "metadata");
        METADATA_HEADERS.forEach(h -> uri.queryParam("metadataHeaders", h));

        JsonNode message = get("gmail.message", uri.buildAndExpand(messageId).encode().toUri(),
                credential, null);
        return toSnapshot(message);
    }

    @Override
    public WatchRegistration startWatch(AccessCredential credential, String channelId, String token) {
        String topic = properties.getGoogle().getPubsubTopic();
        if (topic == null || topic.isBlank()) {
            throw new IllegalStateException("relaytide.google.pubsub-topic is not configured");
        }
        Map<String, Object> body = Map.of(
                "topicName", topic,
                "labelIds", List.of("INBOX"),
                "labelFilterBehavior", "include");

        JsonNode response = post("gmail.watch", URI.create(baseUrl() + "/users/me/watch"), credential, body);
        return WatchRegistration.builder()
                .channelId(topic)
                .initialCursor(response.path("historyId").asText(null))
                .expiresAt(epochMillis(response.path("expiration").asText(null)))
                .build();
    }

    @Override
    public void stopWatch(AccessCredential credential, String channelId, String resourceId) {
        post("gmail.stop", URI.create(baseUrl() + "/users/me/stop"), credential, Map.of());
    }

    MailSnapshot toSnapshot(JsonNode message) {
        String from = null;
        String to = null;
        String subject = null;
        for (JsonNode header : message.path("payload").path("headers")) {
            String name = header.path("name").asText("").toLowerCase(Locale.ROOT);
            String value = header.path("value").asText(null);
            switch (name) {
                case "from" -> from = value;
                case "to" -> to = value;
                case "subject" -> subject = value;
                default -> { }
            }
        }

        List<String> labels = new ArrayList<>();
        message.path("labelIds").forEach(l -> labels.add(l.asText()));

        return MailSnapshot.builder()
                .messageId(message.path("id").asText(null))
                .threadId(message.path("threadId").asText(null))
                .sender(MailAddressParser.parse(from).orElse(null))
                .recipients(MailAddressParser.parseList(to))
                .subject(subject)
                .snippet(message.path("snippet").asText(""))
                .labelIds(labels)
                .receivedAt(epochMillis(message.path("internalDate").asText(null)))
                .build();
    }

    private JsonNode get(String operation, URI uri, AccessCredential credential, String cursor) {
        try {
            JsonNode body = restTemplate.exchange(uri, HttpMethod.GET,
                    new HttpEntity<>(authHeaders(credential)), JsonNode.class).getBody();
            if (body == null) {
                throw new FatalUpstreamException(operation, "Empty response body");
            }
            return body;
        } catch (RestClientException e) {
            throw errorClassifier.classify(operation, e, cursor);
        }
    }

    private JsonNode post(String operation, URI uri, AccessCredential credential, Object body) {
        try {
            HttpHeaders headers = authHeaders(credential);
            headers.setContentType(MediaType.APPLICATION_JSON);
            JsonNode response = restTemplate.exchange(uri, HttpMethod.POST,
                    new HttpEntity<>(body, headers), JsonNode.class).getBody();
            return response != null ? response : MissingNode.getInstance();
        } catch (RestClientException e) {
            throw errorClassifier.classify(operation, e);
        }
    }

    private HttpHeaders authHeaders(AccessCredential credential) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credential.getAccessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private String baseUrl() {
        return properties.getGoogle().getGmailBaseUrl();
    }

    private static Instant epochMillis(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
