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
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Calendar REST adapter for the "primary" calendar.
 *
 * The cursor is an RFC 3339 timestamp used as updatedMin: the change listing is
 * "events updated since then", ordered by modification time and paged up to
 * relaytide.ingestion.calendar-max-pages. A complete listing returns no next cursor;
 * a truncated one returns the last modification time it reached.
 * events.list already returns full events, so every ChangeRecord comes back hydrated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CalendarClient implements RemoteEventSource<MeetingSnapshot>, PushSubscriptionClient {

    private static final String CALENDAR_ID = "primary";

    private final RestTemplate restTemplate;
    private final UpstreamErrorClassifier errorClassifier;
    private final RelaytideProperties properties;

    @Override
    public IngestionSource source() {
        return IngestionSource.CALENDAR_PUSH;
    }

    @Override
    public ChangeSet<MeetingSnapshot> fetchIncrementalChanges(AccessCredential credential, String cursor) {
        int maxPages = properties.getIngestion().getCalendarMaxPages();
        List<ChangeRecord<MeetingSnapshot>> changes = new ArrayList<>();
        Instant lastUpdated = null;
        String pageToken = null;
        int pages = 0;

        do {
            UriComponentsBuilder uri = UriComponentsBuilder
                    .fromHttpUrl(baseUrl() + "/calendars/{calendarId}/events")
                    .queryParam("updatedMin", cursor)
                    .queryParam("singleEvents", true)
                    .queryParam("orderBy", "updated")
                    .queryParam("maxResults", properties.getIngestion().getCalendarMaxResults());
            if (pageToken != null) {
                uri.queryParam("pageToken", pageToken);
            }

            JsonNode page = get("calendar.events", uri.buildAndExpand(CALENDAR_ID).encode().toUri(),
                    credential, cursor);
            for (JsonNode item : page.path("items")) {
                MeetingSnapshot meeting = toSnapshot(item);
                if (meeting.getEventId() != null) {
                    changes.add(new ChangeRecord<>(meeting.getEventId(), meeting));
                }
                Instant updated = parseInstant(item.path("updated").asText(null));
                if (updated != null && (lastUpdated == null || updated.isAfter(lastUpdated))) {
                    lastUpdated = updated;
                }
            }
            pages++;
            pageToken = page.path("nextPageToken").asText(null);
        } while (pageToken != null && !pageToken.isBlank() && pages < maxPages);

        // Listing cut short: resume just before the last modification we actually saw
        String nextCursor = null;
        if (pageToken != null && !pageToken.isBlank()) {
            log.warn("Calendar listing since {} truncated after {} page(s)", cursor, pages);
            nextCursor = lastUpdated != null ? lastUpdated.minusMillis(1).toString() : cursor;
        }
        log.debug("Calendar events updated since {} → {}", cursor, changes.size());
        return new ChangeSet<>(changes, nextCursor);
    }

    @Override
    public MeetingSnapshot fetchEntityDetail(AccessCredential credential, String eventId) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(baseUrl() + "/calendars/{calendarId}/events/{eventId}")
                .buildAndExpand(CALENDAR_ID, eventId)
                .encode()
                .toUri();
        return toSnapshot(get("calendar.event", uri, credential, null));
    }

    @Override
    public WatchRegistration startWatch(AccessCredential credential, String channelId, String token) {
        RelaytideProperties.Google google = properties.getGoogle();
        if (google.getCalendarWebhookUrl() == null || google.getCalendarWebhookUrl().isBlank()) {
            throw new IllegalStateException("relaytide.google.calendar-webhook-url is not configured");
        }
        Map<String, Object> body = new HashMap<>();
        body.put("id", channelId);
        body.put("type", "web_hook");
        body.put("address", google.getCalendarWebhookUrl());
        if (token != null) {
            body.put("token", token);
        }
        body.put("params", Map.of("ttl", String.valueOf(google.getWatchTtlSeconds())));

        URI uri = UriComponentsBuilder
                .fromHttpUrl(baseUrl() + "/calendars/{calendarId}/events/watch")
                .buildAndExpand(CALENDAR_ID)
                .encode()
                .toUri();
        JsonNode response = post("calendar.watch", uri, credential, body);

        String expiration = response.path("expiration").asText(null);
        return WatchRegistration.builder()
                .channelId(response.path("id").asText(channelId))
                .resourceId(response.path("resourceId").asText(null))
                .expiresAt(expiration != null ? Instant.ofEpochMilli(Long.parseLong(expiration)) : null)
                .build();
    }

    @Override
    public void stopWatch(AccessCredential credential, String channelId, String resourceId) {
        Map<String, Object> body = new HashMap<>();
        body.put("id", channelId);
        body.put("resourceId", resourceId);
        post("calendar.stop", URI.create(baseUrl() + "/channels/stop"), credential, body);
    }

    MeetingSnapshot toSnapshot(JsonNode event) {
        List<MeetingAttendee> attendees = new ArrayList<>();
        for (JsonNode attendee : event.path("attendees")) {
            attendees.add(MeetingAttendee.builder()
                    .email(attendee.path("email").asText(null))
                    .displayName(attendee.path("displayName").asText(null))
                    .self(attendee.path("self").asBoolean(false))
                    .build());
        }

        return MeetingSnapshot.builder()
                .eventId(event.path("id").asText(null))
                .status(event.path("status").asText(null))
                .title(event.path("summary").asText(null))
                .description(event.path("description").asText(null))
                .startsAt(parseStart(event.path("start")))
                .organizedBySelf(event.path("organizer").path("self").asBoolean(false))
                .attendees(attendees)
                .build();
    }

    private Instant parseStart(JsonNode start) {
        try {
            if (start.hasNonNull("dateTime")) {
                return OffsetDateTime.parse(start.get("dateTime").asText()).toInstant();
            }
            if (start.hasNonNull("date")) {
                return LocalDate.parse(start.get("date").asText()).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
        } catch (DateTimeParseException e) {
            log.warn("Unparseable calendar start {}: {}", start, e.getMessage());
        }
        return null;
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable calendar timestamp {}", value);
            return null;
        }
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
        return properties.getGoogle().getCalendarBaseUrl();
    }
}
