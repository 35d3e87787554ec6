package com.edusync.sync.calendar.client;

import com.edusync.sync.calendar.CalendarClient;
import com.edusync.sync.calendar.dto.GoogleCalendarEvent;
import com.edusync.sync.calendar.dto.GoogleCalendarEvent.EventDateTime;
import com.edusync.sync.calendar.dto.GoogleCalendarEvent.ExtendedProperties;
import com.edusync.sync.calendar.dto.GoogleEventList;
import com.edusync.sync.calendar.exception.RemoteCalendarException;
import com.edusync.sync.calendar.model.CalendarEventBody;
import com.edusync.sync.calendar.model.RemoteCalendarEntry;
import com.edusync.sync.common.config.EduSyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Calendar API v3 클라이언트
 * 호출마다 tenant의 access token을 Bearer로 전달합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoogleCalendarClient implements CalendarClient {

    private static final int MAX_PAGES = 10;

    private final RestTemplate restTemplate;
    private final EduSyncProperties properties;

    @Override
    public List<RemoteCalendarEntry> findByStableId(String accessToken, String stableId,
                                                    Instant timeMin, Instant timeMax) {
        List<RemoteCalendarEntry> entries = new ArrayList<>();
        String pageToken = null;
        int pages = 0;

        do {
            UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getGoogle().getCalendarApiUrl())
                    .path("/calendars/{calendarId}/events")
                    .queryParam("privateExtendedProperty", "{property}")
                    .queryParam("timeMin", "{timeMin}")
                    .queryParam("timeMax", "{timeMax}")
                    .queryParam("singleEvents", "true");

            Map<String, Object> variables = new HashMap<>();
            variables.put("calendarId", properties.getGoogle().getCalendarId());
            variables.put("property", CalendarEventBody.STABLE_ID_PROPERTY + "=" + stableId);
            variables.put("timeMin", timeMin.toString());
            variables.put("timeMax", timeMax.toString());
            if (pageToken != null) {
                builder.queryParam("pageToken", "{pageToken}");
                variables.put("pageToken", pageToken);
            }

            URI uri = builder.encode().buildAndExpand(variables).toUri();
            GoogleEventList page = execute(uri, HttpMethod.GET, authorized(accessToken, null), GoogleEventList.class,
                    "list stableId=" + stableId);

            if (page != null && page.getItems() != null) {
                page.getItems().stream().map(this::toEntry).forEach(entries::add);
            }
            pageToken = page != null ? page.getNextPageToken() : null;
            pages++;
        } while (pageToken != null && pages < MAX_PAGES);

        return entries;
    }

    @Override
    public RemoteCalendarEntry create(String accessToken, CalendarEventBody body) {
        URI uri = eventsUri().buildAndExpand(properties.getGoogle().getCalendarId()).toUri();
        GoogleCalendarEvent created = execute(uri, HttpMethod.POST, authorized(accessToken, toGoogleEvent(body)),
                GoogleCalendarEvent.class, "insert");
        return toEntry(created);
    }

    @Override
    public RemoteCalendarEntry update(String accessToken, String entryId, CalendarEventBody body) {
        URI uri = eventUri().buildAndExpand(properties.getGoogle().getCalendarId(), entryId).toUri();
        GoogleCalendarEvent updated = execute(uri, HttpMethod.PUT, authorized(accessToken, toGoogleEvent(body)),
                GoogleCalendarEvent.class, "update eventId=" + entryId);
        return toEntry(updated);
    }

    @Override
    public void delete(String accessToken, String entryId) {
        URI uri = eventUri().buildAndExpand(properties.getGoogle().getCalendarId(), entryId).toUri();
        execute(uri, HttpMethod.DELETE, authorized(accessToken, null), Void.class, "delete eventId=" + entryId);
    }

    private UriComponentsBuilder eventsUri() {
        return UriComponentsBuilder.fromUriString(properties.getGoogle().getCalendarApiUrl())
                .path("/calendars/{calendarId}/events")
                .encode();
    }

    private UriComponentsBuilder eventUri() {
        return UriComponentsBuilder.fromUriString(properties.getGoogle().getCalendarApiUrl())
                .path("/calendars/{calendarId}/events/{eventId}")
                .encode();
    }

    private <T> HttpEntity<T> authorized(String accessToken, T body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private <T> T execute(URI uri, HttpMethod method, HttpEntity<?> request, Class<T> responseType, String action) {
        try {
            return restTemplate.exchange(uri, method, request, responseType).getBody();
        } catch (HttpStatusCodeException e) {
            log.error("Google Calendar request failed: action={}, status={}, body={}",
                    action, e.getStatusCode(), e.getResponseBodyAsString());
            throw new RemoteCalendarException(e.getStatusCode().value(),
                    "Google Calendar " + action + " failed: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Google Calendar request error: action={}, error={}", action, e.getMessage());
            throw new RemoteCalendarException(0, "Google Calendar " + action + " failed: " + e.getMessage(), e);
        }
    }

    private GoogleCalendarEvent toGoogleEvent(CalendarEventBody body) {
        return GoogleCalendarEvent.builder()
                .summary(body.getTitle())
                .description(body.getDescription())
                .start(EventDateTime.builder()
                        .date(body.getStartDate().toString())
                        .timeZone(body.getTimeZone())
                        .build())
                .end(EventDateTime.builder()
                        .date(body.getEndDate().toString())
                        .timeZone(body.getTimeZone())
                        .build())
                .extendedProperties(ExtendedProperties.builder()
                        .privateProperties(body.getPrivateProperties())
                        .build())
                .build();
    }

    private RemoteCalendarEntry toEntry(GoogleCalendarEvent event) {
        if (event == null) {
            throw new RemoteCalendarException(0, "Google Calendar returned an empty event");
        }
        String stableId = null;
        if (event.getExtendedProperties() != null && event.getExtendedProperties().getPrivateProperties() != null) {
            stableId = event.getExtendedProperties().getPrivateProperties().get(CalendarEventBody.STABLE_ID_PROPERTY);
        }
        return RemoteCalendarEntry.builder()
                .id(event.getId())
                .stableId(stableId)
                .title(event.getSummary())
                .description(event.getDescription())
                .startDate(toDate(event.getStart()))
                .endDate(toDate(event.getEnd()))
                .build();
    }

    private LocalDate toDate(EventDateTime dateTime) {
        if (dateTime == null) {
            return null;
        }
        if (dateTime.getDate() != null) {
            return LocalDate.parse(dateTime.getDate());
        }
        if (dateTime.getDateTime() != null) {
            return OffsetDateTime.parse(dateTime.getDateTime()).toLocalDate();
        }
        return null;
    }
}
