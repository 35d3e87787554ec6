package com.edusync.sync.calendar.client;

import com.edusync.sync.calendar.exception.RemoteCalendarException;
import com.edusync.sync.calendar.model.CalendarEventBody;
import com.edusync.sync.calendar.model.RemoteCalendarEntry;
import com.edusync.sync.common.config.EduSyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("GoogleCalendarClient 테스트")
class GoogleCalendarClientTest {

    private static final String EVENTS_URL = "https://www.googleapis.com/calendar/v3/calendars/primary/events";
    private static final Instant TIME_MIN = Instant.parse("2024-02-01T00:00:00Z");
    private static final Instant TIME_MAX = Instant.parse("2024-08-12T00:00:00Z");

    private MockRestServiceServer server;
    private GoogleCalendarClient calendarClient;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        calendarClient = new GoogleCalendarClient(restTemplate, new EduSyncProperties());
    }

    @Test
    @DisplayName("stableId로 private 확장 속성 검색, 종일 일정 날짜 파싱")
    void findByStableId() {
        // Given
        server.expect(requestTo(allOf(
                        containsString(EVENTS_URL + "?"),
                        containsString("privateExtendedProperty=queraAssignmentId%3D85830"),
                        containsString("singleEvents=true"))))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer access-token"))
                .andRespond(withSuccess("""
                        {"items":[{"id":"evt-1","summary":"HW1 | Algorithms",
                          "description":"Assignment Link: https://quera.org/course/assignments/85830/problems",
                          "start":{"date":"2024-05-14"},"end":{"date":"2024-05-15"},
                          "extendedProperties":{"private":{"queraAssignmentId":"85830","source":"quera-automation"}}}]}
                        """, MediaType.APPLICATION_JSON));

        // When
        List<RemoteCalendarEntry> entries = calendarClient.findByStableId("access-token", "85830", TIME_MIN, TIME_MAX);

        // Then
        assertThat(entries).hasSize(1);
        RemoteCalendarEntry entry = entries.get(0);
        assertThat(entry.getId()).isEqualTo("evt-1");
        assertThat(entry.getStableId()).isEqualTo("85830");
        assertThat(entry.getStartDate()).isEqualTo(LocalDate.of(2024, 5, 14));
        assertThat(entry.getEndDate()).isEqualTo(LocalDate.of(2024, 5, 15));
        server.verify();
    }

    @Test
    @DisplayName("nextPageToken이 있으면 다음 페이지까지 조회")
    void findByStableId_Paging() {
        // Given
        server.expect(requestTo(not(containsString("pageToken"))))
                .andRespond(withSuccess("{\"items\":[{\"id\":\"evt-1\",\"start\":{\"date\":\"2024-05-14\"}}],"
                        + "\"nextPageToken\":\"page-2\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(containsString("pageToken=page-2")))
                .andRespond(withSuccess("{\"items\":[{\"id\":\"evt-2\","
                        + "\"start\":{\"dateTime\":\"2024-05-14T10:00:00+03:30\"}}]}", MediaType.APPLICATION_JSON));

        // When
        List<RemoteCalendarEntry> entries = calendarClient.findByStableId("access-token", "85830", TIME_MIN, TIME_MAX);

        // Then
        assertThat(entries).extracting(RemoteCalendarEntry::getId).containsExactly("evt-1", "evt-2");
        assertThat(entries.get(1).getStartDate()).isEqualTo(LocalDate.of(2024, 5, 14));
        server.verify();
    }

    @Test
    @DisplayName("생성 요청 본문은 종일 일정 + private 확장 속성")
    void create() {
        // Given
        server.expect(requestTo(EVENTS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.summary").value("HW1 | Algorithms"))
                .andExpect(jsonPath("$.start.date").value("2024-05-14"))
                .andExpect(jsonPath("$.end.date").value("2024-05-15"))
                .andExpect(jsonPath("$.start.timeZone").value("Asia/Tehran"))
                .andExpect(jsonPath("$.extendedProperties.private.queraAssignmentId").value("85830"))
                .andExpect(jsonPath("$.extendedProperties.private.source").value("quera-automation"))
                .andRespond(withSuccess("{\"id\":\"evt-new\",\"start\":{\"date\":\"2024-05-14\"},"
                        + "\"end\":{\"date\":\"2024-05-15\"}}", MediaType.APPLICATION_JSON));

        // When
        RemoteCalendarEntry created = calendarClient.create("access-token", body());

        // Then
        assertThat(created.getId()).isEqualTo("evt-new");
        server.verify();
    }

    @Test
    @DisplayName("수정은 eventId 경로로 PUT")
    void update() {
        // Given
        server.expect(requestTo(EVENTS_URL + "/evt-1"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withSuccess("{\"id\":\"evt-1\",\"start\":{\"date\":\"2024-05-14\"}}",
                        MediaType.APPLICATION_JSON));

        // When
        RemoteCalendarEntry updated = calendarClient.update("access-token", "evt-1", body());

        // Then
        assertThat(updated.getId()).isEqualTo("evt-1");
        server.verify();
    }

    @Test
    @DisplayName("삭제는 eventId 경로로 DELETE")
    void delete() {
        server.expect(requestTo(EVENTS_URL + "/evt-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withNoContent());

        calendarClient.delete("access-token", "evt-1");

        server.verify();
    }

    @Test
    @DisplayName("403은 권한 오류, 재시도 불가")
    void forbidden() {
        server.expect(requestTo(EVENTS_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> calendarClient.create("access-token", body()))
                .isInstanceOfSatisfying(RemoteCalendarException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(403);
                    assertThat(e.isAuthorizationError()).isTrue();
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    @DisplayName("5xx는 재시도 가능")
    void serverError() {
        server.expect(requestTo(EVENTS_URL + "/evt-1")).andRespond(withServerError());

        assertThatThrownBy(() -> calendarClient.update("access-token", "evt-1", body()))
                .isInstanceOfSatisfying(RemoteCalendarException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(500);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    private CalendarEventBody body() {
        return CalendarEventBody.builder()
                .title("HW1 | Algorithms")
                .description("Assignment Link: https://quera.org/course/assignments/85830/problems")
                .startDate(LocalDate.of(2024, 5, 14))
                .endDate(LocalDate.of(2024, 5, 15))
                .timeZone("Asia/Tehran")
                .privateProperties(Map.of(
                        CalendarEventBody.STABLE_ID_PROPERTY, "85830",
                        CalendarEventBody.SOURCE_PROPERTY, CalendarEventBody.SOURCE_VALUE))
                .build();
    }
}
