package com.edusync.sync.source.quera;

import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.deadline.model.RawAssignment;
import com.edusync.sync.source.AssignmentSource;
import com.edusync.sync.source.exception.SourceException;
import com.edusync.sync.source.exception.SourceException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Quera 과목 페이지 스크래퍼
 *
 * GET {baseUrl}/course 를 session_id 쿠키로 호출하고 "مهلت تمرین‌های پیش رو" 섹션의 과제 행을 추출합니다.
 */
@Slf4j
@Component
public class QueraAssignmentSource implements AssignmentSource {

    static final String DEADLINE_SECTION_TITLE = "مهلت تمرین\u200Cهای پیش رو";

    private static final String ROW_SELECTOR = "div.css-ardi2f";
    private static final String DAY_SELECTOR = "span.css-lvorr0";
    private static final String MONTH_SELECTOR = "span.css-itvw0n";
    private static final String TITLE_LINK_SELECTOR = "a.css-15qlil8";
    private static final String COURSE_SELECTOR = "span.css-x4152s";

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final RestTemplate restTemplate;
    private final EduSyncProperties properties;

    public QueraAssignmentSource(
            @Qualifier("sourceRestTemplate") RestTemplate restTemplate,
            EduSyncProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public List<RawAssignment> fetchAssignments(String sessionToken) {
        String html = fetchCoursePage(sessionToken);
        List<RawAssignment> assignments = parse(html);
        log.info("Fetched assignments from Quera: count={}", assignments.size());
        return assignments;
    }

    @Override
    public boolean isSessionValid(String sessionToken) {
        try {
            fetchCoursePage(sessionToken);
            return true;
        } catch (SourceException e) {
            if (e.getReason() == Reason.SESSION_INVALID) {
                return false;
            }
            throw e;
        }
    }

    private String fetchCoursePage(String sessionToken) {
        String url = properties.getQuera().getBaseUrl() + properties.getQuera().getCoursePath();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaders.COOKIE, "session_id=" + sessionToken);

        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                log.warn("Quera rejected session: status={}", e.getStatusCode());
                throw new SourceException(Reason.SESSION_INVALID, "Quera session is invalid or expired", e);
            }
            log.error("Quera request failed: status={}", e.getStatusCode());
            throw new SourceException(Reason.UNAVAILABLE, "Quera returned " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Quera request error: {}", e.getMessage());
            throw new SourceException(Reason.UNAVAILABLE, "Quera is unreachable: " + e.getMessage(), e);
        }

        if (response.getStatusCode().is3xxRedirection()) {
            URI location = response.getHeaders().getLocation();
            if (location != null && location.toString().contains("login")) {
                log.warn("Quera redirected to login page: location={}", location);
                throw new SourceException(Reason.SESSION_INVALID, "Quera session is invalid or expired");
            }
            throw new SourceException(Reason.UNAVAILABLE, "Unexpected redirect from Quera: " + location);
        }

        // Quera 페이지는 charset 헤더와 무관하게 UTF-8
        return response.getBody() != null ? new String(response.getBody(), StandardCharsets.UTF_8) : "";
    }

    List<RawAssignment> parse(String html) {
        Document document = Jsoup.parse(html, properties.getQuera().getBaseUrl());

        boolean hasDeadlineSection = document.select("h2").stream()
                .anyMatch(heading -> withoutZwnj(heading.text()).equals(withoutZwnj(DEADLINE_SECTION_TITLE)));
        if (!hasDeadlineSection) {
            log.warn("Could not find deadline section on Quera course page");
            return List.of();
        }

        List<RawAssignment> assignments = new ArrayList<>();
        for (Element row : document.select(ROW_SELECTOR)) {
            Element day = row.selectFirst(DAY_SELECTOR);
            Element month = row.selectFirst(MONTH_SELECTOR);
            Element titleLink = row.selectFirst(TITLE_LINK_SELECTOR);
            Element course = row.selectFirst(COURSE_SELECTOR);

            if (day == null || month == null || titleLink == null || course == null) {
                log.warn("Skipping incomplete assignment row: {}", row.text());
                continue;
            }

            assignments.add(RawAssignment.builder()
                    .title(titleLink.text().strip())
                    .course(course.text().strip())
                    .dateText(day.text().strip() + " " + month.text().strip())
                    .link(absoluteLink(titleLink))
                    .build());
        }
        return assignments;
    }

    private static String withoutZwnj(String text) {
        return text.replace("\u200C", "").strip();
    }

    private String absoluteLink(Element titleLink) {
        String absolute = titleLink.absUrl("href");
        if (!absolute.isEmpty()) {
            return absolute;
        }
        return properties.getQuera().getBaseUrl() + titleLink.attr("href");
    }
}
