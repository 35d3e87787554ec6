package com.edusync.sync.deadline.date;

import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.deadline.exception.InvalidDateFormatException;
import com.edusync.sync.deadline.exception.InvalidMonthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Quera에 표시되는 "일 월" 형식의 페르시아어 마감일을 그레고리력 날짜로 변환합니다.
 *
 * <p>연도는 표시되지 않으므로 기준 시각의 자랄리 연도를 우선 사용하고,
 * 해당 날짜의 23:59:59가 이미 지났거나 그 해에 존재하지 않는 날짜면 다음 해로 넘깁니다.</p>
 */
@Slf4j
@Component
public class PersianDateNormalizer {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public PersianDateNormalizer(EduSyncProperties properties, Clock clock) {
        this(properties.getTimezone(), clock);
    }

    public PersianDateNormalizer(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * @param dateText "۲۵ اردیبهشت" 형식
     */
    public LocalDate normalize(String dateText) {
        return normalize(dateText, clock.instant());
    }

    public LocalDate normalize(String dateText, Instant referenceNow) {
        if (dateText == null || dateText.isBlank()) {
            throw new InvalidDateFormatException("Empty date text");
        }
        String[] tokens = dateText.strip().split("\\s+");
        if (tokens.length != 2) {
            throw new InvalidDateFormatException("Invalid Persian date format: " + dateText);
        }
        return normalize(tokens[0], tokens[1], referenceNow);
    }

    public LocalDate normalize(String dayToken, String monthToken, Instant referenceNow) {
        int day = parseDay(dayToken);
        PersianMonth month = PersianMonth.fromName(monthToken)
                .orElseThrow(() -> new InvalidMonthException(monthToken));

        int currentYear = JalaliDate.fromGregorian(referenceNow.atZone(zone).toLocalDate()).year();

        // 올해 날짜가 아직 지나지 않았으면 올해, 아니면 내년
        if (JalaliDate.isValid(currentYear, month.getNumber(), day)) {
            LocalDate candidate = new JalaliDate(currentYear, month.getNumber(), day).toGregorian();
            if (!endOfDay(candidate).toInstant().isBefore(referenceNow)) {
                return candidate;
            }
        }

        int nextYear = currentYear + 1;
        if (!JalaliDate.isValid(nextYear, month.getNumber(), day)) {
            throw new InvalidDateFormatException(
                    "Day " + day + " does not exist in " + month.getPersianName());
        }
        LocalDate converted = new JalaliDate(nextYear, month.getNumber(), day).toGregorian();
        log.debug("Rolled deadline over to next Jalali year: day={}, month={}, year={}, date={}",
                day, month, nextYear, converted);
        return converted;
    }

    /**
     * 마감 시각 (해당 일의 23:59:59)
     */
    public ZonedDateTime endOfDay(LocalDate date) {
        return date.atTime(END_OF_DAY).atZone(zone);
    }

    /**
     * 해당 일의 00:00:00
     */
    public ZonedDateTime startOfDay(LocalDate date) {
        return date.atStartOfDay(zone);
    }

    public ZoneId getZone() {
        return zone;
    }

    private int parseDay(String dayToken) {
        if (dayToken == null || dayToken.isBlank()) {
            throw new InvalidDateFormatException("Empty day token");
        }
        String token = dayToken.strip();
        if (token.length() > 2) {
            throw new InvalidDateFormatException("Invalid day: " + dayToken);
        }
        int value = 0;
        for (int i = 0; i < token.length(); i++) {
            // 서양/페르시아/아랍-인도 숫자 모두 허용
            int digit = Character.digit(token.charAt(i), 10);
            if (digit < 0) {
                throw new InvalidDateFormatException("Invalid day: " + dayToken);
            }
            value = value * 10 + digit;
        }
        if (value < 1 || value > 31) {
            throw new InvalidDateFormatException("Day out of range: " + dayToken);
        }
        return value;
    }
}
