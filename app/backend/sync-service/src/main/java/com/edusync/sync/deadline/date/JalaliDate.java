package com.edusync.sync.deadline.date;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 자랄리(페르시아 태양력) 날짜
 *
 * <p>33년 주기 윤년 경계 테이블을 이용한 정수 연산으로 그레고리력과 상호 변환합니다.
 * 지원 범위는 자랄리 -61년 ~ 3177년입니다.</p>
 *
 * @param year  자랄리 연도
 * @param month 1(Farvardin) ~ 12(Esfand)
 * @param day   1 ~ 해당 월 길이
 */
public record JalaliDate(int year, int month, int day) {

    private static final int[] BREAKS = {
            -61, 9, 38, 199, 426, 686, 756, 818, 1111, 1181, 1210,
            1635, 2060, 2097, 2192, 2262, 2324, 2394, 2456, 3178
    };

    public JalaliDate {
        if (!isValid(year, month, day)) {
            throw new DateTimeException("Invalid Jalali date: " + year + "/" + month + "/" + day);
        }
    }

    public static boolean isValid(int year, int month, int day) {
        if (year < BREAKS[0] || year >= BREAKS[BREAKS.length - 1]) {
            return false;
        }
        if (month < 1 || month > 12) {
            return false;
        }
        return day >= 1 && day <= monthLength(year, month);
    }

    public static boolean isLeapYear(int year) {
        return yearInfo(year).leap() == 0;
    }

    public static int monthLength(int year, int month) {
        if (month <= 6) {
            return 31;
        }
        if (month <= 11) {
            return 30;
        }
        return isLeapYear(year) ? 30 : 29;
    }

    public static JalaliDate fromGregorian(LocalDate date) {
        int jy = date.getYear() - 621;
        YearInfo info = yearInfo(jy);
        LocalDate farvardinFirst = LocalDate.of(date.getYear(), 3, info.march());
        int k = (int) ChronoUnit.DAYS.between(farvardinFirst, date);

        if (k >= 0) {
            if (k <= 185) {
                return new JalaliDate(jy, 1 + k / 31, k % 31 + 1);
            }
            k -= 186;
        } else {
            // 1 Farvardin 이전이면 전년도 하반기
            jy -= 1;
            k += 179;
            if (info.leap() == 1) {
                k += 1;
            }
        }
        return new JalaliDate(jy, 7 + k / 30, k % 30 + 1);
    }

    public LocalDate toGregorian() {
        YearInfo info = yearInfo(year);
        int dayOfYear = (month - 1) * 31 - (month / 7) * (month - 7) + day - 1;
        return LocalDate.of(info.gregorianYear(), 3, info.march()).plusDays(dayOfYear);
    }

    /**
     * @return leap 윤년 주기 내 위치 (0이면 윤년), gregorianYear 1 Farvardin이 속한 그레고리 연도,
     * march 1 Farvardin의 3월 일자
     */
    private static YearInfo yearInfo(int jy) {
        if (jy < BREAKS[0] || jy >= BREAKS[BREAKS.length - 1]) {
            throw new DateTimeException("Jalali year out of supported range: " + jy);
        }

        int gy = jy + 621;
        int leapJ = -14;
        int jp = BREAKS[0];
        int jump = 0;

        for (int i = 1; i < BREAKS.length; i++) {
            int jm = BREAKS[i];
            jump = jm - jp;
            if (jy < jm) {
                break;
            }
            leapJ += (jump / 33) * 8 + (jump % 33) / 4;
            jp = jm;
        }

        int n = jy - jp;
        leapJ += (n / 33) * 8 + ((n % 33) + 3) / 4;
        if ((jump % 33) == 4 && jump - n == 4) {
            leapJ += 1;
        }

        int leapG = gy / 4 - ((gy / 100 + 1) * 3) / 4 - 150;
        int march = 20 + leapJ - leapG;

        if (jump - n < 6) {
            n = n - jump + ((jump + 4) / 33) * 33;
        }
        int leap = (((n + 1) % 33) - 1) % 4;
        if (leap == -1) {
            leap = 4;
        }
        return new YearInfo(leap, gy, march);
    }

    private record YearInfo(int leap, int gregorianYear, int march) {
    }
}
