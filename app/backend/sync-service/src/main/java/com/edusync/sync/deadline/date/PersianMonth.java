package com.edusync.sync.deadline.date;

import java.util.Arrays;
import java.util.Optional;

/**
 * 페르시아어 월 이름
 */
public enum PersianMonth {
    FARVARDIN("فروردین"),
    ORDIBEHESHT("اردیبهشت"),
    KHORDAD("خرداد"),
    TIR("تیر"),
    MORDAD("مرداد"),
    SHAHRIVAR("شهریور"),
    MEHR("مهر"),
    ABAN("آبان"),
    AZAR("آذر"),
    DEY("دی"),
    BAHMAN("بهمن"),
    ESFAND("اسفند");

    private final String persianName;

    PersianMonth(String persianName) {
        this.persianName = persianName;
    }

    public String getPersianName() {
        return persianName;
    }

    /**
     * @return 1 ~ 12
     */
    public int getNumber() {
        return ordinal() + 1;
    }

    /**
     * 월 이름으로 조회합니다. 아랍어 yeh/kaf 변형, 제로폭 비결합자(ZWNJ), 앞뒤 공백은 정규화 후 비교합니다.
     */
    public static Optional<PersianMonth> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        return Arrays.stream(values())
                .filter(month -> month.persianName.equals(normalized))
                .findFirst();
    }

    static String normalize(String text) {
        return text.strip()
                .replace('\u064A', '\u06CC')  // Arabic yeh
                .replace('\u0649', '\u06CC')  // alef maksura
                .replace('\u0643', '\u06A9')  // Arabic kaf
                .replace("\u200C", "");
    }
}
