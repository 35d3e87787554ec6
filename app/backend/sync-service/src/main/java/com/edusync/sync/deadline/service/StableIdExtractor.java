package com.edusync.sync.deadline.service;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 과제 URL에서 stableId를 추출합니다.
 * 예: https://quera.org/course/assignments/85830/problems → 85830
 */
@Component
public class StableIdExtractor {

    private static final Pattern ASSIGNMENT_ID = Pattern.compile("/assignments/(\\d+)/");

    public Optional<String> extract(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = ASSIGNMENT_ID.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
