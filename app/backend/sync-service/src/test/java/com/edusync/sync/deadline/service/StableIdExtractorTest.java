package com.edusync.sync.deadline.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StableIdExtractor 테스트")
class StableIdExtractorTest {

    private final StableIdExtractor extractor = new StableIdExtractor();

    @Test
    @DisplayName("과제 URL에서 숫자 ID 추출")
    void extract_Success() {
        assertThat(extractor.extract("https://quera.org/course/assignments/85830/problems"))
                .contains("85830");
        assertThat(extractor.extract("/course/assignments/12/"))
                .contains("12");
    }

    @Test
    @DisplayName("패턴이 없으면 빈 값")
    void extract_NoMatch() {
        assertThat(extractor.extract("https://quera.org/course/assignments/85830")).isEmpty();
        assertThat(extractor.extract("https://quera.org/course/assignments/abc/problems")).isEmpty();
        assertThat(extractor.extract("https://quera.org/course")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
