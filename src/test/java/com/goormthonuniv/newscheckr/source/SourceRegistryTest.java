package com.goormthonuniv.newscheckr.source;

import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.domain.SourceRating;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryTest {

    private final SourceRegistry registry = SourceRegistry.defaults();

    @ParameterizedTest
    @ValueSource(strings = {
            "reuters.com", "REUTERS.COM", "  www.reuters.com ", "https://www.reuters.com/world/us/some-story",
            "http://reuters.com"
    })
    @DisplayName("도메인 표기가 달라도 정규화 후 같은 평판을 찾는다")
    void lookupNormalizesDomain(String input) {
        SourceRating rating = registry.lookup(input);

        assertThat(rating.domain()).isEqualTo("reuters.com");
        assertThat(rating.reputationScore()).isEqualTo(90.0);
        assertThat(rating.knownBias()).isEqualTo(Bias.CENTER);
        assertThat(rating.known()).isTrue();
    }

    @Test
    @DisplayName("미등록 도메인은 중립 평판(50, Center)을 돌려주고 예외를 던지지 않는다")
    void unknownDomainIsNeutral() {
        SourceRating rating = registry.lookup("my-personal-blog.example");

        assertThat(rating.reputationScore()).isEqualTo(SourceRating.NEUTRAL_SCORE);
        assertThat(rating.knownBias()).isEqualTo(Bias.CENTER);
        assertThat(rating.known()).isFalse();
    }

    @Test
    @DisplayName("null, 공백 입력도 중립 평판")
    void blankInputIsNeutral() {
        assertThat(registry.lookup(null).known()).isFalse();
        assertThat(registry.lookup("   ").reputationScore()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("www. 는 한 번만 제거하고 서브도메인은 정확히 일치해야 한다")
    void exactMatchOnly() {
        assertThat(SourceRegistry.normalize("www.www.cnn.com")).isEqualTo("www.cnn.com");
        assertThat(registry.lookup("edition.cnn.com").known()).isFalse();
        assertThat(registry.lookup("cnn.com").knownBias()).isEqualTo(Bias.LEFT);
    }

    @Test
    @DisplayName("기본 테이블은 20개 이상이고 도메인 오름차순으로 나열된다")
    void listSourcesSorted() {
        List<SourceRating> sources = registry.listSources();

        assertThat(sources).hasSizeGreaterThanOrEqualTo(20);
        assertThat(sources).extracting(SourceRating::domain).isSorted();
        assertThat(sources).allMatch(SourceRating::known);
    }

    @Test
    @DisplayName("중복 도메인(정규화 기준)은 구성 시점에 거절")
    void duplicateDomainRejected() {
        List<SourceRating> entries = List.of(
                SourceRating.known("example.com", 70, Bias.CENTER),
                SourceRating.known("www.Example.com", 60, Bias.LEFT));

        assertThatThrownBy(() -> new SourceRegistry(entries))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("example.com");
    }

    @Test
    @DisplayName("평판 점수는 0~100 범위 밖이면 생성 불가")
    void reputationRangeValidated() {
        assertThatThrownBy(() -> SourceRating.known("bad.com", 101, Bias.CENTER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SourceRating.known("bad.com", Double.NaN, Bias.CENTER))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
