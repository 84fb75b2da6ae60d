package com.phillippitts.selfconsistency.service.voting;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenOverlapClustererTest {

    private final TokenOverlapClusterer clusterer = new TokenOverlapClusterer(0.5);

    @Test
    void mergesReorderedWording() {
        assertThat(clusterer.partition(List.of("Paris is the capital.", "The capital is Paris")))
                .containsExactly(List.of(0, 1));
    }

    @Test
    void neverMergesAnswerWithItsNegation() {
        assertThat(clusterer.partition(List.of("7 is prime", "7 is not prime"))).hasSize(2);
    }

    @Test
    void respectsThreshold() {
        assertThat(new TokenOverlapClusterer(0.5).partition(List.of("Paris France", "Paris"))).hasSize(1);
        assertThat(new TokenOverlapClusterer(0.6).partition(List.of("Paris France", "Paris"))).hasSize(2);
    }

    @Test
    void zeroOverlapNeverMatchesEvenAtZeroThreshold() {
        assertThat(new TokenOverlapClusterer(0.0).partition(List.of("Paris", "Lyon"))).hasSize(2);
    }

    @Test
    void jaccardOverTokens() {
        assertThat(TokenOverlapClusterer.jaccard(List.of("a", "b"), List.of("b", "c"))).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(TokenOverlapClusterer.jaccard(List.of(), List.of())).isZero();
    }

    @Test
    void rejectsInvalidThreshold() {
        assertThatThrownBy(() -> new TokenOverlapClusterer(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenOverlapClusterer(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
