package com.phillippitts.selfconsistency.service.voting;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizedMatchClustererTest {

    private final NormalizedMatchClusterer clusterer = new NormalizedMatchClusterer();

    @Test
    void groupsAnswersWithEqualKeys() {
        List<List<Integer>> groups = clusterer.partition(List.of("Paris", "Lyon", "paris.", "PARIS!"));

        assertThat(groups).containsExactly(List.of(0, 2, 3), List.of(1));
    }

    @Test
    void differentWordingStaysApart() {
        assertThat(clusterer.partition(List.of("Paris", "The capital is Paris"))).hasSize(2);
    }

    @Test
    void blankAnswersOnlyMatchEachOther() {
        List<List<Integer>> groups = clusterer.partition(List.of("", "Paris", "  "));

        assertThat(groups).containsExactly(List.of(0, 2), List.of(1));
    }

    @Test
    void emptyInputGivesNoGroups() {
        assertThat(clusterer.partition(List.of())).isEmpty();
    }
}
