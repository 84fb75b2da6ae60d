package com.phillippitts.selfconsistency.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReasoningPathTest {

    @Test
    void copiesStepsDefensively() {
        List<ReasoningStep> steps = new ArrayList<>(List.of(new ReasoningStep(1, "r", "c")));
        ReasoningPath path = new ReasoningPath(1, steps, "Paris", 90, List.of(new UsageRecord(1, 1)), 3);

        steps.add(new ReasoningStep(2, "r2", null));

        assertThat(path.steps()).hasSize(1);
    }

    @Test
    void totalUsageSumsCalls() {
        ReasoningPath path = new ReasoningPath(1, List.of(), "Paris", 90,
                List.of(new UsageRecord(10, 20), new UsageRecord(5, 5)), 3);

        assertThat(path.totalUsage()).isEqualTo(new UsageRecord(15, 25));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new ReasoningPath(0, List.of(), "a", 50, List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReasoningPath(1, List.of(), "a", 101, List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReasoningStep(0, "r", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void groupSortsIndicesAndReportsLowest() {
        ConsistencyGroup group = new ConsistencyGroup(List.of(4, 2, 3), "Paris", "paris", 80);

        assertThat(group.sampleIndices()).containsExactly(2, 3, 4);
        assertThat(group.size()).isEqualTo(3);
        assertThat(group.lowestSampleIndex()).isEqualTo(2);
        assertThat(group.contains(3)).isTrue();
    }
}
