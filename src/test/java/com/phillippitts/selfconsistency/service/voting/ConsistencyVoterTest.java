package com.phillippitts.selfconsistency.service.voting;

import com.phillippitts.selfconsistency.domain.ReasoningPath;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.phillippitts.selfconsistency.testutil.TestRequests.path;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsistencyVoterTest {

    private final ConsistencyVoter voter = new ConsistencyVoter(new TokenOverlapClusterer(0.5));

    @Test
    void majorityWins() {
        VoteOutcome outcome = voter.vote(List.of(
                path(1, "Paris", 90), path(2, "Paris", 85), path(3, "paris.", 80),
                path(4, "Paris", 88), path(5, "Lyon", 40)));

        assertThat(outcome.preliminaryAnswer()).isEqualTo("Paris");
        assertThat(outcome.agreementConfidence()).isEqualTo(0.8);
        assertThat(outcome.winner().sampleIndices()).containsExactly(1, 2, 3, 4);
        assertThat(outcome.distinctAnswers()).isEqualTo(2);
        assertThat(outcome.successfulSamples()).isEqualTo(5);
    }

    @Test
    void singlePathHasFullAgreement() {
        VoteOutcome outcome = voter.vote(List.of(path(1, "42", 70)));

        assertThat(outcome.agreementConfidence()).isEqualTo(1.0);
        assertThat(outcome.preliminaryAnswer()).isEqualTo("42");
    }

    @Test
    void sizeTieGoesToHigherMeanConfidence() {
        VoteOutcome outcome = voter.vote(List.of(
                path(1, "Paris", 60), path(2, "Lyon", 90), path(3, "Paris", 60), path(4, "Lyon", 90)));

        assertThat(outcome.preliminaryAnswer()).isEqualTo("Lyon");
        assertThat(outcome.agreementConfidence()).isEqualTo(0.5);
    }

    @Test
    void fullTieGoesToLowestSampleIndex() {
        VoteOutcome outcome = voter.vote(List.of(
                path(2, "Lyon", 80), path(1, "Paris", 80), path(4, "Lyon", 80), path(3, "Paris", 80)));

        assertThat(outcome.preliminaryAnswer()).isEqualTo("Paris");
        assertThat(outcome.winner().lowestSampleIndex()).isEqualTo(1);
    }

    @Test
    void representativeIsLowestIndexMember() {
        VoteOutcome outcome = voter.vote(List.of(path(3, "Paris", 80), path(2, "paris!", 80)));

        assertThat(outcome.preliminaryAnswer()).isEqualTo("paris!");
    }

    @Test
    void outcomeIndependentOfCompletionOrder() {
        List<ReasoningPath> paths = new ArrayList<>(List.of(
                path(1, "Paris", 70), path(2, "Lyon", 95), path(3, "Marseille", 60),
                path(4, "Lyon", 50), path(5, "Paris", 75), path(6, "Nice", 99)));
        VoteOutcome reference = voter.vote(paths);

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(paths, random);
            VoteOutcome shuffled = voter.vote(paths);
            assertThat(shuffled.preliminaryAnswer()).isEqualTo(reference.preliminaryAnswer());
            assertThat(shuffled.groups()).isEqualTo(reference.groups());
        }
    }

    @Test
    void emptyInputIsRejected() {
        assertThatThrownBy(() -> voter.vote(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
