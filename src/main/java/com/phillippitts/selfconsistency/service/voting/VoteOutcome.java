package com.phillippitts.selfconsistency.service.voting;

import com.phillippitts.selfconsistency.domain.ConsistencyGroup;

import java.util.List;
import java.util.Objects;

/**
 * Result of a consistency vote.
 *
 * @param groups              all groups, ranked (winner first)
 * @param winner              the winning group
 * @param agreementConfidence winner size / successful samples
 * @param successfulSamples   number of answers voted on
 */
public record VoteOutcome(List<ConsistencyGroup> groups, ConsistencyGroup winner, double agreementConfidence,
                          int successfulSamples) {

    public VoteOutcome {
        groups = List.copyOf(groups);
        Objects.requireNonNull(winner, "winner");
    }

    public String preliminaryAnswer() {
        return winner.representativeAnswer();
    }

    public int distinctAnswers() {
        return groups.size();
    }
}
