package com.phillippitts.selfconsistency.service.voting;

import com.phillippitts.selfconsistency.domain.ConsistencyGroup;
import com.phillippitts.selfconsistency.domain.ReasoningPath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Majority vote over the final answers of the successful paths.
 *
 * <p>Ranking: larger group first; equal sizes are ordered by higher mean self-confidence, then by
 * lowest member sample index. The outcome depends only on the paths' answers, confidences and
 * indices, never on the order in which paths finished.
 */
@Component
public class ConsistencyVoter {

    static final Comparator<ConsistencyGroup> RANKING = Comparator
            .comparingInt(ConsistencyGroup::size).reversed()
            .thenComparing(Comparator.comparingDouble(ConsistencyGroup::meanSelfConfidence).reversed())
            .thenComparingInt(ConsistencyGroup::lowestSampleIndex);

    private final AnswerClusterer clusterer;

    public ConsistencyVoter(AnswerClusterer clusterer) {
        this.clusterer = Objects.requireNonNull(clusterer, "clusterer");
    }

    /**
     * @param paths successful paths (any order, at least one)
     * @throws IllegalArgumentException if {@code paths} is empty
     */
    public VoteOutcome vote(List<ReasoningPath> paths) {
        Objects.requireNonNull(paths, "paths");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("no paths to vote on");
        }
        List<ReasoningPath> ordered = paths.stream()
                .sorted(Comparator.comparingInt(ReasoningPath::sampleIndex))
                .toList();
        List<String> answers = ordered.stream().map(ReasoningPath::finalAnswer).toList();

        List<ConsistencyGroup> groups = new ArrayList<>();
        for (List<Integer> positions : clusterer.partition(answers)) {
            groups.add(toGroup(ordered, positions));
        }
        groups.sort(RANKING);

        ConsistencyGroup winner = groups.get(0);
        double agreement = winner.size() / (double) ordered.size();
        return new VoteOutcome(groups, winner, agreement, ordered.size());
    }

    private static ConsistencyGroup toGroup(List<ReasoningPath> ordered, List<Integer> positions) {
        List<Integer> indices = new ArrayList<>(positions.size());
        double confidenceSum = 0.0;
        for (int pos : positions) {
            ReasoningPath path = ordered.get(pos);
            indices.add(path.sampleIndex());
            confidenceSum += path.selfConfidence();
        }
        String representative = ordered.get(positions.get(0)).finalAnswer();
        return new ConsistencyGroup(indices, representative, AnswerNormalizer.key(representative),
                confidenceSum / positions.size());
    }
}
