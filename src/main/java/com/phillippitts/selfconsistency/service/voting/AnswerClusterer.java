package com.phillippitts.selfconsistency.service.voting;

import java.util.List;

/**
 * Strategy that partitions final answers into groups of equivalent answers.
 *
 * <p>Implementations must be pure and deterministic: the same input list always yields
 * the same partition.
 */
public interface AnswerClusterer {

    /**
     * Partitions answers.
     *
     * @param answers answers in sample-index order
     * @return groups of positions into {@code answers}; every position appears in exactly one group,
     *         groups are ordered by their first position and positions within a group ascend
     */
    List<List<Integer>> partition(List<String> answers);
}
