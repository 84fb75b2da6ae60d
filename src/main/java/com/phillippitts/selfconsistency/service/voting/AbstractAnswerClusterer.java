package com.phillippitts.selfconsistency.service.voting;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for clusterers implementing the greedy assignment shared by all strategies.
 *
 * <p>Template method: {@link #partition(List)} normalizes every answer once, then walks the
 * answers in order and places each in the first existing group whose representative (the
 * group's first member) it matches according to {@link #matches(String, String)}, or opens a
 * new group. Blank answers only ever match other blank answers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * public class ExactClusterer extends AbstractAnswerClusterer {
 *     @Override
 *     protected boolean matches(String key, String representativeKey) {
 *         return key.equals(representativeKey);
 *     }
 * }
 * }</pre>
 */
public abstract class AbstractAnswerClusterer implements AnswerClusterer {

    @Override
    public final List<List<Integer>> partition(List<String> answers) {
        Objects.requireNonNull(answers, "answers");
        List<String> keys = answers.stream().map(AnswerNormalizer::key).toList();

        List<List<Integer>> groups = new ArrayList<>();
        List<String> representativeKeys = new ArrayList<>();
        for (int pos = 0; pos < keys.size(); pos++) {
            String key = keys.get(pos);
            int target = -1;
            for (int g = 0; g < groups.size(); g++) {
                if (sameAnswer(key, representativeKeys.get(g))) {
                    target = g;
                    break;
                }
            }
            if (target < 0) {
                List<Integer> group = new ArrayList<>();
                group.add(pos);
                groups.add(group);
                representativeKeys.add(key);
            } else {
                groups.get(target).add(pos);
            }
        }
        return groups.stream().map(List::copyOf).toList();
    }

    private boolean sameAnswer(String key, String representativeKey) {
        if (key.isEmpty() || representativeKey.isEmpty()) {
            return key.isEmpty() && representativeKey.isEmpty();
        }
        return matches(key, representativeKey);
    }

    /**
     * Decides whether two non-blank normalized keys denote the same answer.
     *
     * @param key               key of the answer being placed (never blank)
     * @param representativeKey key of the group representative (never blank)
     */
    protected abstract boolean matches(String key, String representativeKey);
}
