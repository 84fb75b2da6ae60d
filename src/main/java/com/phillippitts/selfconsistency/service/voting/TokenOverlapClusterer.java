package com.phillippitts.selfconsistency.service.voting;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups answers whose keys are identical or whose content tokens overlap enough.
 *
 * <p>Jaccard similarity = |A ∩ B| / |A ∪ B| over content tokens (stopwords removed). Two answers
 * where exactly one is negated ("X is prime" / "X is not prime") are never merged, however much
 * they overlap.
 */
public final class TokenOverlapClusterer extends AbstractAnswerClusterer {

    private final double threshold;

    /**
     * @param threshold minimum Jaccard similarity (0.0 to 1.0)
     * @throws IllegalArgumentException if threshold is not in [0,1]
     */
    public TokenOverlapClusterer(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold in [0,1]");
        }
        this.threshold = threshold;
    }

    @Override
    protected boolean matches(String key, String representativeKey) {
        if (key.equals(representativeKey)) {
            return true;
        }
        if (AnswerNormalizer.isNegated(key) != AnswerNormalizer.isNegated(representativeKey)) {
            return false;
        }
        double similarity = jaccard(AnswerNormalizer.contentTokens(key),
                AnswerNormalizer.contentTokens(representativeKey));
        return similarity > 0.0 && similarity >= threshold;
    }

    double threshold() {
        return threshold;
    }

    static double jaccard(List<String> a, List<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(new HashSet<>(b));
        return intersection.size() / (double) union.size();
    }
}
