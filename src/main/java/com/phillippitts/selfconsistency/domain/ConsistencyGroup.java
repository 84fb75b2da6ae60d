package com.phillippitts.selfconsistency.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Samples whose final answers were judged equivalent.
 *
 * @param sampleIndices        member sample indices, ascending
 * @param representativeAnswer full final answer of the lowest-index member
 * @param answerKey            normalized key the group was matched on
 * @param meanSelfConfidence   mean self-reported confidence of the members (0-100)
 */
public record ConsistencyGroup(
        List<Integer> sampleIndices,
        String representativeAnswer,
        String answerKey,
        double meanSelfConfidence
) {

    public ConsistencyGroup {
        Objects.requireNonNull(sampleIndices, "sampleIndices");
        if (sampleIndices.isEmpty()) {
            throw new IllegalArgumentException("a group needs at least one sample");
        }
        sampleIndices = sampleIndices.stream().sorted().toList();
        Objects.requireNonNull(representativeAnswer, "representativeAnswer");
        Objects.requireNonNull(answerKey, "answerKey");
    }

    @JsonProperty
    public int size() {
        return sampleIndices.size();
    }

    public int lowestSampleIndex() {
        return sampleIndices.get(0);
    }

    public boolean contains(int sampleIndex) {
        return sampleIndices.contains(sampleIndex);
    }
}
