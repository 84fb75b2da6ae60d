package com.phillippitts.selfconsistency.service.compose;

import com.phillippitts.selfconsistency.domain.AggregateResult;
import com.phillippitts.selfconsistency.domain.ConsistencyGroup;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningPath;
import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.service.accounting.AccountingReport;
import com.phillippitts.selfconsistency.service.reflection.ReflectionOutcome;
import com.phillippitts.selfconsistency.service.sampling.FanOutResult;
import com.phillippitts.selfconsistency.service.voting.VoteOutcome;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Assembles the immutable {@link AggregateResult} and the human-readable reasoning summary.
 */
@Component
public class ResultComposer {

    private final ConfidenceBlender blender;

    public ResultComposer(ConfidenceBlender blender) {
        this.blender = Objects.requireNonNull(blender, "blender");
    }

    /**
     * Summary of the vote, e.g. {@code "Generated 5 independent reasoning paths; agreement 4/5. ..."}.
     * Built before reflection because the reflection prompt includes it.
     */
    public String summarize(FanOutResult fanOut, VoteOutcome vote) {
        int obtained = fanOut.obtained();
        StringBuilder sb = new StringBuilder();
        sb.append("Generated ").append(obtained).append(" independent reasoning paths; agreement ")
                .append(vote.winner().size()).append('/').append(obtained).append('.');
        sb.append(String.format(Locale.ROOT, " Average self-confidence %.1f%%, agreement %.1f%%.",
                vote.winner().meanSelfConfidence(), vote.agreementConfidence() * 100.0));
        if (vote.distinctAnswers() > 1) {
            sb.append(" Found ").append(vote.distinctAnswers()).append(" distinct answer patterns.");
        } else {
            sb.append(" All paths converged on the same answer.");
        }
        if (fanOut.degraded()) {
            sb.append(" Degraded: requested ").append(fanOut.requested())
                    .append(", obtained ").append(obtained).append('.');
            if (fanOut.timedOut()) {
                sb.append(" Request deadline expired during sampling.");
            }
        }
        return sb.toString();
    }

    public AggregateResult compose(PromptRequest request, String modelUsed, FanOutResult fanOut, VoteOutcome vote,
                                   String summary, ReflectionOutcome reflection, AccountingReport accounting) {
        ConsistencyGroup winner = vote.winner();
        double blended = blender.blend(vote.agreementConfidence(), winner.meanSelfConfidence(),
                reflection.skipped() ? null : reflection.confidence());

        return new AggregateResult(
                request.prompt(),
                modelUsed,
                request.modelTier(),
                vote.preliminaryAnswer(),
                reflection.finalAnswer(),
                representativeChain(fanOut.paths(), winner),
                fanOut.paths(),
                vote.groups(),
                vote.agreementConfidence(),
                winner.meanSelfConfidence(),
                reflection.reasoning(),
                reflection.confidence(),
                reflection.skipped(),
                reflection.skipReason(),
                blended,
                summary,
                fanOut.requested(),
                fanOut.obtained(),
                fanOut.degraded(),
                fanOut.timedOut(),
                accounting.tokenUsage(),
                accounting.cost(),
                accounting.timing());
    }

    /**
     * Steps of the lowest-index path in the winning group.
     */
    static List<ReasoningStep> representativeChain(List<ReasoningPath> paths, ConsistencyGroup winner) {
        int index = winner.lowestSampleIndex();
        return paths.stream()
                .filter(p -> p.sampleIndex() == index)
                .findFirst()
                .map(ReasoningPath::steps)
                .orElse(List.of());
    }
}
