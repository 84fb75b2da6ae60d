package com.phillippitts.selfconsistency.service.chain;

import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.domain.UsageRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Running record of one path: the steps it has completed and the tokens it has spent.
 *
 * <p>Written by the worker thread driving the path and read by the fan-out, which may look at it
 * after giving up on the path at the request deadline. All access is synchronized.
 *
 * <p>Usage of individual model calls is held as pending until the step they belong to settles,
 * so a step that fails after some of its calls returned still accounts for those calls.
 */
public final class PathProgress {

    private final List<ReasoningStep> steps = new ArrayList<>();
    private final List<UsageRecord> settledUsage = new ArrayList<>();
    private UsageRecord pendingUsage = UsageRecord.ZERO;

    /** Usage of one model call that returned, before its step is known to succeed or fail. */
    public synchronized void recordCall(UsageRecord usage) {
        pendingUsage = pendingUsage.plus(usage);
    }

    /**
     * Settles a successful step.
     *
     * @param step      the step produced
     * @param callUsage usage of every call made for it, as reported by the generator
     */
    public synchronized void stepCompleted(ReasoningStep step, List<UsageRecord> callUsage) {
        steps.add(step);
        settledUsage.addAll(callUsage);
        pendingUsage = UsageRecord.ZERO;
    }

    /**
     * Settles a failed step.
     *
     * @param reportedUsage usage the failure reports for the step, or null when it reports none;
     *                      in that case the calls recorded so far for the step are kept
     */
    public synchronized void stepFailed(UsageRecord reportedUsage) {
        UsageRecord spent = reportedUsage != null ? reportedUsage : pendingUsage;
        if (spent.totalTokens() > 0) {
            settledUsage.add(spent);
        }
        pendingUsage = UsageRecord.ZERO;
    }

    public synchronized List<ReasoningStep> steps() {
        return List.copyOf(steps);
    }

    public synchronized int completedSteps() {
        return steps.size();
    }

    public synchronized List<UsageRecord> settledUsage() {
        return List.copyOf(settledUsage);
    }

    /** Tokens spent so far, including calls of a step still in progress. */
    public synchronized UsageRecord usage() {
        return UsageRecord.sum(settledUsage).plus(pendingUsage);
    }
}
