package com.phillippitts.selfconsistency.service.sampling;

import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.exception.AggregationException;
import com.phillippitts.selfconsistency.exception.AggregationTimeoutException;
import com.phillippitts.selfconsistency.util.Deadline;

/**
 * Runs the K independent reasoning paths of a request concurrently.
 *
 * @see DefaultSampleFanOut
 */
public interface SampleFanOut {

    /**
     * Runs {@code request.sampleCount()} paths and waits for them, at most until the deadline.
     *
     * <p>A failing path never affects its siblings; it is reported in
     * {@link FanOutResult#failures()}.
     *
     * @throws AggregationTimeoutException when the deadline expired and too few paths completed
     * @throws AggregationException        when too few paths succeeded
     */
    FanOutResult fanOut(PromptRequest request, Deadline deadline);
}
