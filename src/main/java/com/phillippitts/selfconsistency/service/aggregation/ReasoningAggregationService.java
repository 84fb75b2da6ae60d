package com.phillippitts.selfconsistency.service.aggregation;

import com.phillippitts.selfconsistency.domain.AggregateResult;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.exception.AggregationException;
import com.phillippitts.selfconsistency.exception.AggregationTimeoutException;
import com.phillippitts.selfconsistency.exception.ValidationException;

/**
 * Entry point of the reasoning engine: answers one prompt by self-consistency over
 * several chain-of-thought paths followed by a reflection pass.
 */
public interface ReasoningAggregationService {

    /**
     * Runs the full pipeline: validate, fan out, vote, reflect, account, compose.
     *
     * @param request the request
     * @return the aggregate result
     * @throws ValidationException         when the request is out of bounds (no model call is made)
     * @throws AggregationException        when too few reasoning paths succeeded
     * @throws AggregationTimeoutException when the deadline expired with too few paths
     */
    AggregateResult runAggregation(PromptRequest request);
}
