package com.phillippitts.selfconsistency.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.phillippitts.selfconsistency.domain.AggregateResult;

/**
 * Response of {@code POST /v1/completions}: the aggregate result fields at top level,
 * plus {@code document_info} when a PDF was uploaded.
 */
public record CompletionResponseBody(
        @JsonUnwrapped AggregateResult result,
        @JsonInclude(JsonInclude.Include.NON_NULL) DocumentInfo documentInfo
) {
}
