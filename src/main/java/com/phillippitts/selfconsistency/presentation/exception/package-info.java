/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.selfconsistency.exception.ValidationException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.DocumentExtractionException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.AggregationException} → 502 Bad Gateway</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.AggregationTimeoutException} → 504 Gateway Timeout</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "error_code": "ValidationException",
 *   "message": "Invalid request",
 *   "details": "Invalid request field 'num_cot': must be between 1 and 10, got 11",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.selfconsistency.presentation.exception;
