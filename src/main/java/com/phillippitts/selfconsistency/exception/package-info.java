/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.selfconsistency.exception.ReasoningEngineException} - Base exception</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.ValidationException} - Bad request parameters
 *       (HTTP 400), raised before any model call</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.MalformedStepException} - Model output failed
 *       step parsing after bounded retries</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.ProviderException} - Model backend call failed</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.ReasoningPathException} - One sample failed;
 *       isolated from its siblings</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.AggregationException} - Too few samples
 *       succeeded (HTTP 502)</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.AggregationTimeoutException} - Deadline
 *       exceeded before enough samples completed (HTTP 504)</li>
 *   <li>{@link com.phillippitts.selfconsistency.exception.DocumentExtractionException} - Uploaded
 *       document could not be read (HTTP 400)</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP responses in
 * {@code presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.selfconsistency.exception;
