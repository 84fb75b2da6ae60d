/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application, following a
 * 3-tier architecture where presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for the completion API</li>
 *   <li>{@code presentation.dto} - request/response records of the wire format (snake_case JSON)</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they apply defaults, delegate to
 * {@link com.phillippitts.selfconsistency.service.aggregation.ReasoningAggregationService} and let
 * the global handler translate exceptions.
 */
package com.phillippitts.selfconsistency.presentation;
