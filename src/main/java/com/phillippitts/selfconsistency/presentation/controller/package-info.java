/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /} - service status</li>
 *   <li>{@code POST /v1/completions} - JSON body, or multipart form with a {@code pdf_file} part</li>
 *   <li>{@code POST /v1/chat/completions} - OpenAI-style chat request; the result is returned in
 *       {@code agentic_metadata}</li>
 * </ul>
 */
package com.phillippitts.selfconsistency.presentation.controller;
