/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicetutor.exception.VoiceTutorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicetutor.exception.BackendException} - The generation backend
 *       failed; carries the backend status when one was reported</li>
 *   <li>{@link com.phillippitts.voicetutor.exception.BackendTimeoutException} - A single backend
 *       attempt exceeded its timeout</li>
 *   <li>{@link com.phillippitts.voicetutor.exception.CircuitOpenException} - Fail-fast rejection
 *       while the circuit breaker is open</li>
 *   <li>{@link com.phillippitts.voicetutor.exception.TurnCancelledException} - A queued operation
 *       was superseded by a newer turn</li>
 * </ul>
 *
 * <p>Gated input and invalid dialog transitions are not exceptions: both are ordinary return
 * values. None of these exceptions reach the user; the turn orchestrator converts every one of
 * them into a response.
 *
 * @see com.phillippitts.voicetutor.service.orchestration.DefaultTurnOrchestrator
 * @since 1.0
 */
package com.phillippitts.voicetutor.exception;
