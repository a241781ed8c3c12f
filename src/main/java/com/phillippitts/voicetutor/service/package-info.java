/**
 * Turn-processing services.
 *
 * <ul>
 *   <li>{@code gating} - rejects unusable input before any work is queued</li>
 *   <li>{@code queue} - one serial queue per session, with barge-in</li>
 *   <li>{@code resilience} - retrying circuit breaker around the generation backend</li>
 *   <li>{@code cache} - semantic cache of generated answers</li>
 *   <li>{@code conversation} - per-session dialog state and answer checking</li>
 *   <li>{@code orchestration} - ties the above together for one turn</li>
 * </ul>
 *
 * @see com.phillippitts.voicetutor.service.orchestration.TurnOrchestrator
 */
package com.phillippitts.voicetutor.service;
