package com.phillippitts.voicetutor.service.resilience;

/**
 * Circuit breaker states. OPEN rejects every call; HALF_OPEN lets calls through to probe recovery.
 */
public enum CircuitState { CLOSED, OPEN, HALF_OPEN }
