/**
 * Circuit breaker for the generation backend.
 *
 * <p>The breaker opens on either a failure-rate threshold or a cumulative count of distress responses
 * (429/5xx, timeouts). A scheduled task moves it to HALF_OPEN after the cooldown; one probe
 * decides whether it closes again.
 */
package com.phillippitts.voicetutor.service.resilience;
