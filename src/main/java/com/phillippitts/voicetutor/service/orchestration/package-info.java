/**
 * Turn orchestration: gate, enqueue, answer from cache or backend, fall back locally.
 *
 * <p>The orchestrator never lets a backend failure reach the caller. Open circuits, timeouts and
 * backend errors all turn into a canned response from
 * {@link com.phillippitts.voicetutor.service.orchestration.FallbackResponder}.
 *
 * <p>Applications plug in text generation by declaring a
 * {@link com.phillippitts.voicetutor.service.orchestration.GenerationBackend} bean.
 *
 * @since 1.0
 */
package com.phillippitts.voicetutor.service.orchestration;
