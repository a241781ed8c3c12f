package com.phillippitts.voicetutor.service.orchestration;

/**
 * The upstream text-generation service. Implementations block until the response is available and
 * are always invoked through the circuit breaker.
 *
 * <p>Failures should be reported as {@link com.phillippitts.voicetutor.exception.BackendException}
 * carrying the upstream status where one exists (429, 5xx), so that backend distress can be told apart
 * from ordinary errors.
 */
public interface GenerationBackend {

    GenerationResult generate(GenerationRequest request);

    default String getName() {
        return getClass().getSimpleName();
    }
}
