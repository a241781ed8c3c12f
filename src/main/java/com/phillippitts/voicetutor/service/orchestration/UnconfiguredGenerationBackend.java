package com.phillippitts.voicetutor.service.orchestration;

import com.phillippitts.voicetutor.exception.BackendException;

/**
 * Placeholder registered when the application provides no {@link GenerationBackend}. Every call
 * fails with status 503, so turns degrade to local fallback responses.
 */
public class UnconfiguredGenerationBackend implements GenerationBackend {

    static final int SERVICE_UNAVAILABLE = 503;

    @Override
    public GenerationResult generate(GenerationRequest request) {
        throw new BackendException("No generation backend configured", SERVICE_UNAVAILABLE);
    }

    @Override
    public String getName() {
        return "unconfigured";
    }
}
