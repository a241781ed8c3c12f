package com.phillippitts.voicetutor.config;

import com.phillippitts.voicetutor.service.orchestration.GenerationBackend;
import com.phillippitts.voicetutor.service.orchestration.UnconfiguredGenerationBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a placeholder {@link GenerationBackend} when the application supplies none, so the
 * context starts and every turn degrades to a local fallback.
 */
@Configuration
public class GenerationBackendConfig {

    private static final Logger LOG = LogManager.getLogger(GenerationBackendConfig.class);

    @Bean
    @ConditionalOnMissingBean(GenerationBackend.class)
    public GenerationBackend generationBackend() {
        LOG.warn("No GenerationBackend bean found; all turns will use local fallback responses");
        return new UnconfiguredGenerationBackend();
    }
}
