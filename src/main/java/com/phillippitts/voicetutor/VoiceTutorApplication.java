package com.phillippitts.voicetutor;

import com.phillippitts.voicetutor.config.properties.CircuitBreakerProperties;
import com.phillippitts.voicetutor.config.properties.ConversationProperties;
import com.phillippitts.voicetutor.config.properties.GatingProperties;
import com.phillippitts.voicetutor.config.properties.SemanticCacheProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        GatingProperties.class,
        CircuitBreakerProperties.class,
        SemanticCacheProperties.class,
        ConversationProperties.class
})
@EnableScheduling
public class VoiceTutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceTutorApplication.class, args);
    }

}
