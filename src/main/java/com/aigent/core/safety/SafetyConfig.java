package com.aigent.core.safety;

import com.aigent.core.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Activates action vetting when {@code aigent.safety.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "aigent.safety.enabled", havingValue = "true")
public class SafetyConfig {

    private static final Logger log = LoggerFactory.getLogger(SafetyConfig.class);

    @Bean
    public SafetyValidator actionTypeSafetyValidator(OrchestratorProperties properties) {
        var restricted = properties.getSafety().getRestrictedActionTypes();
        log.info("Safety validation enabled, restricted action types: {}", restricted);
        return new ActionTypeSafetyValidator(restricted);
    }
}
