package com.defiguard.config;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.policy.PolicyDocumentLoader;
import com.defiguard.policy.PolicyEngine;
import com.defiguard.policy.PolicyMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Loads the policy document at startup. A malformed document throws from the bean
 * factory and the application does not start.
 *
 * <p>Properties prefix: {@code defiguard.policy.*}
 */
@Configuration
public class PolicyConfig {

    @Bean
    public PolicyDocumentLoader policyDocumentLoader(
            ObjectMapper objectMapper,
            @Value("${defiguard.policy.location}") Resource location,
            @Value("${defiguard.policy.require-file:true}") boolean requireFile,
            @Value("${defiguard.policy.fallback-mode:default-deny}") String fallbackMode) {
        PolicyMode mode = PolicyMode.fromWireValue(fallbackMode)
                .orElseThrow(() -> new ConfigurationException("Unknown defiguard.policy.fallback-mode '"
                        + fallbackMode + "' (expected default-allow or default-deny)"));
        return new PolicyDocumentLoader(objectMapper, location, requireFile, mode);
    }

    @Bean
    public PolicyEngine policyEngine(PolicyDocumentLoader policyDocumentLoader) {
        return new PolicyEngine(policyDocumentLoader);
    }
}
