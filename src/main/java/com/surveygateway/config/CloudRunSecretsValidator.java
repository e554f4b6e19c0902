package com.surveygateway.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup in the cloudrun profile when a secret the deployment needs is missing.
 */
@Component
@Profile("cloudrun")
public class CloudRunSecretsValidator {

    private static final Logger logger = LoggerFactory.getLogger(CloudRunSecretsValidator.class);

    private final Environment environment;

    public CloudRunSecretsValidator(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void validateSecrets() {
        String dbPassword = environment.getProperty("spring.datasource.password");
        if (isBlank(dbPassword)) {
            throw new IllegalStateException("DB_PASSWORD is required in cloudrun profile (spring.datasource.password is empty)");
        }

        boolean upstreamEnabled = environment.getProperty("upstream.enabled", Boolean.class, false);
        if (upstreamEnabled && isBlank(environment.getProperty("upstream.api-key"))) {
            throw new IllegalStateException("UPSTREAM_API_KEY is required in cloudrun profile when the upstream is enabled");
        }

        boolean endpointKeyEnabled = environment.getProperty("gateway.endpoint-key-enabled", Boolean.class, false);
        if (endpointKeyEnabled && isBlank(environment.getProperty("gateway.endpoint-key"))) {
            throw new IllegalStateException("ENDPOINT_KEY is required in cloudrun profile when ENDPOINT_KEY_ENABLED=true");
        }

        logger.info("Cloud Run secrets validation passed.");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
