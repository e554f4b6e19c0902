package com.surveygateway.security;

import com.surveygateway.api.GatewayError;
import com.surveygateway.api.GatewayException;
import com.surveygateway.config.GatewayConfigSnapshot;
import org.springframework.stereotype.Component;

/**
 * Global on/off switch for chat traffic. While off, nothing downstream runs:
 * no counters are read or written and the upstream is never called.
 */
@Component
public class KillSwitch {

    private final GatewayConfigSnapshot config;

    public KillSwitch(GatewayConfigSnapshot config) {
        this.config = config;
    }

    public boolean isEnabled() {
        return config.isServiceEnabled();
    }

    /**
     * @throws GatewayException with {@link GatewayError#SERVICE_DISABLED} when the service is switched off
     */
    public void check() {
        if (!config.isServiceEnabled()) {
            throw new GatewayException(GatewayError.SERVICE_DISABLED, "Service disabled via gateway.service-enabled");
        }
    }
}
