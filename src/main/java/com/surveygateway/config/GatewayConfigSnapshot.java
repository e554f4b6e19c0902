package com.surveygateway.config;

import com.surveygateway.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable, process-wide gateway configuration.
 * Bound once from application properties (which map the deployment's environment variables)
 * and shared read-only by every request handler. There is no mutation path: toggling any
 * value, including the kill switch, requires a restart with new configuration.
 *
 * Thresholds follow the "0 disables" convention: a rate limit interval of zero or less
 * turns spacing checks off, and a non-positive error budget or call cap means unlimited.
 */
@Component
public class GatewayConfigSnapshot {

    private static final Logger logger = LoggerFactory.getLogger(GatewayConfigSnapshot.class);

    private final boolean serviceEnabled;
    private final boolean originCheckEnabled;
    private final Set<String> allowedOrigins;
    private final boolean endpointKeyEnabled;
    private final String endpointKey;
    private final boolean ipLimitingEnabled;
    private final double ipRateLimitSeconds;
    private final int ipMaxRateLimitErrors;
    private final int ipMaxCalls;
    private final int maxHistoryMessages;
    private final boolean trustForwardedHeaders;
    private final boolean auditLoggingEnabled;
    private final boolean payloadLoggingEnabled;
    private final String upstreamApiKey;

    @Autowired
    public GatewayConfigSnapshot(
            @Value("${gateway.service-enabled:true}") boolean serviceEnabled,
            @Value("${gateway.origin-check-enabled:true}") boolean originCheckEnabled,
            @Value("${gateway.allowed-origins:}") String allowedOrigins,
            @Value("${gateway.endpoint-key-enabled:false}") boolean endpointKeyEnabled,
            @Value("${gateway.endpoint-key:}") String endpointKey,
            @Value("${gateway.ip-limiting-enabled:true}") boolean ipLimitingEnabled,
            @Value("${gateway.ip-rate-limit-seconds:1}") double ipRateLimitSeconds,
            @Value("${gateway.ip-max-rate-limit-errors:50}") int ipMaxRateLimitErrors,
            @Value("${gateway.ip-max-calls:1000}") int ipMaxCalls,
            @Value("${gateway.max-history-messages:50}") int maxHistoryMessages,
            @Value("${gateway.trust-forwarded-headers:true}") boolean trustForwardedHeaders,
            @Value("${gateway.logging.enabled:false}") boolean auditLoggingEnabled,
            @Value("${gateway.logging.payloads:false}") boolean payloadLoggingEnabled,
            @Value("${upstream.api-key:}") String upstreamApiKey) {
        this(builder()
                .serviceEnabled(serviceEnabled)
                .originCheckEnabled(originCheckEnabled)
                .allowedOrigins(Strings.parseOriginList(allowedOrigins))
                .endpointKeyEnabled(endpointKeyEnabled)
                .endpointKey(endpointKey)
                .ipLimitingEnabled(ipLimitingEnabled)
                .ipRateLimitSeconds(ipRateLimitSeconds)
                .ipMaxRateLimitErrors(ipMaxRateLimitErrors)
                .ipMaxCalls(ipMaxCalls)
                .maxHistoryMessages(maxHistoryMessages)
                .trustForwardedHeaders(trustForwardedHeaders)
                .auditLoggingEnabled(auditLoggingEnabled)
                .payloadLoggingEnabled(payloadLoggingEnabled)
                .upstreamApiKey(upstreamApiKey));

        logger.info("Gateway configuration loaded: serviceEnabled={}, originCheckEnabled={}, allowedOrigins={}, "
                        + "endpointKeyEnabled={}, ipLimitingEnabled={}, ipRateLimitSeconds={}, "
                        + "ipMaxRateLimitErrors={}, ipMaxCalls={}, auditLogging={}",
                this.serviceEnabled, this.originCheckEnabled, this.allowedOrigins, this.endpointKeyEnabled,
                this.ipLimitingEnabled, this.ipRateLimitSeconds, this.ipMaxRateLimitErrors, this.ipMaxCalls,
                this.auditLoggingEnabled);
        if (this.endpointKeyEnabled && Strings.isBlank(this.endpointKey)) {
            logger.warn("Endpoint key checking is enabled but no endpoint key is configured; all requests will be rejected");
        }
    }

    private GatewayConfigSnapshot(Builder b) {
        this.serviceEnabled = b.serviceEnabled;
        this.originCheckEnabled = b.originCheckEnabled;
        this.allowedOrigins = Collections.unmodifiableSet(new LinkedHashSet<>(b.allowedOrigins));
        this.endpointKeyEnabled = b.endpointKeyEnabled;
        this.endpointKey = b.endpointKey != null ? b.endpointKey : "";
        this.ipLimitingEnabled = b.ipLimitingEnabled;
        this.ipRateLimitSeconds = b.ipRateLimitSeconds;
        this.ipMaxRateLimitErrors = b.ipMaxRateLimitErrors;
        this.ipMaxCalls = b.ipMaxCalls;
        this.maxHistoryMessages = b.maxHistoryMessages;
        this.trustForwardedHeaders = b.trustForwardedHeaders;
        this.auditLoggingEnabled = b.auditLoggingEnabled;
        this.payloadLoggingEnabled = b.payloadLoggingEnabled;
        this.upstreamApiKey = b.upstreamApiKey != null ? b.upstreamApiKey : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isServiceEnabled() {
        return serviceEnabled;
    }

    public boolean isOriginCheckEnabled() {
        return originCheckEnabled;
    }

    public Set<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public boolean isEndpointKeyEnabled() {
        return endpointKeyEnabled;
    }

    public String getEndpointKey() {
        return endpointKey;
    }

    public boolean isIpLimitingEnabled() {
        return ipLimitingEnabled;
    }

    public double getIpRateLimitSeconds() {
        return ipRateLimitSeconds;
    }

    public int getIpMaxRateLimitErrors() {
        return ipMaxRateLimitErrors;
    }

    public int getIpMaxCalls() {
        return ipMaxCalls;
    }

    public int getMaxHistoryMessages() {
        return maxHistoryMessages;
    }

    public boolean isTrustForwardedHeaders() {
        return trustForwardedHeaders;
    }

    public boolean isAuditLoggingEnabled() {
        return auditLoggingEnabled;
    }

    /**
     * Payload summaries are only logged when audit logging itself is on.
     */
    public boolean isPayloadLoggingEnabled() {
        return auditLoggingEnabled && payloadLoggingEnabled;
    }

    public String getUpstreamApiKey() {
        return upstreamApiKey;
    }

    @Override
    public String toString() {
        // Secrets omitted
        return "GatewayConfigSnapshot{serviceEnabled=" + serviceEnabled
                + ", originCheckEnabled=" + originCheckEnabled
                + ", allowedOrigins=" + allowedOrigins
                + ", endpointKeyEnabled=" + endpointKeyEnabled
                + ", ipLimitingEnabled=" + ipLimitingEnabled
                + ", ipRateLimitSeconds=" + ipRateLimitSeconds
                + ", ipMaxRateLimitErrors=" + ipMaxRateLimitErrors
                + ", ipMaxCalls=" + ipMaxCalls + "}";
    }

    /**
     * Programmatic construction, defaults match the property defaults.
     */
    public static final class Builder {
        private boolean serviceEnabled = true;
        private boolean originCheckEnabled = true;
        private Set<String> allowedOrigins = Set.of();
        private boolean endpointKeyEnabled = false;
        private String endpointKey = "";
        private boolean ipLimitingEnabled = true;
        private double ipRateLimitSeconds = 1.0;
        private int ipMaxRateLimitErrors = 50;
        private int ipMaxCalls = 1000;
        private int maxHistoryMessages = 50;
        private boolean trustForwardedHeaders = true;
        private boolean auditLoggingEnabled = false;
        private boolean payloadLoggingEnabled = false;
        private String upstreamApiKey = "";

        private Builder() {
        }

        public Builder serviceEnabled(boolean value) {
            this.serviceEnabled = value;
            return this;
        }

        public Builder originCheckEnabled(boolean value) {
            this.originCheckEnabled = value;
            return this;
        }

        public Builder allowedOrigins(Set<String> value) {
            LinkedHashSet<String> normalized = new LinkedHashSet<>();
            for (String origin : value) {
                String n = Strings.normalizeOrigin(origin);
                if (!n.isEmpty()) {
                    normalized.add(n);
                }
            }
            this.allowedOrigins = normalized;
            return this;
        }

        public Builder endpointKeyEnabled(boolean value) {
            this.endpointKeyEnabled = value;
            return this;
        }

        public Builder endpointKey(String value) {
            this.endpointKey = value;
            return this;
        }

        public Builder ipLimitingEnabled(boolean value) {
            this.ipLimitingEnabled = value;
            return this;
        }

        public Builder ipRateLimitSeconds(double value) {
            this.ipRateLimitSeconds = value;
            return this;
        }

        public Builder ipMaxRateLimitErrors(int value) {
            this.ipMaxRateLimitErrors = value;
            return this;
        }

        public Builder ipMaxCalls(int value) {
            this.ipMaxCalls = value;
            return this;
        }

        public Builder maxHistoryMessages(int value) {
            this.maxHistoryMessages = value;
            return this;
        }

        public Builder trustForwardedHeaders(boolean value) {
            this.trustForwardedHeaders = value;
            return this;
        }

        public Builder auditLoggingEnabled(boolean value) {
            this.auditLoggingEnabled = value;
            return this;
        }

        public Builder payloadLoggingEnabled(boolean value) {
            this.payloadLoggingEnabled = value;
            return this;
        }

        public Builder upstreamApiKey(String value) {
            this.upstreamApiKey = value;
            return this;
        }

        public GatewayConfigSnapshot build() {
            return new GatewayConfigSnapshot(this);
        }
    }
}
