package com.surveygateway.security;

import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.shared.model.CallerCounter;
import com.surveygateway.util.Strings;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Client address as seen through the load balancer: the left-most X-Forwarded-For entry,
 * then X-Real-IP, then the socket address. Forwarded headers are ignored unless trusted.
 */
@Component
public class ForwardedHeaderCallerIdentityResolver implements CallerIdentityResolver {

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final String REAL_IP_HEADER = "X-Real-IP";

    private final GatewayConfigSnapshot config;

    public ForwardedHeaderCallerIdentityResolver(GatewayConfigSnapshot config) {
        this.config = config;
    }

    @Override
    public String resolve(HttpServletRequest request) {
        String identity = null;
        if (config.isTrustForwardedHeaders()) {
            identity = firstForwardedAddress(request.getHeader(FORWARDED_FOR_HEADER));
            if (Strings.isBlank(identity)) {
                identity = request.getHeader(REAL_IP_HEADER);
            }
        }
        if (Strings.isBlank(identity)) {
            identity = request.getRemoteAddr();
        }

        identity = Strings.safe(identity).trim();
        if (identity.length() > CallerCounter.CALLER_ID_MAX_LENGTH) {
            identity = identity.substring(0, CallerCounter.CALLER_ID_MAX_LENGTH);
        }
        return identity;
    }

    private static String firstForwardedAddress(String forwardedFor) {
        if (Strings.isBlank(forwardedFor)) {
            return null;
        }
        // "client, proxy1, proxy2"
        String[] addresses = forwardedFor.split(",");
        return addresses.length > 0 ? addresses[0].trim() : null;
    }
}
