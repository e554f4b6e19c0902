package com.surveygateway.security;

import com.surveygateway.api.GatewayError;
import com.surveygateway.api.GatewayException;
import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.util.Strings;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Verifies that a request comes from an allowed embedding page and, when enabled,
 * carries the shared endpoint key. Both failures look the same to the caller.
 *
 * With origin checking on and no allowed origins configured, every request is refused.
 */
@Component
public class OriginValidator {

    private static final Logger logger = LoggerFactory.getLogger(OriginValidator.class);

    public static final String ENDPOINT_KEY_HEADER = "X-Survey-Token";

    private final GatewayConfigSnapshot config;

    public OriginValidator(GatewayConfigSnapshot config) {
        this.config = config;
    }

    /**
     * @throws GatewayException with {@link GatewayError#UNAUTHORIZED} if the origin or key check fails
     */
    public void verify(HttpServletRequest request) {
        if (config.isOriginCheckEnabled()) {
            String origin = resolveOrigin(request);
            if (!isAllowedOrigin(origin)) {
                logger.debug("Origin rejected: {}", Strings.safe(origin));
                throw new GatewayException(GatewayError.UNAUTHORIZED, "Origin not allowed: " + Strings.safe(origin));
            }
        }

        if (config.isEndpointKeyEnabled()) {
            String provided = request.getHeader(ENDPOINT_KEY_HEADER);
            if (!constantTimeEquals(provided, config.getEndpointKey())) {
                logger.debug("Missing or invalid {} header", ENDPOINT_KEY_HEADER);
                throw new GatewayException(GatewayError.UNAUTHORIZED, "Missing or invalid endpoint key");
            }
        }
    }

    /**
     * Origin header if present, otherwise the scheme and authority of the Referer.
     *
     * @return the request origin, or null when neither header yields one
     */
    public String resolveOrigin(HttpServletRequest request) {
        String origin = request.getHeader(HttpHeaders.ORIGIN);
        if (!Strings.isBlank(origin)) {
            return origin;
        }

        String referer = request.getHeader(HttpHeaders.REFERER);
        if (!Strings.isBlank(referer)) {
            try {
                URI refererUri = new URI(referer.trim());
                if (refererUri.getScheme() != null && refererUri.getRawAuthority() != null) {
                    return refererUri.getScheme() + "://" + refererUri.getRawAuthority();
                }
            } catch (URISyntaxException e) {
                logger.debug("Invalid Referer header: {}", referer);
            }
        }
        return null;
    }

    /**
     * Exact, case-sensitive membership after trimming whitespace and trailing slashes.
     */
    public boolean isAllowedOrigin(String origin) {
        String normalized = Strings.normalizeOrigin(origin);
        return !normalized.isEmpty() && config.getAllowedOrigins().contains(normalized);
    }

    static boolean constantTimeEquals(String provided, String expected) {
        if (Strings.isBlank(provided) || Strings.isBlank(expected)) {
            return false;
        }
        return MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8)
        );
    }
}
