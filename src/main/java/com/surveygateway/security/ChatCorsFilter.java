package com.surveygateway.security;

import com.surveygateway.config.GatewayConfigSnapshot;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * CORS for the chat endpoint. Preflights are answered here with 204 and never reach the
 * controller; other responses get Access-Control-Allow-Origin only for origins that pass.
 *
 * Spring's CorsFilter is not used because it answers a disallowed origin with 403,
 * while the widget contract is a 401 from the origin check.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ChatCorsFilter extends OncePerRequestFilter {

    public static final String CHAT_PATH = "/api/chat";
    static final String PREFLIGHT_MAX_AGE_SECONDS = "3600";

    private final GatewayConfigSnapshot config;
    private final OriginValidator originValidator;

    public ChatCorsFilter(GatewayConfigSnapshot config, OriginValidator originValidator) {
        this.config = config;
        this.originValidator = originValidator;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !CHAT_PATH.equals(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String origin = request.getHeader(HttpHeaders.ORIGIN);

        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN,
                    originValidator.isAllowedOrigin(origin) ? origin : "");
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "POST");
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, config.isEndpointKeyEnabled()
                    ? "Content-Type, " + OriginValidator.ENDPOINT_KEY_HEADER
                    : "Content-Type");
            response.setHeader(HttpHeaders.ACCESS_CONTROL_MAX_AGE, PREFLIGHT_MAX_AGE_SECONDS);
            response.addHeader(HttpHeaders.VARY, HttpHeaders.ORIGIN);
            return;
        }

        if (!config.isOriginCheckEnabled()) {
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        } else if (originValidator.isAllowedOrigin(origin)) {
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, origin);
            response.addHeader(HttpHeaders.VARY, HttpHeaders.ORIGIN);
        }

        filterChain.doFilter(request, response);
    }
}
