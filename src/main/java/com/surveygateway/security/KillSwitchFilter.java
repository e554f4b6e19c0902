package com.surveygateway.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveygateway.api.GatewayError;
import com.surveygateway.observability.GatewayMetricsServiceInterface;
import com.surveygateway.shared.dto.ErrorResponse;
import com.surveygateway.util.CorrelationIdFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Answers every chat request with 503 while the kill switch is off, before CORS negotiation,
 * body parsing or any counter access.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class KillSwitchFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(KillSwitchFilter.class);

    private final KillSwitch killSwitch;
    private final ObjectMapper objectMapper;
    private final GatewayMetricsServiceInterface metricsService;

    public KillSwitchFilter(KillSwitch killSwitch, ObjectMapper objectMapper,
                            GatewayMetricsServiceInterface metricsService) {
        this.killSwitch = killSwitch;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !ChatCorsFilter.CHAT_PATH.equals(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        if (killSwitch.isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }

        logger.info("Service is disabled, rejecting {} {}", request.getMethod(), request.getRequestURI());
        metricsService.recordRejection(GatewayError.SERVICE_DISABLED.name());

        GatewayError error = GatewayError.SERVICE_DISABLED;
        response.setStatus(error.getStatus().value());
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(),
                new ErrorResponse(error.name(), error.getMessage(), MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)));
    }
}
