package com.surveygateway.config;

import com.surveygateway.api.GatewayError;
import com.surveygateway.api.GatewayException;
import com.surveygateway.observability.GatewayMetricsServiceInterface;
import com.surveygateway.shared.dto.ErrorResponse;
import com.surveygateway.util.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Set;

/**
 * Maps every failure to the {error, message, timestamp, traceId} body.
 * Internal detail goes to the log only; callers get the fixed message of the error code.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final GatewayMetricsServiceInterface metricsService;

    public GlobalExceptionHandler(GatewayMetricsServiceInterface metricsService) {
        this.metricsService = metricsService;
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException ex) {
        GatewayError error = ex.getError();
        metricsService.recordRejection(error.name());

        if (error.getStatus().is5xxServerError()) {
            logger.error("Request failed with {}: {}", error, ex.getMessage(), ex.getCause());
        } else {
            logger.info("Request rejected with {}: {}", error, ex.getMessage());
        }

        ErrorResponse body = new ErrorResponse(error.name(), ex.getCallerMessage(), traceId());
        if (!ex.getFieldErrors().isEmpty()) {
            body.setErrors(ex.getFieldErrors());
        }

        ResponseEntity.BodyBuilder response = ResponseEntity.status(error.getStatus());
        if (ex.getRetryAfter() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        }
        return response.body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        metricsService.recordRejection(GatewayError.INVALID_REQUEST.name());
        logger.info("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(GatewayError.INVALID_REQUEST.name(),
                        "Request body must be a valid JSON object", traceId()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        Set<HttpMethod> supported = ex.getSupportedHttpMethods();
        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED);
        if (supported != null && !supported.isEmpty()) {
            response.allow(supported.toArray(new HttpMethod[0]));
        }
        return response.body(new ErrorResponse("METHOD_NOT_ALLOWED",
                "Only POST requests are allowed", traceId()));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(new ErrorResponse("UNSUPPORTED_MEDIA_TYPE",
                        "Content-Type must be application/json", traceId()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", "Not found", traceId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        metricsService.recordRejection(GatewayError.INTERNAL_ERROR.name());
        logger.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(GatewayError.INTERNAL_ERROR.name(),
                        GatewayError.INTERNAL_ERROR.getMessage(), traceId()));
    }

    private static String traceId() {
        return MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
    }
}
