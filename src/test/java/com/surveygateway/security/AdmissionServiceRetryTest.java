package com.surveygateway.security;

import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.observability.AuditLogService;
import com.surveygateway.observability.GatewayMetricsServiceInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the admission retry loop.
 */
@ExtendWith(MockitoExtension.class)
class AdmissionServiceRetryTest {

    private static final String CALLER = "203.0.113.50";

    @Mock
    private CallerCounterTransactions callerCounterTransactions;

    @Mock
    private GatewayMetricsServiceInterface metricsService;

    private AdmissionService admissionService;

    @BeforeEach
    void setUp() {
        GatewayConfigSnapshot config = GatewayConfigSnapshot.builder().build();
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        admissionService = new AdmissionService(callerCounterTransactions, config, clock, metricsService,
                new AuditLogService(config, 2000), 3);
    }

    private static AdmissionDecision admitted() {
        return new AdmissionDecision(CALLER, AdmissionOutcome.ADMITTED, 1, 0, Duration.ZERO);
    }

    @Test
    void insertRaceIsRetriedOnFreshState() {
        when(callerCounterTransactions.decide(eq(CALLER), any(Instant.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"))
                .thenReturn(admitted());

        AdmissionDecision decision = admissionService.admit(CALLER);

        assertThat(decision.isAdmitted()).isTrue();
        verify(callerCounterTransactions, times(2)).decide(eq(CALLER), any(Instant.class));
        verify(metricsService).recordAdmissionRetry();
        verify(metricsService).recordAdmission(AdmissionOutcome.ADMITTED);
    }

    @Test
    void persistentContentionFailsClosed() {
        when(callerCounterTransactions.decide(eq(CALLER), any(Instant.class)))
                .thenThrow(new CannotAcquireLockException("lock timeout"));

        assertThatThrownBy(() -> admissionService.admit(CALLER))
                .isInstanceOf(AdmissionUnavailableException.class);
        verify(callerCounterTransactions, times(3)).decide(eq(CALLER), any(Instant.class));
        verify(metricsService, never()).recordAdmission(any());
    }

    @Test
    void storeOutageIsNotRetried() {
        when(callerCounterTransactions.decide(eq(CALLER), any(Instant.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> admissionService.admit(CALLER))
                .isInstanceOf(AdmissionUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        verify(callerCounterTransactions, times(1)).decide(eq(CALLER), any(Instant.class));
    }
}
