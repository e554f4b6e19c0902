package com.surveygateway.security;

import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.observability.AuditLogService;
import com.surveygateway.observability.GatewayMetricsServiceInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-caller admission control backed by the persistent counter store.
 *
 * Each attempt runs the full decision procedure in one transaction holding the caller's row lock.
 * Conflicts (two first requests racing to create the counter, lock timeouts, version clashes)
 * roll the attempt back and the procedure is re-run on fresh state, so every request is counted
 * exactly once. Callers never contend across identities.
 */
@Service
public class AdmissionService {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionService.class);

    private final CallerCounterTransactions callerCounterTransactions;
    private final GatewayConfigSnapshot config;
    private final Clock clock;
    private final GatewayMetricsServiceInterface metricsService;
    private final AuditLogService auditLogService;
    private final int maxAttempts;

    public AdmissionService(CallerCounterTransactions callerCounterTransactions,
                            GatewayConfigSnapshot config,
                            Clock clock,
                            GatewayMetricsServiceInterface metricsService,
                            AuditLogService auditLogService,
                            @Value("${gateway.admission.max-attempts:10}") int maxAttempts) {
        this.callerCounterTransactions = callerCounterTransactions;
        this.config = config;
        this.clock = clock;
        this.metricsService = metricsService;
        this.auditLogService = auditLogService;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Decides whether the caller may proceed and commits the counter update that goes with it.
     *
     * @param callerId caller identity
     * @return the committed decision
     * @throws AdmissionUnavailableException if the store fails or contention outlasts the attempt budget
     */
    public AdmissionDecision admit(String callerId) {
        if (!config.isIpLimitingEnabled()) {
            AdmissionDecision decision = AdmissionDecision.unlimited(callerId);
            auditLogService.admission(decision);
            return decision;
        }

        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Instant now = clock.instant();
            try {
                AdmissionDecision decision = callerCounterTransactions.decide(callerId, now);
                metricsService.recordAdmission(decision.getOutcome());
                auditLogService.admission(decision);
                if (attempt > 1) {
                    logger.debug("Admission for caller {} settled after {} attempts: {}",
                            callerId, attempt, decision.getOutcome());
                }
                return decision;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                lastConflict = e;
                metricsService.recordAdmissionRetry();
                logger.debug("Admission attempt {}/{} for caller {} conflicted: {}",
                        attempt, maxAttempts, callerId, e.getClass().getSimpleName());
            } catch (DataAccessException | TransactionException e) {
                logger.error("Counter store failure while admitting caller {}", callerId, e);
                throw new AdmissionUnavailableException("Counter store unavailable", e);
            }
        }

        logger.error("Admission for caller {} still conflicting after {} attempts", callerId, maxAttempts, lastConflict);
        throw new AdmissionUnavailableException(
                "Admission contention exceeded " + maxAttempts + " attempts", lastConflict);
    }
}
