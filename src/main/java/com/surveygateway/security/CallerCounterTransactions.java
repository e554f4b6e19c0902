package com.surveygateway.security;

import com.surveygateway.shared.model.CallerCallDay;
import com.surveygateway.shared.model.CallerCallDayId;
import com.surveygateway.shared.model.CallerCounter;
import com.surveygateway.shared.repository.CallerCallDayRepository;
import com.surveygateway.shared.repository.CallerCounterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Runs one admission attempt inside a single transaction.
 * This is a separate bean to avoid @Transactional self-invocation from the retry loop
 * in {@link AdmissionService}.
 */
@Service
public class CallerCounterTransactions {

    private static final Logger logger = LoggerFactory.getLogger(CallerCounterTransactions.class);

    private final CallerCounterRepository callerCounterRepository;
    private final CallerCallDayRepository callerCallDayRepository;
    private final AdmissionPolicy admissionPolicy;

    public CallerCounterTransactions(CallerCounterRepository callerCounterRepository,
                                     CallerCallDayRepository callerCallDayRepository,
                                     AdmissionPolicy admissionPolicy) {
        this.callerCounterRepository = callerCounterRepository;
        this.callerCallDayRepository = callerCallDayRepository;
        this.admissionPolicy = admissionPolicy;
    }

    /**
     * Locks (or creates) the caller's counter, applies the admission rules and writes the result.
     * A concurrent first insert for the same caller surfaces as a DataIntegrityViolationException;
     * lock timeouts and version conflicts surface as ConcurrencyFailureException. Either way the
     * transaction rolls back completely and the caller may re-run the attempt.
     */
    @Transactional
    public AdmissionDecision decide(String callerId, Instant now) {
        CallerCounter counter = callerCounterRepository.findByCallerIdForUpdate(callerId)
                .orElseGet(() -> {
                    logger.debug("First request from caller {}, creating counter", callerId);
                    return new CallerCounter(callerId);
                });

        long errorsBefore = counter.getRateLimitErrors();
        long callsBefore = counter.getTotalCalls();

        AdmissionDecision decision = admissionPolicy.apply(counter, now);

        boolean changed = counter.getVersion() == null
                || counter.getRateLimitErrors() != errorsBefore
                || counter.getTotalCalls() != callsBefore;
        if (changed) {
            callerCounterRepository.saveAndFlush(counter);
        }

        if (decision.isAdmitted()) {
            recordCallDay(callerId, now);
        }
        return decision;
    }

    private void recordCallDay(String callerId, Instant now) {
        LocalDate today = now.atOffset(ZoneOffset.UTC).toLocalDate();
        CallerCallDayId id = new CallerCallDayId(callerId, today);
        if (!callerCallDayRepository.existsById(id)) {
            callerCallDayRepository.saveAndFlush(new CallerCallDay(callerId, today));
        }
    }
}
