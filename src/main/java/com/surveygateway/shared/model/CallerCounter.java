package com.surveygateway.shared.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Persistent admission counters for a single caller identity.
 * Created lazily on the caller's first request and never deleted by the gateway.
 * Counters only ever grow; {@code lastCallAt} only ever moves to the instant of an accepted call.
 */
@Entity
@Table(name = "caller_counters")
public class CallerCounter {

    public static final int CALLER_ID_MAX_LENGTH = 128;

    @Id
    @Column(name = "caller_id", length = CALLER_ID_MAX_LENGTH, nullable = false, updatable = false)
    private String callerId;

    @Column(name = "last_call_at")
    private Instant lastCallAt;

    @Column(name = "total_calls", nullable = false)
    private long totalCalls = 0L;

    @Column(name = "rate_limit_errors", nullable = false)
    private long rateLimitErrors = 0L;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Constructors
    public CallerCounter() {
    }

    public CallerCounter(String callerId) {
        this.callerId = callerId;
    }

    /**
     * Records an accepted call: moves the last-call instant forward and bumps the lifetime count.
     */
    public void recordAcceptedCall(Instant now) {
        this.lastCallAt = now;
        this.totalCalls = this.totalCalls + 1;
    }

    /**
     * Records a call rejected for arriving too soon after the previous accepted one.
     */
    public void recordRateLimitError() {
        this.rateLimitErrors = this.rateLimitErrors + 1;
    }

    // Getters
    public String getCallerId() {
        return callerId;
    }

    public Instant getLastCallAt() {
        return lastCallAt;
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getRateLimitErrors() {
        return rateLimitErrors;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
