package com.surveygateway.shared.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One row per (caller, UTC date) on which the caller had at least one accepted call.
 * Gives operators a per-caller activity calendar next to the lifetime counters.
 */
@Entity
@Table(name = "caller_call_days", indexes = {
    @Index(name = "idx_caller_call_days_date", columnList = "call_date")
})
@IdClass(CallerCallDayId.class)
public class CallerCallDay {

    @Id
    @Column(name = "caller_id", length = CallerCounter.CALLER_ID_MAX_LENGTH, nullable = false)
    private String callerId;

    @Id
    @Column(name = "call_date", nullable = false)
    private LocalDate callDate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public CallerCallDay() {
    }

    public CallerCallDay(String callerId, LocalDate callDate) {
        this.callerId = callerId;
        this.callDate = callDate;
    }

    public String getCallerId() {
        return callerId;
    }

    public LocalDate getCallDate() {
        return callDate;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
