package com.surveygateway.shared.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Composite primary key for CallerCallDay entity.
 */
public class CallerCallDayId implements Serializable {

    private String callerId;
    private LocalDate callDate;

    public CallerCallDayId() {
    }

    public CallerCallDayId(String callerId, LocalDate callDate) {
        this.callerId = callerId;
        this.callDate = callDate;
    }

    public String getCallerId() {
        return callerId;
    }

    public LocalDate getCallDate() {
        return callDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallerCallDayId that = (CallerCallDayId) o;
        return Objects.equals(callerId, that.callerId) &&
               Objects.equals(callDate, that.callDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callerId, callDate);
    }
}
