package com.surveygateway.shared.repository;

import com.surveygateway.shared.model.CallerCallDay;
import com.surveygateway.shared.model.CallerCallDayId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for the per-caller calendar of days with accepted calls.
 */
@Repository
public interface CallerCallDayRepository extends JpaRepository<CallerCallDay, CallerCallDayId> {

    /**
     * Dates on which the caller had accepted calls, oldest first.
     */
    @Query("SELECT d.callDate FROM CallerCallDay d WHERE d.callerId = :callerId ORDER BY d.callDate ASC")
    List<LocalDate> findCallDates(@Param("callerId") String callerId);
}
