package com.surveygateway.shared.repository;

import com.surveygateway.shared.model.CallerCounter;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for per-caller admission counters.
 */
@Repository
public interface CallerCounterRepository extends JpaRepository<CallerCounter, String> {

    /**
     * Loads the caller's counter with a row-level write lock (SELECT ... FOR UPDATE).
     * Concurrent admissions for the same caller queue behind the lock holder and then
     * read its committed state, so no two transactions can decide on the same snapshot.
     * Must be called inside a transaction.
     *
     * @param callerId the caller identity
     * @return the locked counter, or empty if the caller has never been seen
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CallerCounter c WHERE c.callerId = :callerId")
    Optional<CallerCounter> findByCallerIdForUpdate(@Param("callerId") String callerId);
}
