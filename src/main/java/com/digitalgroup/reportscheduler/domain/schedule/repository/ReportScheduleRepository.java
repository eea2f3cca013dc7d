package com.digitalgroup.reportscheduler.domain.schedule.repository;

import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Schedule store.
 * The claim queries are compare-and-swap updates on claimed_by/claimed_until:
 * a return value of 1 means the caller owns the schedule until the lease ends,
 * 0 means another instance got there first. Every claim stores a fresh token;
 * renewal requires the token of the claim being renewed.
 */
@Repository
public interface ReportScheduleRepository extends JpaRepository<ReportSchedule, Long> {

    /**
     * Due, enabled and unclaimed schedules, oldest nextRun first
     */
    @Query("""
            SELECT s.id FROM ReportSchedule s
            WHERE s.enabled = true
            AND s.nextRun IS NOT NULL
            AND s.nextRun <= :now
            AND (s.claimedUntil IS NULL OR s.claimedUntil < :now)
            ORDER BY s.nextRun ASC
            """)
    List<Long> findDueScheduleIds(@Param("now") Instant now, Pageable pageable);

    /**
     * Claim a due schedule for a polling cycle
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ReportSchedule s
            SET s.claimedBy = :owner, s.claimToken = :token, s.claimedUntil = :until, s.version = s.version + 1
            WHERE s.id = :id
            AND s.enabled = true
            AND s.nextRun IS NOT NULL
            AND s.nextRun <= :now
            AND (s.claimedUntil IS NULL OR s.claimedUntil < :now)
            """)
    int claimDue(@Param("id") Long id,
                 @Param("owner") String owner,
                 @Param("token") String token,
                 @Param("now") Instant now,
                 @Param("until") Instant until);

    /**
     * Claim a schedule regardless of nextRun/enabled (manual trigger)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ReportSchedule s
            SET s.claimedBy = :owner, s.claimToken = :token, s.claimedUntil = :until, s.version = s.version + 1
            WHERE s.id = :id
            AND (s.claimedUntil IS NULL OR s.claimedUntil < :now)
            """)
    int claimForManualRun(@Param("id") Long id,
                          @Param("owner") String owner,
                          @Param("token") String token,
                          @Param("now") Instant now,
                          @Param("until") Instant until);

    /**
     * Extend the claim identified by {@code token}; 0 when it was released or
     * replaced by a newer claim, even one taken by the same owner
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ReportSchedule s
            SET s.claimedUntil = :until, s.version = s.version + 1
            WHERE s.id = :id
            AND s.claimedBy = :owner
            AND s.claimToken = :token
            """)
    int renewClaim(@Param("id") Long id,
                   @Param("owner") String owner,
                   @Param("token") String token,
                   @Param("until") Instant until);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ReportSchedule s WHERE s.id = :id")
    Optional<ReportSchedule> findByIdForUpdate(@Param("id") Long id);

    Page<ReportSchedule> findByReportId(Long reportId, Pageable pageable);

    Page<ReportSchedule> findByEnabled(Boolean enabled, Pageable pageable);

    Page<ReportSchedule> findByReportIdAndEnabled(Long reportId, Boolean enabled, Pageable pageable);

    List<ReportSchedule> findAllByReportId(Long reportId);

    /**
     * Release claims whose lease ran out (owner crashed or hung)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ReportSchedule s
            SET s.claimedBy = NULL, s.claimToken = NULL, s.claimedUntil = NULL
            WHERE s.claimedUntil IS NOT NULL AND s.claimedUntil < :now
            """)
    int releaseExpiredClaims(@Param("now") Instant now);
}
