package com.digitalgroup.reportscheduler.domain.schedule.service;

import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import com.digitalgroup.reportscheduler.domain.schedule.repository.ReportScheduleRepository;
import com.digitalgroup.reportscheduler.domain.schedule.repository.ScheduledReportRunRepository;
import com.digitalgroup.reportscheduler.exception.BusinessException;
import com.digitalgroup.reportscheduler.exception.ResourceNotFoundException;
import com.digitalgroup.reportscheduler.exception.ScheduleValidationException;
import com.digitalgroup.reportscheduler.util.CronUtils;
import com.digitalgroup.reportscheduler.util.ScheduleTimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Schedule Service
 * Schedule lifecycle (create, update, pause, resume, delete), claims, and the
 * completion step that records a run outcome and advances nextRun.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final ReportScheduleRepository scheduleRepository;
    private final ScheduledReportRunRepository runRepository;
    private final ScheduleValidator validator;
    private final Clock clock;

    public ReportSchedule findById(Long id) {
        return scheduleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule", id));
    }

    public Page<ReportSchedule> list(Long reportId, Boolean enabled, Pageable pageable) {
        if (reportId != null && enabled != null) {
            return scheduleRepository.findByReportIdAndEnabled(reportId, enabled, pageable);
        }
        if (reportId != null) {
            return scheduleRepository.findByReportId(reportId, pageable);
        }
        if (enabled != null) {
            return scheduleRepository.findByEnabled(enabled, pageable);
        }
        return scheduleRepository.findAll(pageable);
    }

    public Page<ScheduledReportRun> listRuns(Long scheduleId, Pageable pageable) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ResourceNotFoundException("Schedule", scheduleId);
        }
        return runRepository.findByScheduleIdOrderByTriggeredAtDesc(scheduleId, pageable);
    }

    /**
     * Dry-run validation, nothing is persisted
     */
    public List<ValidationError> validate(ReportSchedule schedule) {
        return validator.validate(schedule);
    }

    /**
     * Validate, compute the first nextRun and persist
     */
    @Transactional
    public ReportSchedule create(ReportSchedule schedule) {
        requireValid(schedule);
        normalize(schedule);

        schedule.setId(null);
        schedule.releaseClaim();
        schedule.setLastRun(null);
        schedule.setLastStatus(null);
        schedule.setRunCount(0);
        schedule.setSuccessCount(0);
        schedule.setFailureCount(0);

        Instant now = clock.instant();
        if (schedule.isEnabled()) {
            Instant nextRun = ScheduleTimeUtils.computeNextRun(schedule, now);
            if (nextRun == null) {
                throw new ScheduleValidationException(List.of(
                        new ValidationError("startDate", "Schedule has no occurrence in the future")));
            }
            schedule.setNextRun(nextRun);
        } else {
            schedule.setNextRun(null);
        }

        ReportSchedule saved = scheduleRepository.save(schedule);
        log.info("Created schedule {} '{}' for report {} ({}), next run at {}",
                saved.getId(), saved.getName(), saved.getReportId(), saved.getFrequency(), saved.getNextRun());
        return saved;
    }

    /**
     * Replace the definition of a schedule. Statistics and run history are kept;
     * nextRun is recomputed from now.
     */
    @Transactional
    public ReportSchedule update(Long id, ReportSchedule changes) {
        ReportSchedule schedule = findById(id);
        changes.setReportId(schedule.getReportId());
        if (changes.getDelivery() != null) {
            changes.getDelivery().retainSecretsFrom(schedule.getDelivery());
        }
        requireValid(changes);
        normalize(changes);

        schedule.setName(changes.getName());
        schedule.setDescription(changes.getDescription());
        schedule.setOwnerEmail(changes.getOwnerEmail());
        schedule.setFrequency(changes.getFrequency());
        schedule.setStartDate(changes.getStartDate());
        schedule.setEndDate(changes.getEndDate());
        schedule.setTimeOfDay(changes.getTimeOfDay());
        schedule.setDayOfWeek(changes.getDayOfWeek());
        schedule.setDayOfMonth(changes.getDayOfMonth());
        schedule.setCustomCronExpression(changes.getCustomCronExpression());
        schedule.setTimezone(changes.getTimezone());
        schedule.setDelivery(changes.getDelivery());
        schedule.setNotification(changes.getNotification());
        schedule.setRetryPolicy(changes.getRetryPolicy());
        if (changes.getEnabled() != null) {
            schedule.setEnabled(changes.getEnabled());
        }

        if (schedule.isEnabled()) {
            Instant nextRun = ScheduleTimeUtils.computeNextRun(schedule, clock.instant());
            schedule.setNextRun(nextRun);
            if (nextRun == null) {
                schedule.setEnabled(false);
                log.info("Schedule {} has no future occurrence after update, disabled", id);
            }
        }

        ReportSchedule saved = scheduleRepository.save(schedule);
        log.info("Updated schedule {}, next run at {}", id, saved.getNextRun());
        return saved;
    }

    @Transactional
    public ReportSchedule pause(Long id) {
        ReportSchedule schedule = findById(id);
        schedule.setEnabled(false);
        log.info("Paused schedule {}", id);
        return scheduleRepository.save(schedule);
    }

    /**
     * Re-enable and recompute nextRun from now; occurrences missed while paused are not replayed
     */
    @Transactional
    public ReportSchedule resume(Long id) {
        ReportSchedule schedule = findById(id);
        Instant nextRun = ScheduleTimeUtils.computeNextRun(schedule, clock.instant());
        if (nextRun == null) {
            throw new BusinessException("Schedule " + id + " has no future occurrence and cannot be resumed");
        }
        schedule.setEnabled(true);
        schedule.setNextRun(nextRun);
        log.info("Resumed schedule {}, next run at {}", id, nextRun);
        return scheduleRepository.save(schedule);
    }

    @Transactional
    public void delete(Long id) {
        ReportSchedule schedule = findById(id);
        long runs = runRepository.deleteByScheduleIdIn(List.of(id));
        scheduleRepository.delete(schedule);
        log.info("Deleted schedule {} and {} run(s)", id, runs);
    }

    /**
     * Cascade for a deleted report
     * @return number of schedules removed
     */
    @Transactional
    public int deleteByReport(Long reportId) {
        List<ReportSchedule> schedules = scheduleRepository.findAllByReportId(reportId);
        if (schedules.isEmpty()) {
            return 0;
        }
        long runs = runRepository.deleteByScheduleIdIn(schedules.stream().map(ReportSchedule::getId).toList());
        scheduleRepository.deleteAll(schedules);
        log.info("Deleted {} schedule(s) and {} run(s) of report {}", schedules.size(), runs, reportId);
        return schedules.size();
    }

    // ==================== CLAIMS ====================

    public List<Long> findDueScheduleIds(Instant now, int limit) {
        return scheduleRepository.findDueScheduleIds(now, PageRequest.of(0, limit));
    }

    /**
     * Claim a due schedule for the polling loop.
     * @return the claimed schedule, empty when another instance holds it or it is no longer due
     */
    public Optional<ReportSchedule> claimDue(Long id, String owner, Instant now, Duration grace) {
        Optional<ReportSchedule> candidate = scheduleRepository.findById(id);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        Instant until = leaseEnd(candidate.get(), now, grace);
        if (scheduleRepository.claimDue(id, owner, newClaimToken(), now, until) != 1) {
            return Optional.empty();
        }
        return scheduleRepository.findById(id);
    }

    /**
     * Claim a schedule for a manual run, regardless of nextRun and enabled
     * @throws BusinessException when a run of the schedule is already in progress
     */
    public ReportSchedule claimForManualRun(Long id, String owner, Instant now, Duration grace) {
        ReportSchedule schedule = findById(id);
        Instant until = leaseEnd(schedule, now, grace);
        if (scheduleRepository.claimForManualRun(id, owner, newClaimToken(), now, until) != 1) {
            throw new BusinessException("A run of schedule " + id + " is already in progress");
        }
        return findById(id);
    }

    /**
     * Push the lease end forward when a queued run actually starts
     * @param schedule the schedule as read right after it was claimed, carrying that claim's token
     * @return false when that claim was released or replaced in the meantime
     */
    public boolean renewClaim(ReportSchedule schedule, String owner, Instant now, Duration grace) {
        if (schedule.getClaimToken() == null) {
            return false;
        }
        return scheduleRepository.renewClaim(schedule.getId(), owner, schedule.getClaimToken(),
                leaseEnd(schedule, now, grace)) == 1;
    }

    public Optional<ScheduledReportRun> findRun(Long runId) {
        return runRepository.findById(runId);
    }

    public ScheduledReportRun createRun(ReportSchedule schedule, Instant triggeredAt, boolean manual) {
        ScheduledReportRun run = runRepository.save(ScheduledReportRun.pending(schedule, triggeredAt, manual));
        log.info("Run {} created for schedule {} ({})", run.getId(), schedule.getId(), manual ? "manual" : "scheduled");
        return run;
    }

    public ScheduledReportRun saveRun(ScheduledReportRun run) {
        return runRepository.save(run);
    }

    /**
     * Record a terminal run on its schedule under a row lock: statistics, lastRun,
     * nextRun (scheduled runs only) and claim release, in one transaction.
     * nextRun is computed from the run's triggeredAt and always moves past it,
     * so an execution never re-arms the occurrence it just ran; when nothing is
     * left the schedule is disabled.
     */
    @Transactional
    public void completeExecution(Long scheduleId, ScheduledReportRun run, String owner, boolean advanceNextRun) {
        Optional<ReportSchedule> locked = scheduleRepository.findByIdForUpdate(scheduleId);
        if (locked.isEmpty()) {
            log.warn("Schedule {} was deleted while run {} was in progress", scheduleId, run.getId());
            return;
        }
        ReportSchedule schedule = locked.get();
        schedule.recordOutcome(run.getStatus(), run.getTriggeredAt());

        if (advanceNextRun) {
            Instant nextRun = ScheduleTimeUtils.computeNextRun(schedule, run.getTriggeredAt());
            if (nextRun != null && !nextRun.isAfter(run.getTriggeredAt())) {
                nextRun = null;
            }
            schedule.setNextRun(nextRun);
            if (nextRun == null) {
                schedule.setEnabled(false);
                log.info("Schedule {} exhausted, disabled", scheduleId);
            }
        }

        if (owner.equals(schedule.getClaimedBy()) && Objects.equals(run.getClaimToken(), schedule.getClaimToken())) {
            schedule.releaseClaim();
        } else if (schedule.getClaimedBy() != null) {
            log.warn("Schedule {} was claimed again by {} while run {} was in progress",
                    scheduleId, schedule.getClaimedBy(), run.getId());
        }

        scheduleRepository.save(schedule);
        log.info("Run {} of schedule {} completed with {}, next run at {}",
                run.getId(), scheduleId, run.getStatus(), schedule.getNextRun());
    }

    // ==================== HELPER METHODS ====================

    private void requireValid(ReportSchedule schedule) {
        List<ValidationError> errors = validator.validate(schedule);
        if (!errors.isEmpty()) {
            throw new ScheduleValidationException(errors);
        }
    }

    private void normalize(ReportSchedule schedule) {
        if (schedule.getCustomCronExpression() != null) {
            schedule.setCustomCronExpression(CronUtils.canonicalize(schedule.getCustomCronExpression()));
        }
        if (schedule.getTimeOfDay() != null) {
            schedule.setTimeOfDay(schedule.getTimeOfDay().withSecond(0).withNano(0));
        }
        if (schedule.getEnabled() == null) {
            schedule.setEnabled(true);
        }
    }

    /**
     * A claim outlives the longest possible run: every attempt timing out, the
     * retry delays between them, plus a grace margin for queueing and completion.
     */
    private static String newClaimToken() {
        return UUID.randomUUID().toString();
    }

    private Instant leaseEnd(ReportSchedule schedule, Instant now, Duration grace) {
        return now.plus(schedule.getRetryPolicy().worstCaseDuration()).plus(grace);
    }
}
