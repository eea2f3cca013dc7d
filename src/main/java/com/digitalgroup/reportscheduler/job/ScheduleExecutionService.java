package com.digitalgroup.reportscheduler.job;

import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.delivery.service.DeliveryDispatcher;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import com.digitalgroup.reportscheduler.domain.schedule.service.ScheduleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Schedule Execution Service
 * Claims schedules, creates their run records and hands them to the dispatch
 * pool. Used by the polling job for due schedules and by the API for manual runs.
 * A claim is held from before the run record is created until the completion
 * step releases it, so at most one run per schedule is active at any time.
 */
@Slf4j
@Service
public class ScheduleExecutionService {

    static final String REASON_CLAIM_LOST = "ClaimLost";
    static final String REASON_REJECTED = "Rejected";

    private final ScheduleService scheduleService;
    private final DeliveryDispatcher dispatcher;
    private final ThreadPoolExecutor dispatchExecutor;
    private final Clock clock;
    private final String instanceId;
    private final Duration claimGrace;
    private final AtomicLong sequence = new AtomicLong();

    public ScheduleExecutionService(ScheduleService scheduleService,
                                    DeliveryDispatcher dispatcher,
                                    @Qualifier("dispatchExecutor") ThreadPoolExecutor dispatchExecutor,
                                    Clock clock,
                                    @Value("${app.scheduler.instance-id:}") String instanceId,
                                    @Value("${app.scheduler.claim-grace-seconds:300}") long claimGraceSeconds) {
        this.scheduleService = scheduleService;
        this.dispatcher = dispatcher;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.instanceId = instanceId == null || instanceId.isBlank() ? defaultInstanceId() : instanceId;
        this.claimGrace = Duration.ofSeconds(claimGraceSeconds);
        log.info("Scheduler instance id: {}", this.instanceId);
    }

    /**
     * Claim and dispatch due schedules, oldest nextRun first
     * @return number of schedules claimed by this instance
     */
    public int dispatchDueSchedules(int batchSize) {
        Instant now = clock.instant();
        List<Long> dueIds = scheduleService.findDueScheduleIds(now, batchSize);
        if (dueIds.isEmpty()) {
            return 0;
        }

        int claimed = 0;
        for (Long scheduleId : dueIds) {
            try {
                if (claimAndDispatch(scheduleId, now)) {
                    claimed++;
                }
            } catch (RuntimeException e) {
                log.error("Error dispatching schedule {}: {}", scheduleId, e.getMessage(), e);
            }
        }
        log.debug("Claimed {} of {} due schedule(s)", claimed, dueIds.size());
        return claimed;
    }

    /**
     * Start a run now, outside the schedule's cadence. nextRun is left untouched.
     */
    public ScheduledReportRun triggerManualRun(Long scheduleId, boolean force) {
        Instant now = clock.instant();
        ReportSchedule schedule = scheduleService.claimForManualRun(scheduleId, instanceId, now, claimGrace);
        ScheduledReportRun run = scheduleService.createRun(schedule, now, true);
        log.info("Manual run {} of schedule {} queued{}", run.getId(), scheduleId, force ? " (forced)" : "");
        submit(schedule, run, false, force);
        return run;
    }

    // ==================== HELPER METHODS ====================

    private boolean claimAndDispatch(Long scheduleId, Instant now) {
        Optional<ReportSchedule> claimed = scheduleService.claimDue(scheduleId, instanceId, now, claimGrace);
        if (claimed.isEmpty()) {
            log.debug("Schedule {} already claimed or no longer due", scheduleId);
            return false;
        }
        ReportSchedule schedule = claimed.get();
        ScheduledReportRun run = scheduleService.createRun(schedule, now, false);
        log.info("Claimed schedule {} (due {}), run {}", scheduleId, schedule.getNextRun(), run.getId());
        submit(schedule, run, true, false);
        return true;
    }

    private void submit(ReportSchedule schedule, ScheduledReportRun run, boolean scheduled, boolean force) {
        PrioritizedTask task = new PrioritizedTask(schedule.getRetryPolicy().getPriority(), sequence.incrementAndGet(),
                () -> execute(schedule, run, scheduled, force));
        try {
            dispatchExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch pool rejected run {} of schedule {}", run.getId(), schedule.getId());
            cancel(schedule, run, REASON_REJECTED);
        }
    }

    void execute(ReportSchedule schedule, ScheduledReportRun queued, boolean scheduled, boolean force) {
        Optional<ScheduledReportRun> current = scheduleService.findRun(queued.getId());
        if (current.isEmpty() || current.get().isTerminal()) {
            log.warn("Run {} of schedule {} was closed while queued, not starting it", queued.getId(), schedule.getId());
            return;
        }
        ScheduledReportRun run = current.get();

        if (!scheduleService.renewClaim(schedule, instanceId, clock.instant(), claimGrace)) {
            // the claim belongs to someone else now, so neither the schedule nor its claim is touched
            log.warn("Claim on schedule {} lost before run {} started", schedule.getId(), run.getId());
            closeRun(run, REASON_CLAIM_LOST);
            return;
        }

        ScheduledReportRun finished = run;
        try {
            finished = dispatcher.execute(run, schedule, force);
        } finally {
            complete(schedule, finished, scheduled);
        }
    }

    private void cancel(ReportSchedule schedule, ScheduledReportRun run, String reason) {
        ScheduledReportRun saved = closeRun(run, reason);
        if (saved != null) {
            complete(schedule, saved, false);
        }
    }

    private ScheduledReportRun closeRun(ScheduledReportRun run, String reason) {
        try {
            run.complete(RunStatus.CANCELLED, reason, clock.instant());
            return scheduleService.saveRun(run);
        } catch (RuntimeException e) {
            log.error("Could not cancel run {}: {}", run.getId(), e.getMessage());
            return null;
        }
    }

    // an error here leaves the claim in place until its lease runs out
    private void complete(ReportSchedule schedule, ScheduledReportRun run, boolean scheduled) {
        try {
            scheduleService.completeExecution(schedule.getId(), run, instanceId, scheduled);
        } catch (RuntimeException e) {
            log.error("Failed to complete run {} of schedule {}: {}", run.getId(), schedule.getId(), e.getMessage(), e);
        }
    }

    private static String defaultInstanceId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "scheduler";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
