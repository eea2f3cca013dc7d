package com.digitalgroup.reportscheduler.job;

import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import com.digitalgroup.reportscheduler.domain.schedule.repository.ReportScheduleRepository;
import com.digitalgroup.reportscheduler.domain.schedule.repository.ScheduledReportRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Run History Maintenance Job
 * Releases claims left behind by crashed instances, closes the runs they
 * abandoned, and purges old run history.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class RunHistoryMaintenanceJob {

    static final String REASON_ABANDONED = "Abandoned";

    private static final Set<RunStatus> ACTIVE = EnumSet.of(RunStatus.PENDING, RunStatus.RENDERING, RunStatus.DELIVERING);
    private static final Set<RunStatus> TERMINAL =
            EnumSet.of(RunStatus.SUCCEEDED, RunStatus.FAILED, RunStatus.CANCELLED, RunStatus.SKIPPED);

    private final ReportScheduleRepository scheduleRepository;
    private final ScheduledReportRunRepository runRepository;
    private final Clock clock;

    @Value("${app.history.retention-days:90}")
    private int retentionDays;

    /**
     * Release expired claims and cancel the runs their owners left open (runs every 5 minutes)
     */
    @Scheduled(fixedDelayString = "${app.scheduler.stale-claim-check-ms:300000}")
    public void releaseStaleClaims() {
        try {
            Instant now = clock.instant();
            int released = scheduleRepository.releaseExpiredClaims(now);
            if (released > 0) {
                log.warn("Released {} expired schedule claim(s)", released);
            }
            int abandoned = cancelAbandonedRuns(now);
            if (abandoned > 0) {
                log.warn("Cancelled {} abandoned run(s)", abandoned);
            }
        } catch (Exception e) {
            log.error("Error releasing stale claims: {}", e.getMessage(), e);
        }
    }

    /**
     * Purge terminal runs past the retention period (runs daily at 3 AM)
     */
    @Scheduled(cron = "${app.history.purge-cron:0 0 3 * * *}")
    public void purgeOldRuns() {
        try {
            Instant threshold = clock.instant().minus(Duration.ofDays(retentionDays));
            long deleted = runRepository.deleteByStatusInAndCompletedAtBefore(TERMINAL, threshold);
            if (deleted > 0) {
                log.info("Purged {} run(s) completed before {}", deleted, threshold);
            }
        } catch (Exception e) {
            log.error("Error purging run history: {}", e.getMessage(), e);
        }
    }

    // a run is abandoned when it is still open but the claim it was created under is gone
    int cancelAbandonedRuns(Instant now) {
        List<ScheduledReportRun> open = runRepository.findByStatusIn(ACTIVE);
        int cancelled = 0;
        for (ScheduledReportRun run : open) {
            Optional<ReportSchedule> schedule = scheduleRepository.findById(run.getScheduleId());
            if (schedule.isPresent() && holdsClaim(schedule.get(), run, now)) {
                continue;
            }
            run.complete(RunStatus.CANCELLED, REASON_ABANDONED, now);
            try {
                runRepository.save(run);
                cancelled++;
            } catch (ObjectOptimisticLockingFailureException e) {
                log.warn("Run {} changed while being cancelled, left for the next check", run.getId());
            }
        }
        return cancelled;
    }

    private static boolean holdsClaim(ReportSchedule schedule, ScheduledReportRun run, Instant now) {
        return schedule.isClaimedAt(now) && Objects.equals(schedule.getClaimToken(), run.getClaimToken());
    }
}
