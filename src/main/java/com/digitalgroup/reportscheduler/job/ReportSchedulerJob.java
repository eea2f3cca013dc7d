package com.digitalgroup.reportscheduler.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Report Scheduler Job
 * Polls for due schedules at a fixed delay and dispatches them.
 * Several instances may poll the same database; the claim decides who runs what.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ReportSchedulerJob {

    private final ScheduleExecutionService executionService;

    @Value("${app.scheduler.batch-size:50}")
    private int batchSize;

    /**
     * Dispatch due schedules (default every 30 seconds)
     */
    @Scheduled(fixedDelayString = "${app.scheduler.poll-interval-ms:30000}",
               initialDelayString = "${app.scheduler.initial-delay-ms:10000}")
    public void pollDueSchedules() {
        try {
            int claimed = executionService.dispatchDueSchedules(batchSize);
            if (claimed > 0) {
                log.info("Dispatched {} due schedule(s)", claimed);
            }
        } catch (Exception e) {
            log.error("Error polling due schedules: {}", e.getMessage(), e);
        }
    }
}
