package com.digitalgroup.reportscheduler.domain.delivery.service;

import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;

/**
 * Tells people how a run ended. Failures to notify never change the run outcome.
 */
public interface RunNotifier {

    /**
     * @param preview artifact to attach, null when the policy excludes previews or nothing was rendered
     */
    void notifyOutcome(ScheduledReportRun run, ReportSchedule schedule, ReportArtifact preview);
}
