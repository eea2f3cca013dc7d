package com.digitalgroup.reportscheduler.integration.email;

import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.delivery.service.RunNotifier;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Emails run outcomes to the schedule owner, the configured operators and,
 * when the policy asks for it, the delivery recipients.
 */
@Slf4j
@Component
public class EmailRunNotifier implements RunNotifier {

    private final EmailService emailService;
    private final List<String> operatorRecipients;

    public EmailRunNotifier(EmailService emailService,
                            @Value("${app.notifications.recipients:}") List<String> operatorRecipients) {
        this.emailService = emailService;
        this.operatorRecipients = operatorRecipients;
    }

    @Override
    public void notifyOutcome(ScheduledReportRun run, ReportSchedule schedule, ReportArtifact preview) {
        List<String> recipients = resolveRecipients(schedule);
        if (recipients.isEmpty()) {
            log.debug("No one to notify about run {}", run.getId());
            return;
        }
        emailService.sendRunNotification(recipients, run, schedule, preview);
    }

    List<String> resolveRecipients(ReportSchedule schedule) {
        Set<String> recipients = new LinkedHashSet<>();
        if (schedule.getOwnerEmail() != null && !schedule.getOwnerEmail().isBlank()) {
            recipients.add(schedule.getOwnerEmail().trim());
        }
        for (String operator : operatorRecipients) {
            if (operator != null && !operator.isBlank()) {
                recipients.add(operator.trim());
            }
        }
        if (schedule.getNotification() != null && schedule.getNotification().isNotifyRecipients()
                && schedule.getDelivery() != null && schedule.getDelivery().getRecipients() != null) {
            recipients.addAll(schedule.getDelivery().getRecipients());
        }
        return new ArrayList<>(recipients);
    }
}
