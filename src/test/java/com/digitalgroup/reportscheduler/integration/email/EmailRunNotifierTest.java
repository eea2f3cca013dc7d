package com.digitalgroup.reportscheduler.integration.email;

import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.domain.schedule.entity.NotificationPolicy;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailRunNotifierTest {

    @Mock
    private EmailService emailService;

    @Test
    void resolveRecipients_OwnerOperatorsAndRecipients_Deduplicated() {
        EmailRunNotifier notifier = new EmailRunNotifier(emailService, List.of("ops@example.com", " "));
        ReportSchedule schedule = ReportSchedule.builder()
                .ownerEmail("owner@example.com")
                .notification(NotificationPolicy.builder().notifyRecipients(true).build())
                .delivery(DeliveryConfiguration.builder()
                        .recipients(List.of("finance@example.com", "ops@example.com"))
                        .build())
                .build();

        assertEquals(List.of("owner@example.com", "ops@example.com", "finance@example.com"),
                notifier.resolveRecipients(schedule));
    }

    @Test
    void notifyOutcome_NobodyToNotify_SendsNothing() {
        EmailRunNotifier notifier = new EmailRunNotifier(emailService, List.of());
        ReportSchedule schedule = ReportSchedule.builder().id(1L).reportId(2L).build();
        ScheduledReportRun run = ScheduledReportRun.pending(schedule, Instant.parse("2024-01-01T09:00:00Z"), false);

        notifier.notifyOutcome(run, schedule, null);

        verify(emailService, never()).sendRunNotification(any(), any(), any(), any());
    }
}
