package com.digitalgroup.reportscheduler.domain.delivery.service;

import com.digitalgroup.reportscheduler.domain.common.enums.ChannelStatus;
import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.common.enums.ReportFormat;
import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ChannelAdapter;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.delivery.render.RenderException;
import com.digitalgroup.reportscheduler.domain.delivery.render.ReportRenderer;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.domain.schedule.entity.NotificationPolicy;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.RetryPolicy;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import com.digitalgroup.reportscheduler.domain.schedule.repository.ScheduledReportRunRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryDispatcherTest {

    @Mock
    private ReportRenderer renderer;

    @Mock
    private ChannelAdapter emailAdapter;

    @Mock
    private ChannelAdapter ftpAdapter;

    @Mock
    private ScheduledReportRunRepository runRepository;

    @Mock
    private RunNotifier notifier;

    private ExecutorService channelExecutor;
    private DeliveryDispatcher dispatcher;
    private ReportSchedule schedule;
    private ScheduledReportRun run;
    private ReportArtifact artifact;

    @BeforeEach
    void setUp() {
        channelExecutor = Executors.newFixedThreadPool(4);
        when(emailAdapter.method()).thenReturn(DeliveryMethod.EMAIL);
        when(ftpAdapter.method()).thenReturn(DeliveryMethod.FTP);
        lenient().when(runRepository.save(any(ScheduledReportRun.class))).thenAnswer(inv -> inv.getArgument(0));

        dispatcher = new DeliveryDispatcher(renderer, List.of(emailAdapter, ftpAdapter), runRepository,
                notifier, channelExecutor, Clock.systemUTC());

        schedule = ReportSchedule.builder()
                .id(7L)
                .reportId(42L)
                .name("Weekly sales")
                .frequency(Frequency.WEEKLY)
                .dayOfWeek(1)
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .delivery(DeliveryConfiguration.builder()
                        .methods(EnumSet.of(DeliveryMethod.EMAIL, DeliveryMethod.FTP))
                        .format(ReportFormat.PDF)
                        .recipients(List.of("ops@example.com"))
                        .ftpHost("ftp.example.com")
                        .build())
                .notification(NotificationPolicy.builder().onSuccess(true).onFailure(true).includePreview(true).build())
                .retryPolicy(RetryPolicy.builder()
                        .retryOnFailure(true).maxRetries(2).retryDelaySeconds(0).timeoutSeconds(30).build())
                .build();

        run = ScheduledReportRun.pending(schedule, Instant.parse("2024-01-08T09:00:00Z"), false);
        run.setId(100L);

        artifact = new ReportArtifact("artifact-1", "sales.pdf", ReportFormat.PDF, new byte[]{1, 2, 3}, 25);
    }

    @AfterEach
    void tearDown() {
        channelExecutor.shutdownNow();
    }

    @Test
    void execute_AllChannelsSucceed_ReturnsSucceededAndNotifies() throws Exception {
        when(renderer.render(any())).thenReturn(artifact);
        when(emailAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.EMAIL, "<msg-1>"));
        when(ftpAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.FTP, "ftp://host/sales.pdf"));

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(1, result.getAttempt());
        assertEquals("artifact-1", result.getArtifactRef());
        assertEquals(25, result.getRecordCount());
        assertEquals("<msg-1>", result.getPerChannelResult().get(DeliveryMethod.EMAIL).getReceipt());
        assertNotNull(result.getCompletedAt());
        verify(notifier).notifyOutcome(result, schedule, artifact);
    }

    @Test
    void execute_RenderAlwaysFails_MakesMaxRetriesPlusOneAttempts() throws Exception {
        when(renderer.render(any())).thenThrow(new RenderException("renderer down"));

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(3, result.getAttempt());
        assertEquals(ScheduledReportRun.REASON_RENDER_FAILED, result.getFailureReason());
        assertTrue(result.getPerChannelResult().get(DeliveryMethod.FTP).getReason().contains("renderer down"));
        verify(renderer, times(3)).render(any());
        verify(emailAdapter, never()).deliver(any(), any());
        verify(notifier).notifyOutcome(eq(result), eq(schedule), isNull());
    }

    @Test
    void execute_RetryDisabled_MakesSingleAttempt() throws Exception {
        schedule.getRetryPolicy().setRetryOnFailure(false);
        when(renderer.render(any())).thenThrow(new RenderException("renderer down"));

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(1, result.getAttempt());
        verify(renderer, times(1)).render(any());
    }

    @Test
    void execute_PermanentChannelFailure_DoesNotRetry() throws Exception {
        when(renderer.render(any())).thenReturn(artifact);
        when(emailAdapter.deliver(any(), any())).thenThrow(DeliveryException.permanentError("Invalid recipient address"));
        when(ftpAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.FTP, "ftp://host/sales.pdf"));

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(1, result.getAttempt());
        assertEquals("EMAIL: Invalid recipient address", result.getFailureReason());
        assertEquals(ChannelStatus.SUCCEEDED, result.getPerChannelResult().get(DeliveryMethod.FTP).getStatus());
        verify(emailAdapter, times(1)).deliver(any(), any());
    }

    @Test
    void execute_PartialFailure_RetriesEveryChannel() throws Exception {
        when(renderer.render(any())).thenReturn(artifact);
        when(emailAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.EMAIL, "<msg-1>"));
        when(ftpAdapter.deliver(any(), any()))
                .thenThrow(DeliveryException.transientError("Connection reset", null))
                .thenReturn(new DeliveryReceipt(DeliveryMethod.FTP, "ftp://host/sales.pdf"));

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(2, result.getAttempt());
        verify(renderer, times(2)).render(any());
        verify(emailAdapter, times(2)).deliver(any(), any());
        verify(ftpAdapter, times(2)).deliver(any(), any());
    }

    @Test
    void execute_ChannelExceedsTimeout_FailsWithTimeout() throws Exception {
        schedule.getRetryPolicy().setRetryOnFailure(false);
        schedule.getRetryPolicy().setTimeoutSeconds(1);
        when(renderer.render(any())).thenReturn(artifact);
        when(emailAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.EMAIL, "<msg-1>"));
        when(ftpAdapter.deliver(any(), any())).thenAnswer(inv -> {
            Thread.sleep(10_000);
            return new DeliveryReceipt(DeliveryMethod.FTP, "late");
        });

        long started = System.currentTimeMillis();
        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertTrue(System.currentTimeMillis() - started < 5_000);
        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(ScheduledReportRun.REASON_TIMEOUT, result.getFailureReason());
        assertEquals(ScheduledReportRun.REASON_TIMEOUT,
                result.getPerChannelResult().get(DeliveryMethod.FTP).getReason());
        assertTrue(result.getPerChannelResult().get(DeliveryMethod.EMAIL).isSucceeded());
    }

    @Test
    void execute_RecordCountOutsideConditions_SkipsDelivery() throws Exception {
        schedule.getDelivery().setMinRecords(100);
        when(renderer.render(any())).thenReturn(artifact);

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.SKIPPED, result.getStatus());
        assertEquals(ScheduledReportRun.REASON_CONDITIONS_NOT_MET, result.getFailureReason());
        verify(emailAdapter, never()).deliver(any(), any());
        verify(ftpAdapter, never()).deliver(any(), any());
        verifyNoInteractions(notifier);
    }

    @Test
    void execute_Forced_DeliversDespiteConditions() throws Exception {
        schedule.getDelivery().setMaxRecords(10);
        when(renderer.render(any())).thenReturn(artifact);
        when(emailAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.EMAIL, "<msg-1>"));
        when(ftpAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.FTP, "ftp://host/sales.pdf"));

        ScheduledReportRun result = dispatcher.execute(run, schedule, true);

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
    }

    @Test
    void execute_SuccessNotificationDisabled_DoesNotNotify() throws Exception {
        schedule.getNotification().setOnSuccess(false);
        when(renderer.render(any())).thenReturn(artifact);
        when(emailAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.EMAIL, "<msg-1>"));
        when(ftpAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.FTP, "ftp://host/sales.pdf"));

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        verifyNoInteractions(notifier);
    }

    @Test
    void execute_NotifierThrows_OutcomeUnchanged() throws Exception {
        schedule.getNotification().setIncludePreview(false);
        when(renderer.render(any())).thenReturn(artifact);
        when(emailAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.EMAIL, "<msg-1>"));
        when(ftpAdapter.deliver(any(), any())).thenReturn(new DeliveryReceipt(DeliveryMethod.FTP, "ftp://host/sales.pdf"));
        doThrow(new IllegalStateException("smtp down")).when(notifier).notifyOutcome(any(), any(), isNull());

        ScheduledReportRun result = dispatcher.execute(run, schedule);

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        verify(notifier).notifyOutcome(any(), any(), isNull());
    }
}
