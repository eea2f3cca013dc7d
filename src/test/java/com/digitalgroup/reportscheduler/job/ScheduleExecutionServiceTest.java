package com.digitalgroup.reportscheduler.job;

import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.common.enums.Priority;
import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.delivery.service.DeliveryDispatcher;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.RetryPolicy;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import com.digitalgroup.reportscheduler.domain.schedule.service.ScheduleService;
import com.digitalgroup.reportscheduler.exception.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-11T09:00:05Z");
    private static final String INSTANCE = "node-a";
    private static final Duration GRACE = Duration.ofSeconds(300);

    @Mock
    private ScheduleService scheduleService;

    @Mock
    private DeliveryDispatcher dispatcher;

    @Mock
    private ThreadPoolExecutor dispatchExecutor;

    private ScheduleExecutionService executionService;
    private ReportSchedule schedule;
    private ScheduledReportRun run;

    @BeforeEach
    void setUp() {
        executionService = new ScheduleExecutionService(scheduleService, dispatcher, dispatchExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC), INSTANCE, 300);

        schedule = ReportSchedule.builder()
                .id(3L)
                .reportId(9L)
                .name("Hourly orders")
                .frequency(Frequency.DAILY)
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .nextRun(Instant.parse("2024-03-11T09:00:00Z"))
                .retryPolicy(RetryPolicy.builder().priority(Priority.HIGH).build())
                .build();
        run = ScheduledReportRun.pending(schedule, NOW, false);
        run.setId(77L);
    }

    @Test
    void dispatchDueSchedules_ClaimsAndQueuesEachDueSchedule() {
        when(scheduleService.findDueScheduleIds(NOW, 10)).thenReturn(List.of(3L, 4L));
        when(scheduleService.claimDue(3L, INSTANCE, NOW, GRACE)).thenReturn(Optional.of(schedule));
        when(scheduleService.claimDue(4L, INSTANCE, NOW, GRACE)).thenReturn(Optional.empty());
        when(scheduleService.createRun(schedule, NOW, false)).thenReturn(run);

        int claimed = executionService.dispatchDueSchedules(10);

        assertEquals(1, claimed);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(dispatchExecutor).execute(task.capture());
        assertInstanceOf(PrioritizedTask.class, task.getValue());
        assertEquals(Priority.HIGH, ((PrioritizedTask) task.getValue()).getPriority());
        verify(scheduleService, never()).createRun(any(), any(), eq(true));
    }

    @Test
    void dispatchDueSchedules_ErrorOnOneSchedule_ContinuesWithOthers() {
        ReportSchedule other = ReportSchedule.builder().id(4L).reportId(9L).build();
        ScheduledReportRun otherRun = ScheduledReportRun.pending(other, NOW, false);
        when(scheduleService.findDueScheduleIds(NOW, 10)).thenReturn(List.of(3L, 4L));
        when(scheduleService.claimDue(3L, INSTANCE, NOW, GRACE)).thenThrow(new IllegalStateException("db down"));
        when(scheduleService.claimDue(4L, INSTANCE, NOW, GRACE)).thenReturn(Optional.of(other));
        when(scheduleService.createRun(other, NOW, false)).thenReturn(otherRun);

        assertEquals(1, executionService.dispatchDueSchedules(10));
    }

    @Test
    void queuedTask_RunsDispatcherAndCompletesWithAdvance() {
        when(scheduleService.findDueScheduleIds(NOW, 10)).thenReturn(List.of(3L));
        when(scheduleService.claimDue(3L, INSTANCE, NOW, GRACE)).thenReturn(Optional.of(schedule));
        when(scheduleService.createRun(schedule, NOW, false)).thenReturn(run);
        when(scheduleService.findRun(77L)).thenReturn(Optional.of(run));
        when(scheduleService.renewClaim(schedule, INSTANCE, NOW, GRACE)).thenReturn(true);
        when(dispatcher.execute(run, schedule, false)).thenReturn(run);

        executionService.dispatchDueSchedules(10);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(dispatchExecutor).execute(task.capture());
        task.getValue().run();

        verify(dispatcher).execute(run, schedule, false);
        verify(scheduleService).completeExecution(3L, run, INSTANCE, true);
    }

    @Test
    void execute_ClaimLostWhileQueued_CancelsRunButLeavesScheduleAlone() {
        when(scheduleService.findRun(77L)).thenReturn(Optional.of(run));
        when(scheduleService.renewClaim(schedule, INSTANCE, NOW, GRACE)).thenReturn(false);
        when(scheduleService.saveRun(run)).thenReturn(run);

        executionService.execute(schedule, run, true, false);

        assertEquals(RunStatus.CANCELLED, run.getStatus());
        assertEquals(ScheduleExecutionService.REASON_CLAIM_LOST, run.getFailureReason());
        verifyNoInteractions(dispatcher);
        verify(scheduleService, never()).completeExecution(any(), any(), any(), anyBoolean());
    }

    @Test
    void execute_RunClosedWhileQueued_NeitherRenewsNorDispatches() {
        ScheduledReportRun stored = ScheduledReportRun.pending(schedule, NOW, false);
        stored.setId(77L);
        stored.complete(RunStatus.CANCELLED, RunHistoryMaintenanceJob.REASON_ABANDONED, NOW);
        when(scheduleService.findRun(77L)).thenReturn(Optional.of(stored));

        executionService.execute(schedule, run, true, false);

        assertEquals(RunStatus.PENDING, run.getStatus());
        verify(scheduleService, never()).renewClaim(any(), any(), any(), any());
        verify(scheduleService, never()).saveRun(any());
        verify(scheduleService, never()).completeExecution(any(), any(), any(), anyBoolean());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void execute_DispatchesTheStoredRunState() {
        ScheduledReportRun stored = ScheduledReportRun.pending(schedule, NOW, false);
        stored.setId(77L);
        stored.setVersion(2L);
        when(scheduleService.findRun(77L)).thenReturn(Optional.of(stored));
        when(scheduleService.renewClaim(schedule, INSTANCE, NOW, GRACE)).thenReturn(true);
        when(dispatcher.execute(stored, schedule, false)).thenReturn(stored);

        executionService.execute(schedule, run, true, false);

        verify(dispatcher).execute(stored, schedule, false);
        verify(scheduleService).completeExecution(3L, stored, INSTANCE, true);
    }

    @Test
    void execute_DispatcherThrows_StillCompletes() {
        when(scheduleService.findRun(77L)).thenReturn(Optional.of(run));
        when(scheduleService.renewClaim(schedule, INSTANCE, NOW, GRACE)).thenReturn(true);
        when(dispatcher.execute(run, schedule, false)).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> executionService.execute(schedule, run, true, false));

        verify(scheduleService).completeExecution(3L, run, INSTANCE, true);
    }

    @Test
    void triggerManualRun_QueuesManualRunWithoutAdvancing() {
        ScheduledReportRun manual = ScheduledReportRun.pending(schedule, NOW, true);
        manual.setId(78L);
        when(scheduleService.claimForManualRun(3L, INSTANCE, NOW, GRACE)).thenReturn(schedule);
        when(scheduleService.createRun(schedule, NOW, true)).thenReturn(manual);
        when(scheduleService.findRun(78L)).thenReturn(Optional.of(manual));
        when(scheduleService.renewClaim(schedule, INSTANCE, NOW, GRACE)).thenReturn(true);
        when(dispatcher.execute(manual, schedule, true)).thenReturn(manual);

        ScheduledReportRun result = executionService.triggerManualRun(3L, true);

        assertEquals(RunStatus.PENDING, result.getStatus());
        assertTrue(result.getManual());
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(dispatchExecutor).execute(task.capture());
        task.getValue().run();
        verify(scheduleService).completeExecution(3L, manual, INSTANCE, false);
    }

    @Test
    void triggerManualRun_RunInProgress_PropagatesConflict() {
        when(scheduleService.claimForManualRun(3L, INSTANCE, NOW, GRACE))
                .thenThrow(new BusinessException("A run of schedule 3 is already in progress"));

        assertThrows(BusinessException.class, () -> executionService.triggerManualRun(3L, false));
        verify(scheduleService, never()).createRun(any(), any(), anyBoolean());
    }

    @Test
    void submit_PoolRejects_CancelsRunAndReleasesClaim() {
        when(scheduleService.findDueScheduleIds(NOW, 10)).thenReturn(List.of(3L));
        when(scheduleService.claimDue(3L, INSTANCE, NOW, GRACE)).thenReturn(Optional.of(schedule));
        when(scheduleService.createRun(schedule, NOW, false)).thenReturn(run);
        when(scheduleService.saveRun(run)).thenReturn(run);
        doThrow(new RejectedExecutionException("shutting down")).when(dispatchExecutor).execute(any(Runnable.class));

        executionService.dispatchDueSchedules(10);

        assertEquals(RunStatus.CANCELLED, run.getStatus());
        assertEquals(ScheduleExecutionService.REASON_REJECTED, run.getFailureReason());
        verify(scheduleService).completeExecution(3L, run, INSTANCE, false);
    }
}
