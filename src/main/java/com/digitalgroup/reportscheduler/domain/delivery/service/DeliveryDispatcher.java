package com.digitalgroup.reportscheduler.domain.delivery.service;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryErrorKind;
import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ChannelAdapter;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryContext;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.delivery.render.RenderRequest;
import com.digitalgroup.reportscheduler.domain.delivery.render.ReportRenderer;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ChannelResult;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.domain.schedule.entity.NotificationPolicy;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.RetryPolicy;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import com.digitalgroup.reportscheduler.domain.schedule.repository.ScheduledReportRunRepository;
import com.digitalgroup.reportscheduler.util.TemplateUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delivery Dispatcher
 * Runs one ScheduledReportRun to a terminal state: render, fan out to every
 * configured channel concurrently, retry the whole attempt on failure, notify.
 * <p>
 * Each attempt gets {@code timeoutSeconds} of wall-clock time covering render
 * and delivery; channels still running at the deadline are cancelled (interrupted)
 * and recorded as {@code Timeout}. A retry renders again and re-delivers to every
 * channel, including those that succeeded in the failed attempt.
 * Nothing thrown here escapes {@link #execute}.
 */
@Slf4j
@Service
public class DeliveryDispatcher {

    private final ReportRenderer renderer;
    private final Map<DeliveryMethod, ChannelAdapter> adapters;
    private final ScheduledReportRunRepository runRepository;
    private final RunNotifier notifier;
    private final ExecutorService channelExecutor;
    private final Clock clock;

    public DeliveryDispatcher(ReportRenderer renderer,
                              List<ChannelAdapter> adapters,
                              ScheduledReportRunRepository runRepository,
                              RunNotifier notifier,
                              @Qualifier("channelExecutor") ExecutorService channelExecutor,
                              Clock clock) {
        this.renderer = renderer;
        this.adapters = adapters.stream()
                .collect(Collectors.toMap(ChannelAdapter::method, Function.identity(),
                        (a, b) -> a, () -> new EnumMap<>(DeliveryMethod.class)));
        this.runRepository = runRepository;
        this.notifier = notifier;
        this.channelExecutor = channelExecutor;
        this.clock = clock;
    }

    public ScheduledReportRun execute(ScheduledReportRun run, ReportSchedule schedule) {
        return execute(run, schedule, false);
    }

    /**
     * Drives the run to SUCCEEDED, FAILED or SKIPPED and returns the terminal record.
     *
     * @param force deliver even when the record-count conditions are not met
     */
    public ScheduledReportRun execute(ScheduledReportRun run, ReportSchedule schedule, boolean force) {
        RetryPolicy retryPolicy = schedule.getRetryPolicy();
        ReportArtifact lastArtifact = null;

        try {
            while (true) {
                AttemptOutcome outcome = runAttempt(run, schedule, schedule.getDelivery(), retryPolicy, force);
                run = outcome.run();
                if (outcome.artifact() != null) {
                    lastArtifact = outcome.artifact();
                }

                if (outcome.interrupted()) {
                    run = finish(run, RunStatus.FAILED, ScheduledReportRun.REASON_INTERRUPTED);
                    break;
                }
                if (outcome.skipped()) {
                    log.info("Run {} of schedule {} skipped: {} records outside delivery conditions",
                            run.getId(), schedule.getId(), run.getRecordCount());
                    run = finish(run, RunStatus.SKIPPED, ScheduledReportRun.REASON_CONDITIONS_NOT_MET);
                    break;
                }
                if (outcome.succeeded()) {
                    run = finish(run, RunStatus.SUCCEEDED, null);
                    log.info("Run {} of schedule {} succeeded on attempt {}",
                            run.getId(), schedule.getId(), run.getAttempt());
                    break;
                }

                if (!shouldRetry(run, retryPolicy, outcome)) {
                    run = finish(run, RunStatus.FAILED, outcome.reason());
                    log.warn("Run {} of schedule {} failed after {} attempt(s): {}",
                            run.getId(), schedule.getId(), run.getAttempt(), outcome.reason());
                    break;
                }

                log.warn("Attempt {} of run {} failed ({}), retrying in {}s",
                        run.getAttempt(), run.getId(), outcome.reason(), retryPolicy.getRetryDelaySeconds());
                if (!sleep(Duration.ofSeconds(Math.max(retryPolicy.getRetryDelaySeconds(), 0)))) {
                    run = finish(run, RunStatus.FAILED, ScheduledReportRun.REASON_INTERRUPTED);
                    break;
                }
                run.startNextAttempt();
                run = runRepository.save(run);
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error executing run {} of schedule {}: {}",
                    run.getId(), schedule.getId(), e.getMessage(), e);
            if (!run.isTerminal()) {
                run = finishQuietly(run, e);
            }
        }

        notifyOutcome(run, schedule, lastArtifact);
        return run;
    }

    // ==================== ATTEMPT ====================

    private AttemptOutcome runAttempt(ScheduledReportRun run, ReportSchedule schedule,
                                      DeliveryConfiguration delivery, RetryPolicy retryPolicy, boolean force) {
        Instant deadline = clock.instant().plusSeconds(Math.max(retryPolicy.getTimeoutSeconds(), 1));
        int attempt = run.getAttempt();

        run.transitionTo(RunStatus.RENDERING);
        run = runRepository.save(run);

        RenderRequest request = new RenderRequest(schedule.getReportId(), delivery.getFormat(),
                delivery.getPassword(), schedule.getId(), run.getId(), attempt);
        Future<ReportArtifact> rendering = channelExecutor.submit(() -> renderer.render(request));

        ReportArtifact artifact;
        try {
            artifact = rendering.get(remainingMillis(deadline), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            rendering.cancel(true);
            log.warn("Rendering report {} for run {} timed out", schedule.getReportId(), run.getId());
            return failAllChannels(run, delivery, ScheduledReportRun.REASON_TIMEOUT, ScheduledReportRun.REASON_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Rendering report {} for run {} failed: {}", schedule.getReportId(), run.getId(), cause.getMessage());
            String reason = ScheduledReportRun.REASON_RENDER_FAILED + ": " + cause.getMessage();
            return failAllChannels(run, delivery, reason, ScheduledReportRun.REASON_RENDER_FAILED);
        } catch (InterruptedException e) {
            rendering.cancel(true);
            Thread.currentThread().interrupt();
            return AttemptOutcome.interrupted(run);
        }

        run.setArtifactRef(artifact.artifactRef());
        run.setRecordCount(artifact.recordCount());
        if (!force && !delivery.acceptsRecordCount(artifact.recordCount())) {
            return AttemptOutcome.skipped(runRepository.save(run), artifact);
        }

        run.transitionTo(RunStatus.DELIVERING);
        run = runRepository.save(run);

        DeliveryContext context = DeliveryContext.builder()
                .scheduleId(schedule.getId())
                .scheduleName(schedule.getName())
                .reportId(schedule.getReportId())
                .runId(run.getId())
                .attempt(attempt)
                .settings(delivery)
                .variables(TemplateUtils.standardVariables(schedule, artifact, run.getTriggeredAt()))
                .deadline(deadline)
                .clock(clock)
                .build();

        Map<DeliveryMethod, ChannelResult> results = new EnumMap<>(DeliveryMethod.class);
        Map<DeliveryMethod, Future<DeliveryReceipt>> pending = new EnumMap<>(DeliveryMethod.class);
        for (DeliveryMethod method : delivery.getMethods()) {
            ChannelAdapter adapter = adapters.get(method);
            if (adapter == null) {
                results.put(method, ChannelResult.failed("No channel configured for " + method,
                        DeliveryErrorKind.PERMANENT, attempt, clock.instant()));
                continue;
            }
            pending.put(method, channelExecutor.submit(() -> adapter.deliver(artifact, context)));
        }

        boolean timedOut = false;
        for (Map.Entry<DeliveryMethod, Future<DeliveryReceipt>> entry : pending.entrySet()) {
            DeliveryMethod method = entry.getKey();
            Future<DeliveryReceipt> future = entry.getValue();
            try {
                DeliveryReceipt receipt = future.get(remainingMillis(deadline), TimeUnit.MILLISECONDS);
                results.put(method, ChannelResult.succeeded(receipt.reference(), attempt, clock.instant()));
                log.debug("Run {} delivered via {}: {}", run.getId(), method, receipt.reference());
            } catch (TimeoutException e) {
                future.cancel(true);
                timedOut = true;
                results.put(method, ChannelResult.failed(ScheduledReportRun.REASON_TIMEOUT,
                        DeliveryErrorKind.TRANSIENT, attempt, clock.instant()));
            } catch (ExecutionException e) {
                results.put(method, toFailure(e.getCause(), attempt));
                log.warn("Run {} delivery via {} failed: {}", run.getId(), method, results.get(method).getReason());
            } catch (InterruptedException e) {
                pending.values().forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                run.recordChannelResults(results);
                return AttemptOutcome.interrupted(run);
            }
        }

        run.recordChannelResults(results);
        run = runRepository.save(run);

        boolean allSucceeded = results.values().stream().allMatch(ChannelResult::isSucceeded);
        if (allSucceeded) {
            return AttemptOutcome.succeeded(run, artifact);
        }
        boolean permanent = results.values().stream().anyMatch(ChannelResult::isPermanentFailure);
        String reason = timedOut ? ScheduledReportRun.REASON_TIMEOUT : summarizeFailures(results);
        return AttemptOutcome.failed(run, artifact, reason, permanent);
    }

    private AttemptOutcome failAllChannels(ScheduledReportRun run, DeliveryConfiguration delivery,
                                           String channelReason, String runReason) {
        Map<DeliveryMethod, ChannelResult> results = new EnumMap<>(DeliveryMethod.class);
        for (DeliveryMethod method : delivery.getMethods()) {
            results.put(method, ChannelResult.failed(channelReason, DeliveryErrorKind.TRANSIENT,
                    run.getAttempt(), clock.instant()));
        }
        run.recordChannelResults(results);
        return AttemptOutcome.failed(runRepository.save(run), null, runReason, false);
    }

    private ChannelResult toFailure(Throwable cause, int attempt) {
        if (cause instanceof DeliveryException de) {
            return ChannelResult.failed(de.getMessage(), de.getKind(), attempt, clock.instant());
        }
        String message = cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "Unknown error";
        return ChannelResult.failed(message, DeliveryErrorKind.TRANSIENT, attempt, clock.instant());
    }

    // ==================== HELPER METHODS ====================

    /**
     * A failed attempt is retried only while retries remain and no channel failed permanently;
     * a permanent failure would fail again on every retry.
     */
    private boolean shouldRetry(ScheduledReportRun run, RetryPolicy retryPolicy, AttemptOutcome outcome) {
        return retryPolicy.isRetryOnFailure()
                && !outcome.permanent()
                && run.getAttempt() <= retryPolicy.getMaxRetries();
    }

    private ScheduledReportRun finish(ScheduledReportRun run, RunStatus status, String reason) {
        run.complete(status, reason, clock.instant());
        return runRepository.save(run);
    }

    private ScheduledReportRun finishQuietly(ScheduledReportRun run, Exception cause) {
        try {
            return finish(run, RunStatus.FAILED, "Internal error: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}: {}", run.getId(), e.getMessage());
            return run;
        }
    }

    private void notifyOutcome(ScheduledReportRun run, ReportSchedule schedule, ReportArtifact artifact) {
        NotificationPolicy policy = schedule.getNotification();
        if (policy == null) {
            return;
        }
        boolean wanted = (run.getStatus() == RunStatus.SUCCEEDED && policy.isOnSuccess())
                || (run.getStatus() == RunStatus.FAILED && policy.isOnFailure());
        if (!wanted) {
            return;
        }
        try {
            notifier.notifyOutcome(run, schedule, policy.isIncludePreview() ? artifact : null);
        } catch (RuntimeException e) {
            log.error("Failed to notify outcome of run {}: {}", run.getId(), e.getMessage());
        }
    }

    private String summarizeFailures(Map<DeliveryMethod, ChannelResult> results) {
        return results.entrySet().stream()
                .filter(e -> !e.getValue().isSucceeded())
                .map(e -> e.getKey() + ": " + e.getValue().getReason())
                .collect(Collectors.joining("; "));
    }

    private long remainingMillis(Instant deadline) {
        return Math.max(Duration.between(clock.instant(), deadline).toMillis(), 0);
    }

    /**
     * @return false when interrupted while waiting
     */
    protected boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record AttemptOutcome(ScheduledReportRun run, ReportArtifact artifact, boolean succeeded,
                                  boolean skipped, boolean interrupted, boolean permanent, String reason) {

        static AttemptOutcome succeeded(ScheduledReportRun run, ReportArtifact artifact) {
            return new AttemptOutcome(run, artifact, true, false, false, false, null);
        }

        static AttemptOutcome skipped(ScheduledReportRun run, ReportArtifact artifact) {
            return new AttemptOutcome(run, artifact, false, true, false, false, null);
        }

        static AttemptOutcome interrupted(ScheduledReportRun run) {
            return new AttemptOutcome(run, null, false, false, true, false, ScheduledReportRun.REASON_INTERRUPTED);
        }

        static AttemptOutcome failed(ScheduledReportRun run, ReportArtifact artifact, String reason, boolean permanent) {
            return new AttemptOutcome(run, artifact, false, false, false, permanent, reason);
        }
    }
}
