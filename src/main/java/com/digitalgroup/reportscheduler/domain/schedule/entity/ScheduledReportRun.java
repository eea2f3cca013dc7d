package com.digitalgroup.reportscheduler.domain.schedule.entity;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * One execution of a schedule. Retries bump {@code attempt} on the same row;
 * once the status is terminal the record is history and no longer changes.
 */
@Entity
@Table(name = "scheduled_report_runs", indexes = {
    @Index(name = "idx_scheduled_report_runs_schedule", columnList = "schedule_id, triggered_at"),
    @Index(name = "idx_scheduled_report_runs_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledReportRun {

    public static final String REASON_TIMEOUT = "Timeout";
    public static final String REASON_RENDER_FAILED = "RenderFailed";
    public static final String REASON_CONDITIONS_NOT_MET = "DeliveryConditionsNotMet";
    public static final String REASON_INTERRUPTED = "Interrupted";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_id", nullable = false, updatable = false)
    private Long scheduleId;

    @Column(name = "report_id", nullable = false, updatable = false)
    private Long reportId;

    @Column(name = "triggered_at", nullable = false, updatable = false)
    private Instant triggeredAt;

    @Column(name = "manual", nullable = false, updatable = false)
    @Builder.Default
    private Boolean manual = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private RunStatus status = RunStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private Integer attempt = 1;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "scheduled_report_run_channel_results",
            joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "method")
    @Builder.Default
    private Map<DeliveryMethod, ChannelResult> perChannelResult = new HashMap<>();

    @Column(name = "failure_reason", columnDefinition = "text")
    private String failureReason;

    @Column(name = "artifact_ref")
    private String artifactRef;

    @Column(name = "record_count")
    private Integer recordCount;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Token of the schedule claim this run was created under
     */
    @Column(name = "claim_token", length = 36, updatable = false)
    private String claimToken;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // ==================== HELPER METHODS ====================

    public static ScheduledReportRun pending(ReportSchedule schedule, Instant triggeredAt, boolean manual) {
        return ScheduledReportRun.builder()
                .scheduleId(schedule.getId())
                .reportId(schedule.getReportId())
                .triggeredAt(triggeredAt)
                .manual(manual)
                .status(RunStatus.PENDING)
                .attempt(1)
                .claimToken(schedule.getClaimToken())
                .build();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Moves the run to a non-terminal stage of the current attempt.
     */
    public void transitionTo(RunStatus next) {
        ensureMutable();
        this.status = next;
    }

    public void startNextAttempt() {
        ensureMutable();
        this.attempt = attempt + 1;
        this.status = RunStatus.PENDING;
        this.failureReason = null;
        this.perChannelResult.clear();
    }

    public void recordChannelResults(Map<DeliveryMethod, ChannelResult> results) {
        ensureMutable();
        this.perChannelResult.clear();
        this.perChannelResult.putAll(results);
    }

    public void complete(RunStatus terminal, String reason, Instant at) {
        ensureMutable();
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        this.status = terminal;
        this.failureReason = reason;
        this.completedAt = at;
    }

    public Map<DeliveryMethod, ChannelResult> channelResultsView() {
        return perChannelResult.isEmpty() ? Map.of() : new EnumMap<>(perChannelResult);
    }

    private void ensureMutable() {
        if (isTerminal()) {
            throw new IllegalStateException("Run " + id + " is already " + status);
        }
    }
}
