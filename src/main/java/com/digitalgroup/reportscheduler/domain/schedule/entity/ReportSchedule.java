package com.digitalgroup.reportscheduler.domain.schedule.entity;

import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Recurrence rule plus delivery, notification and retry policy for one report.
 * nextRun/lastRun, the claim columns and the counters are only written by the
 * scheduler loop and the dispatcher completion path.
 */
@Entity
@Table(name = "report_schedules", indexes = {
    @Index(name = "idx_report_schedules_due", columnList = "enabled, next_run"),
    @Index(name = "idx_report_schedules_report_id", columnList = "report_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_id", nullable = false, updatable = false)
    private Long reportId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "text")
    private String description;

    @Column(name = "owner_email")
    private String ownerEmail;

    @Column(name = "created_by")
    private String createdBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Frequency frequency;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "time_of_day")
    @Builder.Default
    private LocalTime timeOfDay = LocalTime.of(9, 0);

    // 0 = Sunday ... 6 = Saturday
    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "custom_cron_expression")
    private String customCronExpression;

    @Column(nullable = false)
    @Builder.Default
    private String timezone = "UTC";

    @Column(nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    @Column(name = "next_run")
    private Instant nextRun;

    @Column(name = "last_run")
    private Instant lastRun;

    @Column(name = "claimed_by")
    private String claimedBy;

    @Column(name = "claimed_until")
    private Instant claimedUntil;

    // changes on every claim, so a task queued under an older claim cannot renew it
    @Column(name = "claim_token", length = 36)
    private String claimToken;

    @Column(name = "run_count", nullable = false)
    @Builder.Default
    private Integer runCount = 0;

    @Column(name = "success_count", nullable = false)
    @Builder.Default
    private Integer successCount = 0;

    @Column(name = "failure_count", nullable = false)
    @Builder.Default
    private Integer failureCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_status")
    private RunStatus lastStatus;

    @Embedded
    @Builder.Default
    private DeliveryConfiguration delivery = new DeliveryConfiguration();

    @Embedded
    @Builder.Default
    private NotificationPolicy notification = new NotificationPolicy();

    @Embedded
    @Builder.Default
    private RetryPolicy retryPolicy = new RetryPolicy();

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ==================== HELPER METHODS ====================

    public ZoneId zoneId() {
        return ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone);
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean isClaimedAt(Instant now) {
        return claimedBy != null && claimedUntil != null && claimedUntil.isAfter(now);
    }

    /**
     * Percentage of runs that ended SUCCEEDED, 0 when the schedule never ran.
     */
    public double getSuccessRate() {
        if (runCount == null || runCount == 0) {
            return 0.0;
        }
        return (successCount * 100.0) / runCount;
    }

    public void recordOutcome(RunStatus status, Instant triggeredAt) {
        this.lastRun = triggeredAt;
        this.lastStatus = status;
        // skipped and cancelled runs delivered nothing, they do not count as executions
        if (status == RunStatus.SKIPPED || status == RunStatus.CANCELLED) {
            return;
        }
        this.runCount = runCount + 1;
        if (status == RunStatus.SUCCEEDED) {
            this.successCount = successCount + 1;
        } else {
            this.failureCount = failureCount + 1;
        }
    }

    public void releaseClaim() {
        this.claimedBy = null;
        this.claimedUntil = null;
        this.claimToken = null;
    }
}
