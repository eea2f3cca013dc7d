package com.digitalgroup.reportscheduler.api.v1.dto.schedule;

import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.util.ScheduleTimeUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleResponse {

    private Long id;
    private Long reportId;
    private String name;
    private String description;
    private String ownerEmail;
    private String createdBy;

    private Frequency frequency;
    private Instant startDate;
    private Instant endDate;
    private LocalTime timeOfDay;
    private Integer dayOfWeek;
    private Integer dayOfMonth;
    private String customCronExpression;
    private String timezone;
    private String cronExpression;
    private String humanReadable;

    private Boolean enabled;
    private Instant nextRun;
    private Instant lastRun;
    private RunStatus lastStatus;
    private boolean running;

    private Integer runCount;
    private Integer successCount;
    private Integer failureCount;
    private double successRate;

    private DeliveryDto delivery;
    private NotificationDto notification;
    private RetryPolicyDto retryPolicy;

    private Instant createdAt;
    private Instant updatedAt;

    public static ScheduleResponse fromEntity(ReportSchedule schedule, Instant now) {
        return ScheduleResponse.builder()
                .id(schedule.getId())
                .reportId(schedule.getReportId())
                .name(schedule.getName())
                .description(schedule.getDescription())
                .ownerEmail(schedule.getOwnerEmail())
                .createdBy(schedule.getCreatedBy())
                .frequency(schedule.getFrequency())
                .startDate(schedule.getStartDate())
                .endDate(schedule.getEndDate())
                .timeOfDay(schedule.getTimeOfDay())
                .dayOfWeek(schedule.getDayOfWeek())
                .dayOfMonth(schedule.getDayOfMonth())
                .customCronExpression(schedule.getCustomCronExpression())
                .timezone(schedule.getTimezone())
                .cronExpression(ScheduleTimeUtils.toCronExpression(schedule))
                .humanReadable(ScheduleTimeUtils.describe(schedule))
                .enabled(schedule.getEnabled())
                .nextRun(schedule.getNextRun())
                .lastRun(schedule.getLastRun())
                .lastStatus(schedule.getLastStatus())
                .running(schedule.isClaimedAt(now))
                .runCount(schedule.getRunCount())
                .successCount(schedule.getSuccessCount())
                .failureCount(schedule.getFailureCount())
                .successRate(schedule.getSuccessRate())
                .delivery(DeliveryDto.fromEntity(schedule.getDelivery()))
                .notification(NotificationDto.fromEntity(schedule.getNotification()))
                .retryPolicy(RetryPolicyDto.fromEntity(schedule.getRetryPolicy()))
                .createdAt(schedule.getCreatedAt())
                .updatedAt(schedule.getUpdatedAt())
                .build();
    }
}
