package com.digitalgroup.reportscheduler.api.v1.dto.schedule;

import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.domain.schedule.entity.NotificationPolicy;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Create/update payload. Annotations reject structurally broken input before it
 * reaches the service; cross-field rules live in ScheduleValidator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRequest {

    @NotNull(message = "Report is required")
    private Long reportId;

    @Size(max = 255, message = "Schedule name must be at most 255 characters")
    private String name;
    private String description;
    private String ownerEmail;
    private String createdBy;

    private Frequency frequency;
    private Instant startDate;
    private Instant endDate;
    private LocalTime timeOfDay;

    /**
     * 0 = Sunday ... 6 = Saturday
     */
    @Min(value = 0, message = "Day of week must be between 0 (Sunday) and 6 (Saturday)")
    @Max(value = 6, message = "Day of week must be between 0 (Sunday) and 6 (Saturday)")
    private Integer dayOfWeek;

    @Min(value = 1, message = "Day of month must be between 1 and 31")
    @Max(value = 31, message = "Day of month must be between 1 and 31")
    private Integer dayOfMonth;
    private String customCronExpression;
    private String timezone;
    private Boolean enabled;

    @Valid
    private DeliveryDto delivery;
    private NotificationDto notification;
    @Valid
    private RetryPolicyDto retryPolicy;

    public ReportSchedule toEntity() {
        ReportSchedule schedule = new ReportSchedule();
        schedule.setReportId(reportId);
        schedule.setName(name != null ? name.trim() : null);
        schedule.setDescription(description);
        schedule.setOwnerEmail(ownerEmail);
        schedule.setCreatedBy(createdBy);
        schedule.setFrequency(frequency);
        schedule.setStartDate(startDate);
        schedule.setEndDate(endDate);
        if (timeOfDay != null) {
            schedule.setTimeOfDay(timeOfDay);
        }
        schedule.setDayOfWeek(dayOfWeek);
        schedule.setDayOfMonth(dayOfMonth);
        schedule.setCustomCronExpression(customCronExpression);
        if (timezone != null && !timezone.isBlank()) {
            schedule.setTimezone(timezone.trim());
        }
        schedule.setEnabled(enabled);
        schedule.setDelivery(delivery != null ? delivery.toEntity() : new DeliveryConfiguration());
        schedule.setNotification(notification != null ? notification.toEntity() : new NotificationPolicy());
        schedule.setRetryPolicy(retryPolicy != null ? retryPolicy.toEntity() : new RetryPolicy());
        return schedule;
    }
}
