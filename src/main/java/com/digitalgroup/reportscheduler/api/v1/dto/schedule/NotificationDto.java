package com.digitalgroup.reportscheduler.api.v1.dto.schedule;

import com.digitalgroup.reportscheduler.domain.schedule.entity.NotificationPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationDto {

    private Boolean onSuccess;
    private Boolean onFailure;
    private Boolean notifyRecipients;
    private Boolean includePreview;

    public NotificationPolicy toEntity() {
        NotificationPolicy policy = new NotificationPolicy();
        if (onSuccess != null) {
            policy.setOnSuccess(onSuccess);
        }
        if (onFailure != null) {
            policy.setOnFailure(onFailure);
        }
        if (notifyRecipients != null) {
            policy.setNotifyRecipients(notifyRecipients);
        }
        if (includePreview != null) {
            policy.setIncludePreview(includePreview);
        }
        return policy;
    }

    public static NotificationDto fromEntity(NotificationPolicy policy) {
        if (policy == null) {
            return null;
        }
        return NotificationDto.builder()
                .onSuccess(policy.isOnSuccess())
                .onFailure(policy.isOnFailure())
                .notifyRecipients(policy.isNotifyRecipients())
                .includePreview(policy.isIncludePreview())
                .build();
    }
}
