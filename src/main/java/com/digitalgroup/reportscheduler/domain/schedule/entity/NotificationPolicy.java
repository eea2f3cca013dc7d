package com.digitalgroup.reportscheduler.domain.schedule.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationPolicy {

    @Column(name = "notify_on_success")
    @Builder.Default
    private boolean onSuccess = true;

    @Column(name = "notify_on_failure")
    @Builder.Default
    private boolean onFailure = true;

    @Column(name = "notify_recipients")
    private boolean notifyRecipients;

    @Column(name = "include_preview")
    @Builder.Default
    private boolean includePreview = true;
}
