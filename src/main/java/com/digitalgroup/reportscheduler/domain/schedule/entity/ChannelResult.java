package com.digitalgroup.reportscheduler.domain.schedule.entity;

import com.digitalgroup.reportscheduler.domain.common.enums.ChannelStatus;
import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryErrorKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Outcome of one delivery method within the latest attempt of a run.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChannelResult {

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ChannelStatus status;

    @Column(name = "reason", columnDefinition = "text")
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind")
    private DeliveryErrorKind errorKind;

    // provider reference returned by the channel (message id, object key, remote path...)
    @Column(name = "receipt")
    private String receipt;

    @Column(name = "attempt")
    private Integer attempt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public static ChannelResult succeeded(String receipt, int attempt, Instant at) {
        return ChannelResult.builder()
                .status(ChannelStatus.SUCCEEDED)
                .receipt(receipt)
                .attempt(attempt)
                .completedAt(at)
                .build();
    }

    public static ChannelResult failed(String reason, DeliveryErrorKind kind, int attempt, Instant at) {
        return ChannelResult.builder()
                .status(ChannelStatus.FAILED)
                .reason(reason)
                .errorKind(kind)
                .attempt(attempt)
                .completedAt(at)
                .build();
    }

    public boolean isSucceeded() {
        return status == ChannelStatus.SUCCEEDED;
    }

    public boolean isPermanentFailure() {
        return status == ChannelStatus.FAILED && errorKind == DeliveryErrorKind.PERMANENT;
    }
}
