package com.digitalgroup.reportscheduler.api.v1.dto.schedule;

import com.digitalgroup.reportscheduler.domain.common.enums.ChannelStatus;
import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryErrorKind;
import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ChannelResult;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunResponse {

    private Long id;
    private Long scheduleId;
    private Long reportId;
    private Instant triggeredAt;
    private boolean manual;
    private RunStatus status;
    private Integer attempt;
    private String failureReason;
    private String artifactRef;
    private Integer recordCount;
    private Instant completedAt;
    private Map<DeliveryMethod, ChannelResultDto> channelResults;

    public record ChannelResultDto(ChannelStatus status, String reason, DeliveryErrorKind errorKind,
                                   String receipt, Integer attempt, Instant completedAt) {

        static ChannelResultDto fromEntity(ChannelResult result) {
            return new ChannelResultDto(result.getStatus(), result.getReason(), result.getErrorKind(),
                    result.getReceipt(), result.getAttempt(), result.getCompletedAt());
        }
    }

    public static RunResponse fromEntity(ScheduledReportRun run) {
        Map<DeliveryMethod, ChannelResultDto> results = new EnumMap<>(DeliveryMethod.class);
        run.channelResultsView().forEach((method, result) -> results.put(method, ChannelResultDto.fromEntity(result)));

        return RunResponse.builder()
                .id(run.getId())
                .scheduleId(run.getScheduleId())
                .reportId(run.getReportId())
                .triggeredAt(run.getTriggeredAt())
                .manual(Boolean.TRUE.equals(run.getManual()))
                .status(run.getStatus())
                .attempt(run.getAttempt())
                .failureReason(run.getFailureReason())
                .artifactRef(run.getArtifactRef())
                .recordCount(run.getRecordCount())
                .completedAt(run.getCompletedAt())
                .channelResults(results)
                .build();
    }
}
