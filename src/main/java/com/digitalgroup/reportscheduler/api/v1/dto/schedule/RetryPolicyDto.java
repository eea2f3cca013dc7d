package com.digitalgroup.reportscheduler.api.v1.dto.schedule;

import com.digitalgroup.reportscheduler.domain.common.enums.Priority;
import com.digitalgroup.reportscheduler.domain.schedule.entity.RetryPolicy;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetryPolicyDto {

    private Boolean retryOnFailure;
    @Min(value = 0, message = "Max retries cannot be negative")
    private Integer maxRetries;

    @Min(value = 0, message = "Retry delay cannot be negative")
    private Integer retryDelaySeconds;

    @Min(value = 1, message = "Timeout must be at least one second")
    private Integer timeoutSeconds;
    private Priority priority;

    public RetryPolicy toEntity() {
        RetryPolicy policy = new RetryPolicy();
        if (retryOnFailure != null) {
            policy.setRetryOnFailure(retryOnFailure);
        }
        if (maxRetries != null) {
            policy.setMaxRetries(maxRetries);
        }
        if (retryDelaySeconds != null) {
            policy.setRetryDelaySeconds(retryDelaySeconds);
        }
        if (timeoutSeconds != null) {
            policy.setTimeoutSeconds(timeoutSeconds);
        }
        if (priority != null) {
            policy.setPriority(priority);
        }
        return policy;
    }

    public static RetryPolicyDto fromEntity(RetryPolicy policy) {
        if (policy == null) {
            return null;
        }
        return RetryPolicyDto.builder()
                .retryOnFailure(policy.isRetryOnFailure())
                .maxRetries(policy.getMaxRetries())
                .retryDelaySeconds(policy.getRetryDelaySeconds())
                .timeoutSeconds(policy.getTimeoutSeconds())
                .priority(policy.getPriority())
                .build();
    }
}
