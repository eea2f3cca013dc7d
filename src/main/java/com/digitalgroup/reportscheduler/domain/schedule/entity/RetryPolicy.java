package com.digitalgroup.reportscheduler.domain.schedule.entity;

import com.digitalgroup.reportscheduler.domain.common.enums.Priority;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetryPolicy {

    @Column(name = "retry_on_failure")
    @Builder.Default
    private boolean retryOnFailure = true;

    @Column(name = "max_retries")
    @Builder.Default
    private int maxRetries = 3;

    @Column(name = "retry_delay_seconds")
    @Builder.Default
    private int retryDelaySeconds = 300;

    @Column(name = "timeout_seconds")
    @Builder.Default
    private int timeoutSeconds = 1800;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority")
    @Builder.Default
    private Priority priority = Priority.NORMAL;

    /**
     * Number of attempts a run may make, the first one included.
     */
    public int maxAttempts() {
        return retryOnFailure ? (int) Math.min(Math.max(maxRetries, 0) + 1L, Integer.MAX_VALUE) : 1;
    }

    /**
     * Upper bound of a whole run: every attempt timing out plus the delays between them.
     */
    public Duration worstCaseDuration() {
        long attempts = maxAttempts();
        long seconds = attempts * Math.max(timeoutSeconds, 0)
                + (attempts - 1) * Math.max(retryDelaySeconds, 0);
        return Duration.ofSeconds(seconds);
    }
}
