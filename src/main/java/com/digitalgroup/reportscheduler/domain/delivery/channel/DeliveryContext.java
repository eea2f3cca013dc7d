package com.digitalgroup.reportscheduler.domain.delivery.channel;

import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.util.TemplateUtils;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * What a channel needs besides the artifact: the schedule's delivery settings,
 * identifiers for receipts and logging, template variables, and the attempt deadline.
 */
@Value
@Builder
public class DeliveryContext {

    Long scheduleId;
    String scheduleName;
    Long reportId;
    Long runId;
    int attempt;
    DeliveryConfiguration settings;
    Map<String, String> variables;
    Instant deadline;
    Clock clock;

    /**
     * Time left before the attempt times out, never negative
     */
    public Duration remainingTimeout() {
        if (deadline == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public int remainingTimeoutMillis() {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(remainingTimeout().toMillis(), 1));
    }

    public String render(String template) {
        return TemplateUtils.render(template, variables);
    }
}
