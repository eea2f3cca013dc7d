package com.digitalgroup.reportscheduler.domain.schedule.service;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.RetryPolicy;
import com.digitalgroup.reportscheduler.util.CronUtils;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cross-field schedule validation.
 * Every rule runs independently so the caller gets all violations at once;
 * an empty result means the schedule can be activated.
 */
@Component
public class ScheduleValidator {

    /**
     * Plain or schema-qualified SQL identifier, nothing that needs quoting
     */
    public static final Pattern TABLE_IDENTIFIER =
            Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}(\\.[A-Za-z_][A-Za-z0-9_]{0,62})?$");

    static final int MAX_RETRIES = 10;
    static final int MAX_RETRY_DELAY_SECONDS = 3600;
    static final int MAX_TIMEOUT_SECONDS = 7200;

    public List<ValidationError> validate(ReportSchedule schedule) {
        return validate(schedule, schedule.getDelivery());
    }

    public List<ValidationError> validate(ReportSchedule schedule, DeliveryConfiguration delivery) {
        List<ValidationError> errors = new ArrayList<>();
        validateSchedule(schedule, errors);
        validateRetryPolicy(schedule.getRetryPolicy(), errors);
        validateDelivery(delivery, errors);
        return errors;
    }

    // ==================== SCHEDULE ====================

    private void validateSchedule(ReportSchedule schedule, List<ValidationError> errors) {
        if (schedule.getName() == null || schedule.getName().isBlank()) {
            errors.add(new ValidationError("name", "Schedule name is required"));
        }
        if (schedule.getReportId() == null) {
            errors.add(new ValidationError("reportId", "Report is required"));
        }
        if (schedule.getStartDate() == null) {
            errors.add(new ValidationError("startDate", "Start date is required"));
        }
        if (schedule.getEndDate() != null && schedule.getStartDate() != null
                && !schedule.getEndDate().isAfter(schedule.getStartDate())) {
            errors.add(new ValidationError("endDate", "End date must be after start date"));
        }
        if (!isValidZone(schedule.getTimezone())) {
            errors.add(new ValidationError("timezone", "Unknown timezone: " + schedule.getTimezone()));
        }

        Frequency frequency = schedule.getFrequency();
        if (frequency == null) {
            errors.add(new ValidationError("frequency", "Frequency is required"));
            return;
        }

        if (frequency == Frequency.CUSTOM) {
            String cron = schedule.getCustomCronExpression();
            if (cron == null || cron.isBlank()) {
                errors.add(new ValidationError("customCronExpression", "Cron expression is required"));
            } else {
                try {
                    CronUtils.parse(cron);
                } catch (IllegalArgumentException e) {
                    errors.add(new ValidationError("customCronExpression", "Invalid cron expression: " + e.getMessage()));
                }
            }
        }

        if (frequency == Frequency.WEEKLY) {
            Integer dow = schedule.getDayOfWeek();
            if (dow == null || dow < 0 || dow > 6) {
                errors.add(new ValidationError("dayOfWeek", "Day of week must be between 0 (Sunday) and 6 (Saturday)"));
            }
        }

        if (frequency.usesDayOfMonth()) {
            Integer dom = schedule.getDayOfMonth();
            if (dom == null || dom < 1 || dom > 31) {
                errors.add(new ValidationError("dayOfMonth", "Day of month must be between 1 and 31"));
            }
        }
    }

    private void validateRetryPolicy(RetryPolicy policy, List<ValidationError> errors) {
        if (policy == null) {
            return;
        }
        if (policy.getMaxRetries() < 0 || policy.getMaxRetries() > MAX_RETRIES) {
            errors.add(new ValidationError("retryPolicy.maxRetries",
                    "Max retries must be between 0 and " + MAX_RETRIES));
        }
        if (policy.getRetryDelaySeconds() < 0 || policy.getRetryDelaySeconds() > MAX_RETRY_DELAY_SECONDS) {
            errors.add(new ValidationError("retryPolicy.retryDelaySeconds",
                    "Retry delay must be between 0 and " + MAX_RETRY_DELAY_SECONDS + " seconds"));
        }
        if (policy.getTimeoutSeconds() <= 0 || policy.getTimeoutSeconds() > MAX_TIMEOUT_SECONDS) {
            errors.add(new ValidationError("retryPolicy.timeoutSeconds",
                    "Timeout must be between 1 and " + MAX_TIMEOUT_SECONDS + " seconds"));
        }
    }

    // ==================== DELIVERY ====================

    private void validateDelivery(DeliveryConfiguration delivery, List<ValidationError> errors) {
        if (delivery == null || delivery.getMethods() == null || delivery.getMethods().isEmpty()) {
            errors.add(new ValidationError("delivery.methods", "At least one delivery method is required"));
            return;
        }
        if (delivery.getFormat() == null) {
            errors.add(new ValidationError("delivery.format", "Report format is required"));
        }

        if (delivery.hasMethod(DeliveryMethod.EMAIL)) {
            validateEmail(delivery, errors);
        }
        if (delivery.hasMethod(DeliveryMethod.CLOUD_STORAGE)) {
            if (delivery.getCloudProvider() == null) {
                errors.add(new ValidationError("delivery.cloudProvider", "Cloud provider is required"));
            } else if (!delivery.getCloudProvider().isSupported()) {
                errors.add(new ValidationError("delivery.cloudProvider",
                        "Cloud provider not supported: " + delivery.getCloudProvider()));
            }
            if (isBlank(delivery.getCloudPath())) {
                errors.add(new ValidationError("delivery.cloudPath", "Cloud path is required"));
            }
        }
        if (delivery.hasMethod(DeliveryMethod.FTP)) {
            if (isBlank(delivery.getFtpHost())) {
                errors.add(new ValidationError("delivery.ftpHost", "FTP host is required"));
            }
            Integer port = delivery.getFtpPort();
            if (port != null && (port < 1 || port > 65535)) {
                errors.add(new ValidationError("delivery.ftpPort", "FTP port must be between 1 and 65535"));
            }
        }
        if (delivery.hasMethod(DeliveryMethod.WEBHOOK)) {
            if (isBlank(delivery.getWebhookUrl())) {
                errors.add(new ValidationError("delivery.webhookUrl", "Webhook URL is required"));
            } else if (!isValidHttpUrl(delivery.getWebhookUrl())) {
                errors.add(new ValidationError("delivery.webhookUrl", "Webhook URL must be a valid http(s) URL"));
            }
        }
        if (delivery.hasMethod(DeliveryMethod.DATABASE)) {
            if (isBlank(delivery.getDatabaseConnection())) {
                errors.add(new ValidationError("delivery.databaseConnection", "Database connection is required"));
            }
            if (isBlank(delivery.getDatabaseTable())) {
                errors.add(new ValidationError("delivery.databaseTable", "Database table is required"));
            } else if (!TABLE_IDENTIFIER.matcher(delivery.getDatabaseTable()).matches()) {
                errors.add(new ValidationError("delivery.databaseTable", "Database table must be a plain identifier"));
            }
        }

        if (delivery.getMinRecords() != null && delivery.getMinRecords() < 0) {
            errors.add(new ValidationError("delivery.minRecords", "Minimum records cannot be negative"));
        }
        if (delivery.getMinRecords() != null && delivery.getMaxRecords() != null
                && delivery.getMaxRecords() < delivery.getMinRecords()) {
            errors.add(new ValidationError("delivery.maxRecords", "Maximum records must not be below minimum records"));
        }
    }

    private void validateEmail(DeliveryConfiguration delivery, List<ValidationError> errors) {
        List<String> recipients = delivery.getRecipients();
        if (recipients == null || recipients.isEmpty()) {
            errors.add(new ValidationError("delivery.recipients", "At least one recipient is required for email delivery"));
        } else {
            for (int i = 0; i < recipients.size(); i++) {
                if (!isValidEmail(recipients.get(i))) {
                    errors.add(new ValidationError("delivery.recipients[" + i + "]",
                            "Invalid email address: " + recipients.get(i)));
                }
            }
        }
        if (Boolean.TRUE.equals(delivery.getIncludeLink())
                && (delivery.getLinkExpiryDays() == null || delivery.getLinkExpiryDays() < 1)) {
            errors.add(new ValidationError("delivery.linkExpiryDays", "Link expiry must be at least one day"));
        }
    }

    // ==================== HELPERS ====================

    static boolean isValidEmail(String address) {
        if (isBlank(address)) {
            return false;
        }
        try {
            new InternetAddress(address, true).validate();
            return address.contains("@");
        } catch (AddressException e) {
            return false;
        }
    }

    static boolean isValidHttpUrl(String url) {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isValidZone(String timezone) {
        if (isBlank(timezone)) {
            return false;
        }
        try {
            ZoneId.of(timezone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
