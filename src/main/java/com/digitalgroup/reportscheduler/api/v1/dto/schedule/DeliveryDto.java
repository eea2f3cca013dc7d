package com.digitalgroup.reportscheduler.api.v1.dto.schedule;

import com.digitalgroup.reportscheduler.domain.common.enums.*;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

/**
 * Delivery settings as exchanged over the API. Secrets are masked on the way out;
 * sending the mask back on update keeps the stored value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryDto {

    private Set<DeliveryMethod> methods;
    private ReportFormat format;

    private List<String> recipients;
    private String emailSubject;
    private String emailBody;
    private Boolean includeLink;
    @Min(value = 1, message = "Link expiry must be at least one day")
    private Integer linkExpiryDays;
    private String password;

    private CloudProvider cloudProvider;
    private String cloudPath;

    private FileTransferProtocol ftpProtocol;
    private String ftpHost;
    @Min(value = 1, message = "FTP port must be between 1 and 65535")
    @Max(value = 65535, message = "FTP port must be between 1 and 65535")
    private Integer ftpPort;
    private String ftpUsername;
    private String ftpPassword;
    private String ftpPath;

    private String webhookUrl;
    private WebhookMethod webhookMethod;
    private Map<String, String> webhookHeaders;
    private Boolean webhookIncludeContent;

    private String databaseConnection;
    private String databaseTable;

    @Min(value = 0, message = "Minimum records cannot be negative")
    private Integer minRecords;
    private Integer maxRecords;

    public DeliveryConfiguration toEntity() {
        DeliveryConfiguration config = new DeliveryConfiguration();
        config.setMethods(methods == null || methods.isEmpty()
                ? EnumSet.noneOf(DeliveryMethod.class) : EnumSet.copyOf(methods));
        if (format != null) {
            config.setFormat(format);
        }
        config.setRecipients(recipients != null ? new ArrayList<>(recipients) : new ArrayList<>());
        config.setEmailSubject(emailSubject);
        config.setEmailBody(emailBody);
        if (includeLink != null) {
            config.setIncludeLink(includeLink);
        }
        if (linkExpiryDays != null) {
            config.setLinkExpiryDays(linkExpiryDays);
        }
        config.setPassword(password);
        config.setCloudProvider(cloudProvider);
        config.setCloudPath(cloudPath);
        if (ftpProtocol != null) {
            config.setFtpProtocol(ftpProtocol);
        }
        config.setFtpHost(ftpHost);
        config.setFtpPort(ftpPort);
        config.setFtpUsername(ftpUsername);
        config.setFtpPassword(ftpPassword);
        if (ftpPath != null) {
            config.setFtpPath(ftpPath);
        }
        config.setWebhookUrl(webhookUrl);
        if (webhookMethod != null) {
            config.setWebhookMethod(webhookMethod);
        }
        config.setWebhookHeaders(webhookHeaders != null ? new HashMap<>(webhookHeaders) : new HashMap<>());
        if (webhookIncludeContent != null) {
            config.setWebhookIncludeContent(webhookIncludeContent);
        }
        config.setDatabaseConnection(databaseConnection);
        config.setDatabaseTable(databaseTable);
        config.setMinRecords(minRecords);
        config.setMaxRecords(maxRecords);
        return config;
    }

    public static DeliveryDto fromEntity(DeliveryConfiguration config) {
        if (config == null) {
            return null;
        }
        return DeliveryDto.builder()
                .methods(config.getMethods() != null ? new TreeSet<>(config.getMethods()) : Set.of())
                .format(config.getFormat())
                .recipients(config.getRecipients())
                .emailSubject(config.getEmailSubject())
                .emailBody(config.getEmailBody())
                .includeLink(config.getIncludeLink())
                .linkExpiryDays(config.getLinkExpiryDays())
                .password(mask(config.getPassword()))
                .cloudProvider(config.getCloudProvider())
                .cloudPath(config.getCloudPath())
                .ftpProtocol(config.getFtpProtocol())
                .ftpHost(config.getFtpHost())
                .ftpPort(config.getFtpPort())
                .ftpUsername(config.getFtpUsername())
                .ftpPassword(mask(config.getFtpPassword()))
                .ftpPath(config.getFtpPath())
                .webhookUrl(config.getWebhookUrl())
                .webhookMethod(config.getWebhookMethod())
                .webhookHeaders(maskHeaders(config.getWebhookHeaders()))
                .webhookIncludeContent(config.getWebhookIncludeContent())
                .databaseConnection(config.getDatabaseConnection())
                .databaseTable(config.getDatabaseTable())
                .minRecords(config.getMinRecords())
                .maxRecords(config.getMaxRecords())
                .build();
    }

    private static String mask(String secret) {
        return secret == null || secret.isEmpty() ? null : DeliveryConfiguration.MASKED_SECRET;
    }

    // header values often carry tokens
    private static Map<String, String> maskHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> masked = new TreeMap<>();
        headers.keySet().forEach(name -> masked.put(name, DeliveryConfiguration.MASKED_SECRET));
        return masked;
    }
}
