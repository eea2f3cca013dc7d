package com.digitalgroup.reportscheduler.domain.schedule.entity;

import com.digitalgroup.reportscheduler.domain.common.enums.*;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.*;

/**
 * Where and how a rendered report is delivered.
 * Only the settings of the selected methods are required; the others are ignored.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryConfiguration {

    /**
     * Placeholder returned instead of stored secrets
     */
    public static final String MASKED_SECRET = "********";

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "report_schedule_delivery_methods",
            joinColumns = @JoinColumn(name = "schedule_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false)
    @Builder.Default
    private Set<DeliveryMethod> methods = EnumSet.noneOf(DeliveryMethod.class);

    @Enumerated(EnumType.STRING)
    @Column(name = "report_format")
    @Builder.Default
    private ReportFormat format = ReportFormat.PDF;

    // ==================== EMAIL ====================

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "email_recipients")
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    @Column(name = "email_subject")
    private String emailSubject;

    @Column(name = "email_body", columnDefinition = "text")
    private String emailBody;

    @Column(name = "include_link")
    @Builder.Default
    private Boolean includeLink = false;

    @Column(name = "link_expiry_days")
    @Builder.Default
    private Integer linkExpiryDays = 7;

    @Column(name = "artifact_password")
    private String password;

    // ==================== CLOUD STORAGE ====================

    @Enumerated(EnumType.STRING)
    @Column(name = "cloud_provider")
    private CloudProvider cloudProvider;

    @Column(name = "cloud_path")
    private String cloudPath;

    // ==================== FTP / FTPS / SFTP ====================

    @Enumerated(EnumType.STRING)
    @Column(name = "ftp_protocol")
    @Builder.Default
    private FileTransferProtocol ftpProtocol = FileTransferProtocol.FTP;

    @Column(name = "ftp_host")
    private String ftpHost;

    @Column(name = "ftp_port")
    private Integer ftpPort;

    @Column(name = "ftp_username")
    private String ftpUsername;

    @Column(name = "ftp_password")
    private String ftpPassword;

    @Column(name = "ftp_path")
    @Builder.Default
    private String ftpPath = "/";

    // ==================== WEBHOOK ====================

    @Column(name = "webhook_url", length = 2048)
    private String webhookUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "webhook_method")
    @Builder.Default
    private WebhookMethod webhookMethod = WebhookMethod.POST;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "webhook_headers")
    @Builder.Default
    private Map<String, String> webhookHeaders = new HashMap<>();

    @Column(name = "webhook_include_content")
    @Builder.Default
    private Boolean webhookIncludeContent = false;

    // ==================== DATABASE ====================

    @Column(name = "database_connection")
    private String databaseConnection;

    @Column(name = "database_table")
    private String databaseTable;

    // ==================== CONDITIONS ====================

    @Column(name = "min_records")
    private Integer minRecords;

    @Column(name = "max_records")
    private Integer maxRecords;

    /**
     * Keep the stored secrets wherever the incoming configuration carries the mask.
     */
    public void retainSecretsFrom(DeliveryConfiguration stored) {
        if (stored == null) {
            return;
        }
        if (MASKED_SECRET.equals(password)) {
            password = stored.getPassword();
        }
        if (MASKED_SECRET.equals(ftpPassword)) {
            ftpPassword = stored.getFtpPassword();
        }
        if (webhookHeaders != null && stored.getWebhookHeaders() != null) {
            webhookHeaders.replaceAll((name, value) ->
                    MASKED_SECRET.equals(value) ? stored.getWebhookHeaders().getOrDefault(name, value) : value);
        }
    }

    public boolean hasMethod(DeliveryMethod method) {
        return methods != null && methods.contains(method);
    }

    public int effectiveFtpPort() {
        if (ftpPort != null && ftpPort > 0) {
            return ftpPort;
        }
        return (ftpProtocol != null ? ftpProtocol : FileTransferProtocol.FTP).getDefaultPort();
    }

    /**
     * True when the record count satisfies the min/max delivery conditions.
     * An unknown count never blocks delivery.
     */
    public boolean acceptsRecordCount(Integer recordCount) {
        if (recordCount == null) {
            return true;
        }
        if (minRecords != null && recordCount < minRecords) {
            return false;
        }
        return maxRecords == null || recordCount <= maxRecords;
    }
}
