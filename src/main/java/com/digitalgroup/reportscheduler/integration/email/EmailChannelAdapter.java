package com.digitalgroup.reportscheduler.integration.email;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ChannelAdapter;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryContext;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.integration.storage.S3StorageService;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.time.Duration;
import java.util.List;

/**
 * Emails the report to the configured recipients, as an attachment or as a
 * download link when {@code includeLink} is set (or the file is too large to attach).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailChannelAdapter implements ChannelAdapter {

    static final String DEFAULT_SUBJECT = "{{schedule}} - {{date}}";
    static final String DEFAULT_BODY = "Please find attached the scheduled report {{schedule}}.";

    private final EmailService emailService;
    private final S3StorageService storageService;

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.EMAIL;
    }

    @Override
    public DeliveryReceipt deliver(ReportArtifact artifact, DeliveryContext context) throws DeliveryException {
        DeliveryConfiguration settings = context.getSettings();
        List<String> recipients = settings.getRecipients();
        if (recipients == null || recipients.isEmpty()) {
            throw DeliveryException.permanentError("No email recipients configured");
        }

        String subject = context.render(blankToDefault(settings.getEmailSubject(), DEFAULT_SUBJECT));
        String body = context.render(blankToDefault(settings.getEmailBody(), DEFAULT_BODY));

        boolean wantsLink = Boolean.TRUE.equals(settings.getIncludeLink());
        boolean tooLarge = !emailService.fitsAttachmentLimit(artifact);
        String downloadUrl = null;
        ReportArtifact attachment = artifact;

        if (wantsLink || tooLarge) {
            if (storageService.isEnabled()) {
                downloadUrl = shareLink(artifact, settings);
                attachment = null;
            } else if (tooLarge) {
                throw DeliveryException.permanentError("Report too large to attach and cloud storage is not configured");
            } else {
                log.warn("Schedule {} asks for a download link but storage is disabled, attaching instead",
                        context.getScheduleId());
            }
        }

        try {
            String messageId = emailService.sendReport(recipients, subject, body,
                    context.getScheduleName(), attachment, downloadUrl);
            return new DeliveryReceipt(method(), messageId != null ? messageId : String.join(",", recipients));
        } catch (MessagingException | UnsupportedEncodingException e) {
            throw DeliveryException.permanentError("Invalid email message: " + e.getMessage(), e);
        } catch (MailException e) {
            throw classify(e);
        }
    }

    private String shareLink(ReportArtifact artifact, DeliveryConfiguration settings) throws DeliveryException {
        int days = settings.getLinkExpiryDays() != null && settings.getLinkExpiryDays() > 0
                ? settings.getLinkExpiryDays() : 7;
        try {
            return storageService.createShareLink(artifact.content(), artifact.fileName(),
                    artifact.contentType(), Duration.ofDays(days));
        } catch (RuntimeException e) {
            throw DeliveryException.transientError("Could not create download link: " + e.getMessage(), e);
        }
    }

    static DeliveryException classify(MailException e) {
        if (e instanceof MailAuthenticationException) {
            return DeliveryException.permanentError("SMTP authentication failed", e);
        }
        if (e instanceof MailParseException || e instanceof MailPreparationException) {
            return DeliveryException.permanentError("Invalid email message: " + e.getMessage(), e);
        }
        if (e instanceof MailSendException sendException) {
            for (Exception failure : sendException.getFailedMessages().values()) {
                if (failure instanceof SendFailedException sfe
                        && sfe.getInvalidAddresses() != null && sfe.getInvalidAddresses().length > 0) {
                    return DeliveryException.permanentError("Recipient rejected: " + sfe.getMessage(), e);
                }
            }
        }
        return DeliveryException.transientError("Email delivery failed: " + e.getMessage(), e);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
