package com.digitalgroup.reportscheduler.integration.email;

import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.util.List;

/**
 * Email Service
 * Report deliveries (synchronous, the caller needs the outcome) and
 * run notifications (asynchronous, best effort).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailService {

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;

    @Value("${app.mail.from:reports@localhost}")
    private String fromEmail;

    @Value("${app.mail.from-name:Report Scheduler}")
    private String fromName;

    @Value("${app.mail.max-attachment-mb:10}")
    private int maxAttachmentMb;

    /**
     * Send a rendered report. Either attaches the artifact or links to it.
     * @return the Message-ID of the sent message
     */
    public String sendReport(List<String> to, String subject, String body, String scheduleName,
                             ReportArtifact attachment, String downloadUrl)
            throws MessagingException, UnsupportedEncodingException {
        Context context = new Context();
        context.setVariable("body", body);
        context.setVariable("scheduleName", scheduleName);
        context.setVariable("downloadUrl", downloadUrl);
        context.setVariable("fileName", attachment != null ? attachment.fileName() : null);

        String htmlContent = templateEngine.process("email/report-delivery", context);

        MimeMessage message = createHtmlMessage(to, subject, htmlContent, attachment);
        mailSender.send(message);

        log.info("Report email '{}' sent to {} recipient(s)", subject, to.size());
        return message.getMessageID();
    }

    /**
     * Send run outcome notification
     */
    @Async
    public void sendRunNotification(List<String> to, ScheduledReportRun run, ReportSchedule schedule,
                                    ReportArtifact preview) {
        try {
            boolean succeeded = run.getStatus() == RunStatus.SUCCEEDED;

            Context context = new Context();
            context.setVariable("run", run);
            context.setVariable("schedule", schedule);
            context.setVariable("succeeded", succeeded);
            context.setVariable("channelResults", run.channelResultsView());

            String template = succeeded ? "email/run-succeeded" : "email/run-failed";
            String htmlContent = templateEngine.process(template, context);

            String subject = (succeeded ? "Report delivered: " : "Report delivery failed: ") + schedule.getName();
            ReportArtifact attachment = preview != null && fitsAttachmentLimit(preview) ? preview : null;

            mailSender.send(createHtmlMessage(to, subject, htmlContent, attachment));

            log.info("Run {} notification sent to {}", run.getId(), to);
        } catch (Exception e) {
            log.error("Failed to send run {} notification to {}: {}", run.getId(), to, e.getMessage());
        }
    }

    public boolean fitsAttachmentLimit(ReportArtifact artifact) {
        return artifact.size() <= (long) maxAttachmentMb * 1024 * 1024;
    }

    /**
     * Build HTML email, with optional attachment
     */
    private MimeMessage createHtmlMessage(List<String> to, String subject, String htmlContent,
                                          ReportArtifact attachment)
            throws MessagingException, UnsupportedEncodingException {
        MimeMessage message = mailSender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

        helper.setFrom(fromEmail, fromName);
        helper.setTo(to.toArray(new String[0]));
        helper.setSubject(subject);
        helper.setText(htmlContent, true);

        if (attachment != null) {
            helper.addAttachment(attachment.fileName(), new ByteArrayResource(attachment.content()),
                    attachment.contentType());
        }
        return message;
    }
}
