package com.digitalgroup.reportscheduler.integration.webhook;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.common.enums.WebhookMethod;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ChannelAdapter;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryContext;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook Channel
 * Sends run metadata as JSON to the configured URL, optionally with the
 * artifact base64-encoded in {@code content}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookChannelAdapter implements ChannelAdapter {

    private final WebClient.Builder webClientBuilder;

    @Value("${app.delivery.webhook.timeout-seconds:30}")
    private long timeoutSeconds;

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.WEBHOOK;
    }

    @Override
    public DeliveryReceipt deliver(ReportArtifact artifact, DeliveryContext context) throws DeliveryException {
        DeliveryConfiguration settings = context.getSettings();
        String url = settings.getWebhookUrl();
        if (url == null || url.isBlank()) {
            throw DeliveryException.permanentError("Webhook URL is not configured");
        }
        WebhookMethod verb = settings.getWebhookMethod() != null ? settings.getWebhookMethod() : WebhookMethod.POST;

        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        if (context.remainingTimeout().compareTo(timeout) < 0) {
            timeout = context.remainingTimeout();
        }

        try {
            ResponseEntity<Void> response = webClientBuilder.build()
                    .method(HttpMethod.valueOf(verb.name()))
                    .uri(url)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .headers(h -> {
                        if (settings.getWebhookHeaders() != null) {
                            settings.getWebhookHeaders().forEach(h::set);
                        }
                    })
                    .bodyValue(buildPayload(artifact, context))
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout.isZero() ? Duration.ofMillis(1) : timeout);

            int status = response != null ? response.getStatusCode().value() : 0;
            log.info("Webhook {} {} answered {} for run {}", verb, url, status, context.getRunId());
            return new DeliveryReceipt(method(), "HTTP " + status);

        } catch (WebClientResponseException e) {
            throw classify(e);
        } catch (WebClientRequestException e) {
            throw DeliveryException.transientError("Webhook unreachable: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block() timed out
            throw DeliveryException.transientError("Webhook did not answer in time", e);
        }
    }

    Map<String, Object> buildPayload(ReportArtifact artifact, DeliveryContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("schedule_id", context.getScheduleId());
        payload.put("schedule_name", context.getScheduleName());
        payload.put("report_id", context.getReportId());
        payload.put("run_id", context.getRunId());
        payload.put("attempt", context.getAttempt());
        payload.put("artifact_ref", artifact.artifactRef());
        payload.put("file_name", artifact.fileName());
        payload.put("format", artifact.format() != null ? artifact.format().name() : null);
        payload.put("content_type", artifact.contentType());
        payload.put("size", artifact.size());
        payload.put("record_count", artifact.recordCount());
        payload.put("timestamp", Instant.now(context.getClock()).toString());
        if (Boolean.TRUE.equals(context.getSettings().getWebhookIncludeContent()) && artifact.content() != null) {
            payload.put("content", Base64.getEncoder().encodeToString(artifact.content()));
        }
        return payload;
    }

    static DeliveryException classify(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String message = "Webhook returned " + status;
        // 408 and 429 are the endpoint asking to try again later
        if (e.getStatusCode().is4xxClientError() && status != 408 && status != 429) {
            return DeliveryException.permanentError(message, e);
        }
        return DeliveryException.transientError(message, e);
    }
}
