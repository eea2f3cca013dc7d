package com.digitalgroup.reportscheduler.integration.renderer;

import com.digitalgroup.reportscheduler.domain.common.enums.ReportFormat;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.delivery.render.RenderException;
import com.digitalgroup.reportscheduler.domain.delivery.render.RenderRequest;
import com.digitalgroup.reportscheduler.domain.delivery.render.ReportRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Report Renderer Client
 * Asks the reporting service to render a report and returns the bytes as an artifact.
 * The service answers with the file as body plus X-Artifact-Ref / X-Record-Count headers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportRendererClient implements ReportRenderer {

    static final String HEADER_ARTIFACT_REF = "X-Artifact-Ref";
    static final String HEADER_RECORD_COUNT = "X-Record-Count";

    private final WebClient.Builder webClientBuilder;

    @Value("${app.renderer.base-url:http://localhost:8081}")
    private String baseUrl;

    @Value("${app.renderer.timeout-seconds:600}")
    private long timeoutSeconds;

    @Override
    public ReportArtifact render(RenderRequest request) throws RenderException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("format", request.format().name());
        payload.put("scheduleId", request.scheduleId());
        payload.put("runId", request.runId());
        payload.put("attempt", request.attempt());
        if (request.password() != null && !request.password().isBlank()) {
            payload.put("password", request.password());
        }

        String url = String.format("%s/api/reports/%d/render", baseUrl, request.reportId());

        ResponseEntity<byte[]> response;
        try {
            response = webClientBuilder.build()
                    .post()
                    .uri(url)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(payload)
                    .retrieve()
                    .toEntity(byte[].class)
                    .block(Duration.ofSeconds(timeoutSeconds));
        } catch (WebClientResponseException e) {
            throw new RenderException("Renderer returned " + e.getStatusCode().value()
                    + " for report " + request.reportId(), e);
        } catch (RuntimeException e) {
            throw new RenderException("Renderer unavailable: " + e.getMessage(), e);
        }

        if (response == null || response.getBody() == null || response.getBody().length == 0) {
            throw new RenderException("Renderer returned an empty artifact for report " + request.reportId());
        }

        HttpHeaders headers = response.getHeaders();
        String artifactRef = headers.getFirst(HEADER_ARTIFACT_REF);
        if (artifactRef == null || artifactRef.isBlank()) {
            artifactRef = UUID.randomUUID().toString();
        }

        ReportArtifact artifact = new ReportArtifact(
                artifactRef,
                resolveFileName(headers, request),
                request.format(),
                response.getBody(),
                parseRecordCount(headers.getFirst(HEADER_RECORD_COUNT)));

        log.info("Rendered report {} as {} ({} bytes, {} records)",
                request.reportId(), request.format(), artifact.size(), artifact.recordCount());
        return artifact;
    }

    // ==================== HELPER METHODS ====================

    private String resolveFileName(HttpHeaders headers, RenderRequest request) {
        ContentDisposition disposition = headers.getContentDisposition();
        if (disposition.getFilename() != null && !disposition.getFilename().isBlank()) {
            return disposition.getFilename();
        }
        ReportFormat format = request.format();
        return "report_" + request.reportId() + "." + format.getExtension();
    }

    private Integer parseRecordCount(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {} header: {}", HEADER_RECORD_COUNT, value);
            return null;
        }
    }
}
