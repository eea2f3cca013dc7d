package com.digitalgroup.reportscheduler.integration.storage;

import com.digitalgroup.reportscheduler.domain.common.enums.CloudProvider;
import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ChannelAdapter;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryContext;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Uploads the artifact to {@code cloudPath/fileName}; the cloud path may use
 * {{date}}, {{year}}, {{month}}... placeholders.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CloudStorageChannelAdapter implements ChannelAdapter {

    private final S3StorageService storageService;

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.CLOUD_STORAGE;
    }

    @Override
    public DeliveryReceipt deliver(ReportArtifact artifact, DeliveryContext context) throws DeliveryException {
        DeliveryConfiguration settings = context.getSettings();
        CloudProvider provider = settings.getCloudProvider();
        if (provider == null || !provider.isSupported()) {
            throw DeliveryException.permanentError("Cloud provider not supported: " + provider);
        }
        if (!storageService.isEnabled()) {
            throw DeliveryException.permanentError("Cloud storage is not configured");
        }

        String key = objectKey(context.render(settings.getCloudPath()), artifact.fileName());
        try {
            storageService.upload(artifact.content(), key, artifact.contentType());
            log.info("Run {} uploaded {} to s3://{}/{}", context.getRunId(), artifact.fileName(),
                    storageService.getBucketName(), key);
            return new DeliveryReceipt(method(), "s3://" + storageService.getBucketName() + "/" + key);
        } catch (S3Exception e) {
            throw classify(e);
        } catch (SdkClientException e) {
            throw DeliveryException.transientError("S3 unreachable: " + e.getMessage(), e);
        } catch (SdkException e) {
            throw DeliveryException.transientError("S3 upload failed: " + e.getMessage(), e);
        }
    }

    static String objectKey(String path, String fileName) {
        String prefix = path == null ? "" : path.trim();
        while (prefix.startsWith("/")) {
            prefix = prefix.substring(1);
        }
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix.isEmpty() ? fileName : prefix + "/" + fileName;
    }

    private DeliveryException classify(S3Exception e) {
        int status = e.statusCode();
        String message = "S3 returned " + status + ": " + e.getMessage();
        if (status == 403 || status == 404 || status == 400) {
            return DeliveryException.permanentError(message, e);
        }
        return DeliveryException.transientError(message, e);
    }
}
