package com.digitalgroup.reportscheduler.integration.storage;

import com.digitalgroup.reportscheduler.domain.common.enums.CloudProvider;
import com.digitalgroup.reportscheduler.domain.common.enums.ReportFormat;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryContext;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CloudStorageChannelAdapterTest {

    private static final Instant NOW = Instant.parse("2024-03-11T09:00:10Z");

    @Mock
    private S3StorageService storageService;

    @InjectMocks
    private CloudStorageChannelAdapter adapter;

    private DeliveryConfiguration settings;
    private ReportArtifact artifact;

    @BeforeEach
    void setUp() {
        settings = DeliveryConfiguration.builder()
                .cloudProvider(CloudProvider.AWS_S3)
                .cloudPath("/reports/{{year}}/{{month}}/")
                .build();
        artifact = new ReportArtifact("a-1", "sales.xlsx", ReportFormat.EXCEL, new byte[]{1}, 3);
    }

    private DeliveryContext context() {
        return DeliveryContext.builder()
                .scheduleId(7L)
                .runId(100L)
                .attempt(1)
                .settings(settings)
                .variables(Map.of("year", "2024", "month", "03"))
                .deadline(NOW.plusSeconds(60))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    @Test
    void objectKey_TrimsSlashes() {
        assertEquals("reports/2024/sales.pdf", CloudStorageChannelAdapter.objectKey("/reports/2024/", "sales.pdf"));
        assertEquals("sales.pdf", CloudStorageChannelAdapter.objectKey("  ", "sales.pdf"));
        assertEquals("sales.pdf", CloudStorageChannelAdapter.objectKey(null, "sales.pdf"));
    }

    @Test
    void deliver_RendersPathAndUploads() throws Exception {
        when(storageService.isEnabled()).thenReturn(true);
        when(storageService.getBucketName()).thenReturn("acme-reports");

        DeliveryReceipt receipt = adapter.deliver(artifact, context());

        verify(storageService).upload(artifact.content(), "reports/2024/03/sales.xlsx", ReportFormat.EXCEL.getContentType());
        assertEquals("s3://acme-reports/reports/2024/03/sales.xlsx", receipt.reference());
    }

    @Test
    void deliver_UnsupportedProvider_FailsPermanently() {
        settings.setCloudProvider(CloudProvider.DROPBOX);

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver(artifact, context()));

        assertTrue(e.isPermanent());
        verifyNoInteractions(storageService);
    }

    @Test
    void deliver_AccessDenied_FailsPermanently() {
        when(storageService.isEnabled()).thenReturn(true);
        when(storageService.upload(any(), any(), any()))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver(artifact, context()));

        assertTrue(e.isPermanent());
    }

    @Test
    void deliver_ServerError_FailsTransiently() {
        when(storageService.isEnabled()).thenReturn(true);
        when(storageService.upload(any(), any(), any()))
                .thenThrow(S3Exception.builder().statusCode(503).message("Slow Down").build());

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver(artifact, context()));

        assertFalse(e.isPermanent());
    }
}
